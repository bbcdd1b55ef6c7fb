package com.leaflog.service;

import com.leaflog.dto.IncomingTransaction;
import com.leaflog.log.LogNode;
import lombok.Getter;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Per-transaction state shared by the instructions of one transaction.
 *
 * claimedInvocations remembers which tree-program frames already supplied a
 * changelog, so two instructions in one transaction never share one.
 */
@Getter
public class TransactionContext {

    private final String transactionId;
    private final long slot;
    private final SequenceWindow window;
    private final List<LogNode> roots;
    private final Set<LogNode> claimedInvocations = Collections.newSetFromMap(new IdentityHashMap<>());

    public TransactionContext(String transactionId, long slot, SequenceWindow window, List<LogNode> roots) {
        this.transactionId = transactionId;
        this.slot = slot;
        this.window = window;
        this.roots = roots;
    }

    public static TransactionContext of(IncomingTransaction transaction, SequenceWindow window, List<LogNode> roots) {
        return new TransactionContext(transaction.getSignature(), transaction.getSlot(), window, roots);
    }

    public boolean claim(LogNode invocation) {
        return claimedInvocations.add(invocation);
    }

    public boolean isClaimed(LogNode invocation) {
        return claimedInvocations.contains(invocation);
    }
}
