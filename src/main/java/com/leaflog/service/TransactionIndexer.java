package com.leaflog.service;

import com.leaflog.dto.IncomingTransaction;
import com.leaflog.event.ChangeLogEvent;
import com.leaflog.event.DecodedEvent;
import com.leaflog.event.ProgramRegistry;
import com.leaflog.event.ProgramRole;
import com.leaflog.event.UnsupportedSchemaVersionException;
import com.leaflog.log.LogLine;
import com.leaflog.log.LogNode;
import com.leaflog.log.LogParseException;
import com.leaflog.log.LogToken;
import com.leaflog.log.LogTokenizer;
import com.leaflog.log.LogTreeParser;
import com.leaflog.model.IndexStatus;
import com.leaflog.repository.IndexBatch;
import com.leaflog.repository.IndexStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconciles one transaction's logs into indexed state.
 *
 * FLOW (atomic):
 *   1. err flag set?          → TRANSACTION_ERROR, logs never parsed
 *   2. truncation marker?     → LOG_TRUNCATED, zero storage calls
 *   3. empty seq window?      → SUCCESS, nothing could be written
 *   4. parse the log tree     (LogParseException propagates, nothing written)
 *   5. dispatch token-program instructions, in log order
 *   6. per instruction: extract changelog, decode own events, run handler
 *   7. commit every buffered write in one IndexStore.applyBatch()
 *
 * Anomalies inside one instruction (missing changelog, wrong event count,
 * unsupported schema version) drop that instruction only; siblings still index.
 *
 * The best-effort entry point runs the same steps but commits each
 * instruction on its own and only logs failures. It reports the same
 * statuses, so callers can still re-fetch truncated logs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionIndexer {

    private final LogTokenizer tokenizer;
    private final LogTreeParser parser;
    private final ProgramDispatcher dispatcher;
    private final ChangelogExtractor changelogExtractor;
    private final InstructionHandler instructionHandler;
    private final ProgramRegistry programRegistry;
    private final IndexStore indexStore;

    public IndexStatus indexAtomic(IncomingTransaction transaction) {
        String signature = transaction.getSignature();

        if (transaction.failed()) {
            log.info("Transaction {} failed on-chain, skipping", signature);
            return IndexStatus.TRANSACTION_ERROR;
        }

        List<LogToken> tokens = tokenizer.tokenizeAll(transaction.getLogs());
        if (LogTokenizer.isTruncated(tokens)) {
            log.info("Transaction {} has truncated logs, needs re-fetch", signature);
            return IndexStatus.LOG_TRUNCATED;
        }

        SequenceWindow window = SequenceWindow.of(transaction.getStartSeq(), transaction.getEndSeq());
        if (window.isEmpty()) {
            log.warn("Transaction {} has an empty seq window {}, nothing to write", signature, window);
            return IndexStatus.SUCCESS;
        }

        List<LogNode> roots;
        try {
            roots = parser.parse(tokens);
        } catch (LogParseException e) {
            log.error("Malformed logs in transaction {} at line {}: {}",
                    signature, e.getLineIndex(), e.getMessage());
            throw e;
        }

        TransactionContext context = TransactionContext.of(transaction, window, roots);
        IndexBatch batch = new IndexBatch();
        for (MatchedInstruction instruction : dispatcher.dispatch(roots)) {
            batch.merge(indexInstruction(instruction, context));
        }

        if (!batch.isEmpty()) {
            indexStore.applyBatch(batch);
        }
        log.info("Indexed transaction {}: slot={}, writes={}", signature, transaction.getSlot(), batch.size());
        return IndexStatus.SUCCESS;
    }

    public IndexStatus indexBestEffort(IncomingTransaction transaction) {
        String signature = transaction.getSignature();
        if (transaction.failed()) {
            log.info("Transaction {} failed on-chain, skipping", signature);
            return IndexStatus.TRANSACTION_ERROR;
        }

        List<LogToken> tokens = tokenizer.tokenizeAll(transaction.getLogs());
        if (LogTokenizer.isTruncated(tokens)) {
            log.warn("Transaction {} has truncated logs, needs re-fetch", signature);
            return IndexStatus.LOG_TRUNCATED;
        }

        SequenceWindow window = SequenceWindow.of(transaction.getStartSeq(), transaction.getEndSeq());
        if (window.isEmpty()) {
            log.warn("Transaction {} has an empty seq window {}, nothing to write", signature, window);
            return IndexStatus.SUCCESS;
        }

        List<LogNode> roots;
        try {
            roots = parser.parse(tokens);
        } catch (LogParseException e) {
            log.error("Malformed logs in transaction {} at line {}: {}",
                    signature, e.getLineIndex(), e.getMessage());
            return IndexStatus.SUCCESS;
        }

        TransactionContext context = TransactionContext.of(transaction, window, roots);
        for (MatchedInstruction instruction : dispatcher.dispatch(roots)) {
            IndexBatch batch = indexInstruction(instruction, context);
            if (batch.isEmpty()) {
                continue;
            }
            try {
                indexStore.applyBatch(batch);
            } catch (RuntimeException e) {
                log.error("Failed to store {} from transaction {}: {}",
                        instruction.getKind(), signature, e.getMessage(), e);
            }
        }
        return IndexStatus.SUCCESS;
    }

    private IndexBatch indexInstruction(MatchedInstruction instruction, TransactionContext context) {
        try {
            ChangeLogEvent changelog = null;
            if (instruction.getKind().requiresChangelog()) {
                changelog = changelogExtractor.extract(instruction, context).orElse(null);
            }
            return instructionHandler.handle(instruction, changelog, domainEvents(instruction.getNode()), context);
        } catch (UnsupportedSchemaVersionException e) {
            log.error("Skipping {} in transaction {}: {}",
                    instruction.getKind(), context.getTransactionId(), e.getMessage());
            return new IndexBatch();
        }
    }

    // Events logged by the token program in its own frame, in log order
    private List<DecodedEvent> domainEvents(LogNode node) {
        List<DecodedEvent> events = new ArrayList<>();
        for (LogLine line : node.lines()) {
            if (!line.getToken().is(LogToken.Type.DATA)) {
                continue;
            }
            Optional<DecodedEvent> event = programRegistry.decodeEvent(ProgramRole.TOKEN, line.getToken().getValue());
            event.ifPresent(events::add);
        }
        return events;
    }
}
