package com.leaflog.service;

import com.leaflog.log.LogNode;
import com.leaflog.model.InstructionKind;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A token-program invocation paired with its classified instruction kind.
 */
@Getter
@RequiredArgsConstructor
public class MatchedInstruction {

    private final LogNode node;
    private final InstructionKind kind;

    @Override
    public String toString() {
        return kind + "@depth" + node.getDepth();
    }
}
