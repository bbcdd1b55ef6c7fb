package com.leaflog.service;

import com.leaflog.event.ChangeLogEvent;
import com.leaflog.event.ProgramRegistry;
import com.leaflog.event.ProgramRole;
import com.leaflog.log.LogLine;
import com.leaflog.log.LogNode;
import com.leaflog.log.LogToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Locates the tree program's changelog for one token-program instruction.
 *
 * HOW IT WORKS:
 *   1. Candidates are tree-program invocations inside the instruction's own
 *      subtree first, then anywhere else in the transaction
 *   2. Administrative tree instructions and frames already claimed by an
 *      earlier instruction of the same transaction are passed over
 *   3. In a candidate frame the changelog is expected on the second-to-last
 *      line; otherwise the last data line that decodes as one is taken
 *   4. As a last resort, a changelog logged in the instruction's own frame
 *
 * The winning frame is claimed on the transaction context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChangelogExtractor {

    static final Set<String> ADMIN_INSTRUCTIONS = Set.of("TransferAuthority", "VerifyLeaf");

    private final ProgramRegistry programRegistry;

    public Optional<ChangeLogEvent> extract(MatchedInstruction instruction, TransactionContext context) {
        String treeProgramId = programRegistry.programId(ProgramRole.TREE);

        Set<LogNode> candidates = new LinkedHashSet<>(instruction.getNode().findInvocations(treeProgramId));
        for (LogNode root : context.getRoots()) {
            candidates.addAll(root.findInvocations(treeProgramId));
        }

        for (LogNode invocation : candidates) {
            if (context.isClaimed(invocation) || isAdministrative(invocation)) {
                continue;
            }
            Optional<ChangeLogEvent> changelog = fromInvocation(invocation);
            if (changelog.isPresent()) {
                context.claim(invocation);
                return changelog;
            }
        }

        // Same frame as the instruction, e.g. both programs deployed under one id
        if (!context.isClaimed(instruction.getNode())) {
            Optional<ChangeLogEvent> own = lastChangelog(instruction.getNode().lines());
            if (own.isPresent()) {
                context.claim(instruction.getNode());
                return own;
            }
        }
        return Optional.empty();
    }

    private boolean isAdministrative(LogNode invocation) {
        return invocation.instructionName()
                .map(ADMIN_INSTRUCTIONS::contains)
                .orElse(false);
    }

    private Optional<ChangeLogEvent> fromInvocation(LogNode invocation) {
        List<LogLine> lines = invocation.lines();
        if (lines.size() >= 2) {
            Optional<ChangeLogEvent> expected = decode(lines.get(lines.size() - 2));
            if (expected.isPresent()) {
                return expected;
            }
        }
        return lastChangelog(lines);
    }

    private Optional<ChangeLogEvent> lastChangelog(List<LogLine> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            Optional<ChangeLogEvent> changelog = decode(lines.get(i));
            if (changelog.isPresent()) {
                return changelog;
            }
        }
        return Optional.empty();
    }

    private Optional<ChangeLogEvent> decode(LogLine line) {
        if (!line.getToken().is(LogToken.Type.DATA)) {
            return Optional.empty();
        }
        return programRegistry.decodeEvent(ProgramRole.TREE, line.getToken().getValue())
                .filter(event -> event.isA(ChangeLogEvent.class))
                .map(event -> event.dataAs(ChangeLogEvent.class));
    }
}
