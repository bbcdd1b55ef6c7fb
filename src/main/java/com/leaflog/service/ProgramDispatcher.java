package com.leaflog.service;

import com.leaflog.event.ProgramRegistry;
import com.leaflog.event.ProgramRole;
import com.leaflog.log.LogNode;
import com.leaflog.model.InstructionKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds token-program invocations in a parsed transaction and classifies them.
 *
 * FLOW:
 *   top-level nodes → depth-first walk
 *                        ↓
 *          node.programId == token program?
 *       ┌─── YES ───────┴────── NO ───┐
 *       ↓                              ↓
 *   read "Instruction: <Name>"     recurse into its child nodes
 *   map to InstructionKind         (the token program may be a CPI
 *   UNKNOWN / absent → warn, skip   from an unrelated outer program)
 *
 * Matches come back in log order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProgramDispatcher {

    private final ProgramRegistry programRegistry;

    public List<MatchedInstruction> dispatch(List<LogNode> roots) {
        String tokenProgramId = programRegistry.programId(ProgramRole.TOKEN);
        List<MatchedInstruction> matches = new ArrayList<>();
        for (LogNode root : roots) {
            walk(root, tokenProgramId, matches);
        }
        return matches;
    }

    private void walk(LogNode node, String tokenProgramId, List<MatchedInstruction> matches) {
        if (!node.getProgramId().equals(tokenProgramId)) {
            for (LogNode child : node.childNodes()) {
                walk(child, tokenProgramId, matches);
            }
            return;
        }

        Optional<String> name = node.instructionName();
        InstructionKind kind = InstructionKind.fromLogName(name.orElse(null));
        if (kind == InstructionKind.UNKNOWN) {
            log.warn("Unrecognized token-program instruction '{}' at depth {}, skipping",
                    name.orElse("<none>"), node.getDepth());
            return;
        }
        matches.add(new MatchedInstruction(node, kind));
    }
}
