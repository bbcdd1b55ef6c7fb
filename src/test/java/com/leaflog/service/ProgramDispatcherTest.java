package com.leaflog.service;

import com.leaflog.log.LogNode;
import com.leaflog.log.LogTokenizer;
import com.leaflog.log.LogTreeParser;
import com.leaflog.model.InstructionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.leaflog.support.LogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ProgramDispatcherTest {

    private final ProgramDispatcher dispatcher = new ProgramDispatcher(registry());
    private final LogTokenizer tokenizer = new LogTokenizer();
    private final LogTreeParser parser = new LogTreeParser();

    private List<LogNode> parse(String... lines) {
        return parser.parse(tokenizer.tokenizeAll(List.of(lines)));
    }

    @Test
    @DisplayName("top-level token-program invocation is classified by its instruction line")
    void topLevel() {
        List<MatchedInstruction> matches = dispatcher.dispatch(parse(
                invoke(TOKEN, 1), instruction("CreateTree"), success(TOKEN)));

        assertEquals(1, matches.size());
        assertEquals(InstructionKind.CREATE_TREE, matches.get(0).getKind());
    }

    @Test
    @DisplayName("token program reached by CPI from an unrelated program is found")
    void viaCpi() {
        List<MatchedInstruction> matches = dispatcher.dispatch(parse(
                invoke(OUTER, 1),
                invoke(TOKEN, 2), instruction("Transfer"), success(TOKEN),
                success(OUTER)));

        assertEquals(1, matches.size());
        assertEquals(InstructionKind.TRANSFER, matches.get(0).getKind());
        assertEquals(1, matches.get(0).getNode().getDepth());
    }

    @Test
    @DisplayName("several instructions come back in log order")
    void logOrder() {
        List<MatchedInstruction> matches = dispatcher.dispatch(parse(
                invoke(TOKEN, 1), instruction("MintV1"), success(TOKEN),
                invoke(OUTER, 1),
                invoke(TOKEN, 2), instruction("Redeem"), success(TOKEN),
                success(OUTER),
                invoke(TOKEN, 1), instruction("DecompressV1"), success(TOKEN)));

        assertEquals(List.of(InstructionKind.MINT, InstructionKind.REDEEM, InstructionKind.DECOMPRESS),
                matches.stream().map(MatchedInstruction::getKind).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("unknown or missing instruction name is a no-op")
    void unknownName() {
        List<MatchedInstruction> matches = dispatcher.dispatch(parse(
                invoke(TOKEN, 1), instruction("SetTreeDelegate"), success(TOKEN),
                invoke(TOKEN, 1), "Program log: no header", success(TOKEN)));

        assertTrue(matches.isEmpty());
    }

    @Test
    @DisplayName("tree-program invocations alone produce no instructions")
    void treeOnly() {
        assertTrue(dispatcher.dispatch(parse(
                invoke(TREE, 1), instruction("Append"), success(TREE))).isEmpty());
    }
}
