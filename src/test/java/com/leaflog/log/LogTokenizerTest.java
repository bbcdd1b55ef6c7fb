package com.leaflog.log;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.leaflog.support.LogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LogTokenizerTest {

    private final LogTokenizer tokenizer = new LogTokenizer();

    @Test
    @DisplayName("invoke line carries program id and depth")
    void invokeLine() {
        LogToken token = tokenizer.tokenize(invoke(TREE, 2));

        assertEquals(LogToken.Type.INVOKE, token.getType());
        assertEquals(TREE, token.getProgramId());
        assertEquals(2, token.getDepth());
    }

    @Test
    @DisplayName("success line carries program id")
    void successLine() {
        LogToken token = tokenizer.tokenize(success(TOKEN));

        assertEquals(LogToken.Type.SUCCESS, token.getType());
        assertEquals(TOKEN, token.getProgramId());
    }

    @Test
    @DisplayName("failed line is plain text, not a success")
    void failedIsPlain() {
        LogToken token = tokenizer.tokenize("Program " + TOKEN + " failed: custom program error: 0x1");

        assertEquals(LogToken.Type.PLAIN, token.getType());
    }

    @Test
    @DisplayName("program id with non-base58 characters is plain text")
    void invalidProgramId() {
        LogToken token = tokenizer.tokenize("Program 0OIl invoke [1]");

        assertEquals(LogToken.Type.PLAIN, token.getType());
    }

    @Test
    @DisplayName("instruction line yields the instruction name")
    void instructionName() {
        LogToken token = tokenizer.tokenize(instruction("CancelRedeem"));

        assertEquals(LogToken.Type.INSTRUCTION, token.getType());
        assertEquals("CancelRedeem", token.getValue());
    }

    @Test
    @DisplayName("data line keeps the trailing base64 payload, padding included")
    void dataPayload() {
        LogToken token = tokenizer.tokenize("Program data: AAECAw==");

        assertEquals(LogToken.Type.DATA, token.getType());
        assertEquals("AAECAw==", token.getValue());
    }

    @Test
    @DisplayName("other program log output is plain text")
    void otherLogIsPlain() {
        LogToken token = tokenizer.tokenize("Program log: transferring 5 lamports");

        assertEquals(LogToken.Type.PLAIN, token.getType());
        assertEquals("Program log: transferring 5 lamports", token.getRaw());
    }

    @Test
    @DisplayName("compute-unit lines are plain text")
    void consumedIsPlain() {
        assertEquals(LogToken.Type.PLAIN, tokenizer.tokenize(consumed(TREE)).getType());
    }

    @Test
    @DisplayName("truncation marker is its own token type")
    void marker() {
        assertEquals(LogToken.Type.TRUNCATED, tokenizer.tokenize("Log truncated").getType());
    }

    @Test
    @DisplayName("a marker anywhere in the array marks the capture truncated")
    void anywhere() {
        List<LogToken> tokens = tokenizer.tokenizeAll(List.of(
                invoke(TOKEN, 1),
                "Log truncated",
                instruction("Transfer")));

        assertTrue(LogTokenizer.isTruncated(tokens));
    }

    @Test
    @DisplayName("complete capture is not truncated")
    void complete() {
        List<LogToken> tokens = tokenizer.tokenizeAll(List.of(
                invoke(TOKEN, 1), instruction("Transfer"), success(TOKEN)));

        assertFalse(LogTokenizer.isTruncated(tokens));
    }
}
