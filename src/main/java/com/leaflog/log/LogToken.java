package com.leaflog.log;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One classified log line.
 *
 * Only the fields relevant to the token's type are set:
 *   INVOKE      → programId, depth
 *   SUCCESS     → programId
 *   INSTRUCTION → value (the instruction name)
 *   DATA        → value (the base64 payload)
 *   PLAIN       → nothing beyond the raw text
 *   TRUNCATED   → nothing beyond the raw text
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LogToken {

    public enum Type {
        INVOKE,
        SUCCESS,
        INSTRUCTION,
        DATA,
        PLAIN,
        TRUNCATED
    }

    private final Type type;
    private final String raw;
    private final String programId;
    private final int depth;
    private final String value;

    public static LogToken invoke(String raw, String programId, int depth) {
        return new LogToken(Type.INVOKE, raw, programId, depth, null);
    }

    public static LogToken success(String raw, String programId) {
        return new LogToken(Type.SUCCESS, raw, programId, 0, null);
    }

    public static LogToken instruction(String raw, String name) {
        return new LogToken(Type.INSTRUCTION, raw, null, 0, name);
    }

    public static LogToken data(String raw, String base64) {
        return new LogToken(Type.DATA, raw, null, 0, base64);
    }

    public static LogToken plain(String raw) {
        return new LogToken(Type.PLAIN, raw, null, 0, null);
    }

    public static LogToken truncated(String raw) {
        return new LogToken(Type.TRUNCATED, raw, null, 0, null);
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + raw + ")";
    }
}
