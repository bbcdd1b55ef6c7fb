package com.leaflog.log;

/**
 * Structural violation in a transaction's logs. The whole parse is abandoned;
 * no partial tree is returned.
 */
public class LogParseException extends RuntimeException {

    private final int lineIndex;

    public LogParseException(String message, int lineIndex) {
        super(message + " (line " + lineIndex + ")");
        this.lineIndex = lineIndex;
    }

    public int getLineIndex() {
        return lineIndex;
    }
}
