package com.leaflog.log;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class LogLine implements LogEntry {

    private final LogToken token;

    @Override
    public boolean isNode() {
        return false;
    }

    public LogToken.Type getType() {
        return token.getType();
    }

    public String getText() {
        return token.getRaw();
    }

    @Override
    public String toString() {
        return token.getRaw();
    }
}
