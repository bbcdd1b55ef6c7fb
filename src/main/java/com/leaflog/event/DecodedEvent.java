package com.leaflog.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * An event decoded from a "Program data:" line: the schema name plus the typed body.
 */
@Getter
@RequiredArgsConstructor
public class DecodedEvent {

    private final String name;
    private final Object data;

    public boolean isA(Class<?> type) {
        return type.isInstance(data);
    }

    public <T> T dataAs(Class<T> type) {
        return type.cast(data);
    }

    @Override
    public String toString() {
        return "DecodedEvent{" + name + "}";
    }
}
