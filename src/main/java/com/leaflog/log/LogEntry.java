package com.leaflog.log;

/**
 * A child of a {@link LogNode}: either a single line or a nested invocation.
 */
public interface LogEntry {

    boolean isNode();
}
