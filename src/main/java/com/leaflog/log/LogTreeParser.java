package com.leaflog.log;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rebuilds the nested program-invocation tree from a flat token list.
 *
 * FLOW:
 *   INVOKE  → open a new node under the currently open one (or as a root)
 *   SUCCESS → close the open node; its program id must match
 *   other   → append as a line of the currently open node
 *
 * A single forward pass over the tokens with an explicit stack of open
 * invocations, so parsing is O(n) in the number of lines.
 *
 * Truncation is NOT handled here: callers check {@link LogTokenizer#isTruncated}
 * before trusting the structure.
 */
@Component
public class LogTreeParser {

    public List<LogNode> parse(List<LogToken> tokens) {
        List<LogNode> roots = new ArrayList<>();
        Deque<LogNode> open = new ArrayDeque<>();

        for (int i = 0; i < tokens.size(); i++) {
            LogToken token = tokens.get(i);
            switch (token.getType()) {
                case INVOKE -> {
                    int expectedDepth = open.size() + 1;
                    if (token.getDepth() != expectedDepth) {
                        throw new LogParseException("Invoke depth " + token.getDepth()
                                + " for " + token.getProgramId()
                                + " does not match nesting level " + expectedDepth, i);
                    }
                    LogNode node = new LogNode(token.getProgramId(), token.getDepth() - 1);
                    if (open.isEmpty()) {
                        roots.add(node);
                    } else {
                        open.peek().addChild(node);
                    }
                    open.push(node);
                }
                case SUCCESS -> {
                    if (open.isEmpty()) {
                        throw new LogParseException(
                                "Unexpected program id finished: " + token.getProgramId(), i);
                    }
                    LogNode closing = open.pop();
                    if (!closing.getProgramId().equals(token.getProgramId())) {
                        throw new LogParseException("Unexpected program id finished: "
                                + token.getProgramId() + ", expected " + closing.getProgramId(), i);
                    }
                }
                default -> {
                    if (open.isEmpty()) {
                        throw new LogParseException(
                                "Log line outside of any program invocation: " + token.getRaw(), i);
                    }
                    open.peek().addChild(new LogLine(token));
                }
            }
        }

        if (!open.isEmpty()) {
            throw new LogParseException(
                    "Unterminated invocation of " + open.peek().getProgramId(), tokens.size());
        }
        return roots;
    }
}
