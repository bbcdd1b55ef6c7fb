package com.leaflog.log;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One program invocation reconstructed from the logs.
 *
 * Children keep log order and mix plain lines with nested invocations (CPIs).
 * A node at depth 0 was invoked directly by the transaction; depth N is the
 * Nth level of CPI.
 */
@Getter
public class LogNode implements LogEntry {

    private final String programId;
    private final int depth;
    private final List<LogEntry> children = new ArrayList<>();

    public LogNode(String programId, int depth) {
        this.programId = programId;
        this.depth = depth;
    }

    void addChild(LogEntry child) {
        children.add(child);
    }

    @Override
    public boolean isNode() {
        return true;
    }

    public List<LogEntry> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<LogLine> lines() {
        List<LogLine> lines = new ArrayList<>();
        for (LogEntry child : children) {
            if (!child.isNode()) {
                lines.add((LogLine) child);
            }
        }
        return lines;
    }

    public List<LogNode> childNodes() {
        List<LogNode> nodes = new ArrayList<>();
        for (LogEntry child : children) {
            if (child.isNode()) {
                nodes.add((LogNode) child);
            }
        }
        return nodes;
    }

    /**
     * Name from the node's first line, when that line is "Instruction: <Name>".
     */
    public Optional<String> instructionName() {
        for (LogEntry child : children) {
            if (!child.isNode()) {
                LogToken token = ((LogLine) child).getToken();
                return token.is(LogToken.Type.INSTRUCTION)
                        ? Optional.of(token.getValue())
                        : Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Depth-first flattening of every line under this node, in log order.
     */
    public List<LogLine> flattenLines() {
        List<LogLine> out = new ArrayList<>();
        collectLines(this, out);
        return out;
    }

    private static void collectLines(LogNode node, List<LogLine> out) {
        for (LogEntry child : node.children) {
            if (child.isNode()) {
                collectLines((LogNode) child, out);
            } else {
                out.add((LogLine) child);
            }
        }
    }

    /**
     * Every node in this subtree (including this one) invoked by the given program,
     * in depth-first pre-order.
     */
    public List<LogNode> findInvocations(String targetProgramId) {
        List<LogNode> out = new ArrayList<>();
        collectInvocations(this, targetProgramId, out);
        return out;
    }

    private static void collectInvocations(LogNode node, String programId, List<LogNode> out) {
        if (node.programId.equals(programId)) {
            out.add(node);
        }
        for (LogEntry child : node.children) {
            if (child.isNode()) {
                collectInvocations((LogNode) child, programId, out);
            }
        }
    }

    @Override
    public String toString() {
        return "LogNode{" + programId + ", depth=" + depth + ", children=" + children.size() + "}";
    }
}
