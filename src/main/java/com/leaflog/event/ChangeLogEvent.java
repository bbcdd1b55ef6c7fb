package com.leaflog.event;

import lombok.*;

import java.util.List;

/**
 * Proof-path snapshot emitted by the tree program on every mutation.
 *
 * - treeId: Base58 address of the tree account
 * - path:   leaf-to-root nodes; path[0] is the new leaf hash
 * - seq:    per-tree sequence number, strictly increasing
 * - index:  leaf index that was written
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChangeLogEvent {

    public static final String NAME = "ChangeLogEvent";

    private String treeId;
    private List<PathNode> path;
    private long seq;
    private long index;

    public String leafHash() {
        return path == null || path.isEmpty() ? null : path.get(0).getNode();
    }

    static ChangeLogEvent read(BorshReader reader) {
        String treeId = reader.key();
        List<PathNode> path = reader.vec(PathNode::read);
        if (path.isEmpty()) {
            throw new EventDecodingException("Changelog for tree " + treeId + " has an empty path");
        }
        long seq = reader.u64();
        long index = reader.u32();
        return new ChangeLogEvent(treeId, path, seq, index);
    }
}
