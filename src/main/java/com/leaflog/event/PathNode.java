package com.leaflog.event;

import lombok.*;

/**
 * One node of a changelog path.
 * - node:  Base58 hash of the node after the mutation
 * - index: node index in the tree's 1-based heap layout (root = 1)
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class PathNode {

    private String node;
    private long index;

    static PathNode read(BorshReader reader) {
        return new PathNode(reader.key(), reader.u32());
    }
}
