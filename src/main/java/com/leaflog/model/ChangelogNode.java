package com.leaflog.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * One node of a changelog path, stored per (tree, seq, node index).
 *
 * A changelog for (treeId, seq) is the set of its path rows. Writing the same
 * changelog twice overwrites the same keys, so replays never duplicate.
 *
 * Example (depth-3 tree, leaf 0 written at seq 5):
 *   (tree, 5, 8, level 0)  ← leaf
 *   (tree, 5, 4, level 1)
 *   (tree, 5, 2, level 2)
 *   (tree, 5, 1, level 3)  ← root
 */
@Entity
@Table(name = "changelog_nodes", indexes = {
    @Index(name = "idx_changelog_seq", columnList = "tree_id, seq")
})
@IdClass(ChangelogNodeId.class)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChangelogNode {

    @Id
    @Column(name = "tree_id", nullable = false)
    private String treeId;

    @Id
    @Column(nullable = false)
    private long seq;

    @Id
    @Column(name = "node_idx", nullable = false)
    private long nodeIdx;

    // Position in the path: 0 = leaf
    @Column(nullable = false)
    private int level;

    @Column(nullable = false)
    private String hash;

    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    @Column(nullable = false)
    private long slot;
}
