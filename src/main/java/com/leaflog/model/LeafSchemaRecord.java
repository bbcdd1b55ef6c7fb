package com.leaflog.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;

/**
 * Latest known leaf descriptor of a compressed asset.
 *
 * Keyed by (treeId, nonce); assetId is indexed for lookups. seq is the
 * changelog sequence that produced this state and guards against replays:
 * an older seq never overwrites a newer one.
 */
@Entity
@Table(name = "leaf_schemas", indexes = {
    @Index(name = "idx_leaf_schema_asset", columnList = "asset_id")
})
@IdClass(LeafSchemaRecordId.class)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LeafSchemaRecord {

    @Id
    @Column(name = "tree_id", nullable = false)
    private String treeId;

    @Id
    @Column(nullable = false, precision = 39)
    private BigInteger nonce;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(nullable = false)
    private String owner;

    @Column(nullable = false)
    private String delegate;

    @Column(name = "data_hash", nullable = false)
    private String dataHash;

    @Column(name = "creator_hash", nullable = false)
    private String creatorHash;

    @Column(name = "leaf_hash", nullable = false)
    private String leafHash;

    @Column(nullable = false)
    private long seq;

    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    @Column(nullable = false)
    private long slot;

    @Column(nullable = false)
    private boolean compressed;

    @Column(nullable = false)
    private boolean redeemed;
}
