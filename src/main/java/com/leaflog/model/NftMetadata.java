package com.leaflog.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Metadata captured at mint time, keyed by asset id.
 */
@Entity
@Table(name = "nft_metadata")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NftMetadata {

    @Id
    @Column(name = "asset_id", nullable = false)
    private String assetId;

    private String name;

    private String symbol;

    @Column(columnDefinition = "TEXT")
    private String uri;

    @Column(name = "seller_fee_basis_points", nullable = false)
    private int sellerFeeBasisPoints;

    @Column(name = "primary_sale_happened", nullable = false)
    private boolean primarySaleHappened;

    @Column(name = "is_mutable", nullable = false)
    private boolean mutable;

    @Column(name = "edition_nonce")
    private Integer editionNonce;

    @Column(name = "token_standard")
    private Integer tokenStandard;

    @Column(name = "token_program_version", nullable = false)
    private int tokenProgramVersion;

    @Column(name = "collection_key")
    private String collectionKey;

    @Column(name = "collection_verified")
    private Boolean collectionVerified;

    /**
     * JSON array of creators, in on-chain order:
     *   [{"address": "...", "verified": true, "share": 100}]
     */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String creators;
}
