package com.leaflog.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Flag row: the asset was decompressed into a regular token.
 */
@Entity
@Table(name = "decompressed_assets")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DecompressedAsset {

    @Id
    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(name = "decompressed_at", nullable = false)
    @Builder.Default
    private Instant decompressedAt = Instant.now();
}
