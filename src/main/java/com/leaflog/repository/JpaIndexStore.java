package com.leaflog.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaflog.event.ChangeLogEvent;
import com.leaflog.event.MetadataArgs;
import com.leaflog.event.PathNode;
import com.leaflog.model.ChangelogNode;
import com.leaflog.model.DecompressedAsset;
import com.leaflog.model.LeafSchemaRecord;
import com.leaflog.model.LeafSchemaRecordId;
import com.leaflog.model.NftMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link IndexStore} backed by Spring Data JPA.
 *
 * HOW IT WORKS:
 *   1. applyBatch() opens one database transaction
 *   2. Each buffered mutation calls back into the upsert methods below
 *   3. Any exception rolls the whole batch back and propagates to the caller
 *
 * Upserts rely on JPA merge semantics: save() on an existing primary key
 * overwrites the row instead of inserting a second one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaIndexStore implements IndexStore {

    private final ChangelogNodeRepository changelogNodeRepository;
    private final LeafSchemaRecordRepository leafSchemaRecordRepository;
    private final NftMetadataRepository nftMetadataRepository;
    private final DecompressedAssetRepository decompressedAssetRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void upsertChangelog(ChangeLogEvent changelog, String transactionId, long slot) {
        List<PathNode> path = changelog.getPath();
        List<ChangelogNode> rows = new ArrayList<>(path.size());
        for (int level = 0; level < path.size(); level++) {
            PathNode node = path.get(level);
            rows.add(ChangelogNode.builder()
                    .treeId(changelog.getTreeId())
                    .seq(changelog.getSeq())
                    .nodeIdx(node.getIndex())
                    .level(level)
                    .hash(node.getNode())
                    .transactionId(transactionId)
                    .slot(slot)
                    .build());
        }
        changelogNodeRepository.saveAll(rows);
        log.debug("Upserted changelog: tree={}, seq={}, nodes={}",
                changelog.getTreeId(), changelog.getSeq(), rows.size());
    }

    @Override
    public void upsertLeafSchema(LeafSchemaRecord record) {
        Optional<LeafSchemaRecord> existing = leafSchemaRecordRepository.findById(
                new LeafSchemaRecordId(record.getTreeId(), record.getNonce()));

        // Replay of an older mutation: keep the newer state
        if (existing.isPresent() && existing.get().getSeq() > record.getSeq()) {
            log.debug("Ignoring stale leaf schema: asset={}, seq={} < stored seq={}",
                    record.getAssetId(), record.getSeq(), existing.get().getSeq());
            return;
        }
        leafSchemaRecordRepository.save(record);
    }

    @Override
    public void upsertNftMetadata(String assetId, MetadataArgs metadata) {
        NftMetadata.NftMetadataBuilder row = NftMetadata.builder()
                .assetId(assetId)
                .name(metadata.getName())
                .symbol(metadata.getSymbol())
                .uri(metadata.getUri())
                .sellerFeeBasisPoints(metadata.getSellerFeeBasisPoints())
                .primarySaleHappened(metadata.isPrimarySaleHappened())
                .mutable(metadata.isMutable())
                .editionNonce(metadata.getEditionNonce())
                .tokenStandard(metadata.getTokenStandard())
                .tokenProgramVersion(metadata.getTokenProgramVersion())
                .creators(creatorsJson(metadata));

        if (metadata.getCollection() != null) {
            row.collectionKey(metadata.getCollection().getKey())
               .collectionVerified(metadata.getCollection().isVerified());
        }
        nftMetadataRepository.save(row.build());
    }

    @Override
    public void setDecompressed(String assetId) {
        if (decompressedAssetRepository.existsById(assetId)) {
            return;
        }
        decompressedAssetRepository.save(DecompressedAsset.builder().assetId(assetId).build());
    }

    @Override
    @Transactional
    public void applyBatch(IndexBatch batch) {
        batch.applyTo(this);
    }

    private String creatorsJson(MetadataArgs metadata) {
        try {
            return objectMapper.writeValueAsString(
                    metadata.getCreators() == null ? List.of() : metadata.getCreators());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize creators", e);
        }
    }
}
