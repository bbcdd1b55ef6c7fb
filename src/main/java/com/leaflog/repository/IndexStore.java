package com.leaflog.repository;

import com.leaflog.event.ChangeLogEvent;
import com.leaflog.event.MetadataArgs;
import com.leaflog.model.LeafSchemaRecord;

/**
 * Storage collaborator for indexed state.
 *
 * Every upsert is keyed and idempotent: calling it twice with the same key
 * leaves one row. {@link #applyBatch(IndexBatch)} is the single begin/commit
 * bracket around everything one transaction produced.
 */
public interface IndexStore {

    void upsertChangelog(ChangeLogEvent changelog, String transactionId, long slot);

    void upsertLeafSchema(LeafSchemaRecord record);

    void upsertNftMetadata(String assetId, MetadataArgs metadata);

    void setDecompressed(String assetId);

    /**
     * Apply every mutation of the batch atomically: all land, or none do.
     */
    void applyBatch(IndexBatch batch);
}
