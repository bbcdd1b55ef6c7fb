package com.leaflog.repository;

import com.leaflog.event.ChangeLogEvent;
import com.leaflog.event.MetadataArgs;
import com.leaflog.model.LeafSchemaRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Buffered writes, replayed against an {@link IndexStore} in insertion order.
 *
 * Handlers only ever append here. Nothing touches storage until the
 * reconciliation step hands the batch to {@link IndexStore#applyBatch(IndexBatch)}.
 */
public class IndexBatch {

    @FunctionalInterface
    public interface Mutation {
        void applyTo(IndexStore store);
    }

    private final List<Mutation> mutations = new ArrayList<>();

    public IndexBatch upsertChangelog(ChangeLogEvent changelog, String transactionId, long slot) {
        mutations.add(store -> store.upsertChangelog(changelog, transactionId, slot));
        return this;
    }

    public IndexBatch upsertLeafSchema(LeafSchemaRecord record) {
        mutations.add(store -> store.upsertLeafSchema(record));
        return this;
    }

    public IndexBatch upsertNftMetadata(String assetId, MetadataArgs metadata) {
        mutations.add(store -> store.upsertNftMetadata(assetId, metadata));
        return this;
    }

    public IndexBatch setDecompressed(String assetId) {
        mutations.add(store -> store.setDecompressed(assetId));
        return this;
    }

    public void merge(IndexBatch other) {
        mutations.addAll(other.mutations);
    }

    public void applyTo(IndexStore store) {
        for (Mutation mutation : mutations) {
            mutation.applyTo(store);
        }
    }

    public List<Mutation> getMutations() {
        return Collections.unmodifiableList(mutations);
    }

    public int size() {
        return mutations.size();
    }

    public boolean isEmpty() {
        return mutations.isEmpty();
    }
}
