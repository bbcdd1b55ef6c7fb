package com.leaflog.service;

import com.leaflog.event.ChangeLogEvent;
import com.leaflog.event.DecodedEvent;
import com.leaflog.event.DecompressionEvent;
import com.leaflog.event.LeafSchemaEvent;
import com.leaflog.event.LeafSchemaV1;
import com.leaflog.event.NewLeafEvent;
import com.leaflog.model.InstructionKind;
import com.leaflog.model.LeafSchemaRecord;
import com.leaflog.repository.IndexBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns one classified instruction and its events into buffered writes.
 *
 * Per kind:
 *   CREATE_TREE   → changelog
 *   MINT          → changelog + leaf schema + metadata   (events: NewNFT, LeafSchema)
 *   TRANSFER, DELEGATE, BURN, REDEEM, CANCEL_REDEEM
 *                 → changelog + leaf schema              (events: LeafSchema)
 *   DECOMPRESS    → decompressed flag                    (events: NFTDecompression)
 *
 * A missing changelog, a changelog outside the sequence window, or the wrong
 * number of events yields an empty batch. Nothing here throws for those cases.
 */
@Component
@Slf4j
public class InstructionHandler {

    public IndexBatch handle(MatchedInstruction instruction, ChangeLogEvent changelog,
                             List<DecodedEvent> events, TransactionContext context) {
        InstructionKind kind = instruction.getKind();

        if (kind == InstructionKind.DECOMPRESS) {
            return handleDecompress(events, context);
        }

        if (changelog == null) {
            log.warn("No changelog found for {} in tx={}, skipping", kind, context.getTransactionId());
            return new IndexBatch();
        }
        if (context.getWindow().excludes(changelog.getSeq())) {
            log.debug("Changelog seq={} outside window {} for tx={}, skipping",
                    changelog.getSeq(), context.getWindow(), context.getTransactionId());
            return new IndexBatch();
        }

        return switch (kind) {
            case CREATE_TREE -> handleCreateTree(changelog, context);
            case MINT -> handleMint(changelog, events, context);
            case TRANSFER, DELEGATE, BURN, CANCEL_REDEEM -> handleReplace(kind, changelog, events, context, false);
            case REDEEM -> handleReplace(kind, changelog, events, context, true);
            default -> new IndexBatch();
        };
    }

    private IndexBatch handleCreateTree(ChangeLogEvent changelog, TransactionContext context) {
        return new IndexBatch().upsertChangelog(changelog, context.getTransactionId(), context.getSlot());
    }

    private IndexBatch handleMint(ChangeLogEvent changelog, List<DecodedEvent> events, TransactionContext context) {
        if (events.size() != 2
                || !events.get(0).isA(NewLeafEvent.class)
                || !events.get(1).isA(LeafSchemaEvent.class)) {
            log.warn("Mint in tx={} expected [NewNFTEvent, LeafSchemaEvent] but decoded {}, skipping",
                    context.getTransactionId(), events);
            return new IndexBatch();
        }

        NewLeafEvent newLeaf = events.get(0).dataAs(NewLeafEvent.class);
        LeafSchemaV1 schema = events.get(1).dataAs(LeafSchemaEvent.class).getV1();

        return new IndexBatch()
                .upsertChangelog(changelog, context.getTransactionId(), context.getSlot())
                .upsertLeafSchema(toRecord(schema, changelog, context, false))
                .upsertNftMetadata(schema.getId(), newLeaf.getMetadata());
    }

    private IndexBatch handleReplace(InstructionKind kind, ChangeLogEvent changelog, List<DecodedEvent> events,
                                     TransactionContext context, boolean redeemed) {
        if (events.size() != 1 || !events.get(0).isA(LeafSchemaEvent.class)) {
            log.warn("{} in tx={} expected [LeafSchemaEvent] but decoded {}, skipping",
                    kind, context.getTransactionId(), events);
            return new IndexBatch();
        }

        LeafSchemaV1 schema = events.get(0).dataAs(LeafSchemaEvent.class).getV1();
        return new IndexBatch()
                .upsertChangelog(changelog, context.getTransactionId(), context.getSlot())
                .upsertLeafSchema(toRecord(schema, changelog, context, redeemed));
    }

    private IndexBatch handleDecompress(List<DecodedEvent> events, TransactionContext context) {
        if (events.size() != 1 || !events.get(0).isA(DecompressionEvent.class)) {
            log.warn("Decompress in tx={} expected [NFTDecompressionEvent] but decoded {}, skipping",
                    context.getTransactionId(), events);
            return new IndexBatch();
        }
        return new IndexBatch().setDecompressed(events.get(0).dataAs(DecompressionEvent.class).getId());
    }

    private LeafSchemaRecord toRecord(LeafSchemaV1 schema, ChangeLogEvent changelog,
                                      TransactionContext context, boolean redeemed) {
        return LeafSchemaRecord.builder()
                .treeId(changelog.getTreeId())
                .nonce(schema.getNonce())
                .assetId(schema.getId())
                .owner(schema.getOwner())
                .delegate(schema.getDelegate())
                .dataHash(schema.getDataHash())
                .creatorHash(schema.getCreatorHash())
                .leafHash(changelog.leafHash())
                .seq(changelog.getSeq())
                .transactionId(context.getTransactionId())
                .slot(context.getSlot())
                .compressed(true)
                .redeemed(redeemed)
                .build();
    }
}
