package com.leaflog.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaflog.config.LeafLogProperties;
import com.leaflog.dto.IncomingTransaction;
import com.leaflog.log.LogParseException;
import com.leaflog.model.IndexStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for executed transactions on "leaflog.transactions".
 *
 * FLOW:
 *   feeder publishes transaction JSON → leaflog.transactions
 *                                          ↓
 *                              deserialize → IncomingTransaction
 *                                          ↓
 *                              Redis dedup on the signature
 *                                          ↓
 *                              TransactionIndexer (atomic or best-effort)
 *                                          ↓
 *   LOG_TRUNCATED    → clear dedup, publish to leaflog.refetch
 *   malformed logs  → permanent DLQ (a retry would fail the same way)
 *   any other error  → DLQ, retried with backoff
 *
 * The consumer group "leaflog-indexer" delivers each record to one instance.
 * Ordering per tree comes from the feeder partitioning by tree id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionListener {

    private final TransactionIndexer indexer;
    private final DeduplicationService deduplicationService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;
    private final LeafLogProperties properties;

    @KafkaListener(topics = "${leaflog.topics.transactions:leaflog.transactions}", groupId = "leaflog-indexer")
    public void onTransaction(String message) {
        IncomingTransaction transaction;
        try {
            transaction = objectMapper.readValue(message, IncomingTransaction.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize transaction: {}", e.getMessage());
            deadLetterQueueService.sendRawToDlq(message, e.getMessage());
            return;
        }

        if (deduplicationService.isDuplicate(transaction.getSignature())) {
            log.info("Skipping duplicate transaction: {}", transaction.getSignature());
            return;
        }

        try {
            IndexStatus status = properties.getIngest().isAtomic()
                    ? indexer.indexAtomic(transaction)
                    : indexer.indexBestEffort(transaction);
            if (status == IndexStatus.LOG_TRUNCATED) {
                deduplicationService.clearDedup(transaction.getSignature());
                deadLetterQueueService.sendForRefetch(transaction);
            }
        } catch (LogParseException | IllegalArgumentException e) {
            deadLetterQueueService.sendToPermanentDlq(message, "Unindexable transaction: " + e.getMessage());
        } catch (Exception e) {
            log.error("Failed to index transaction {}: {}", transaction.getSignature(), e.getMessage(), e);
            deadLetterQueueService.sendToDlq(transaction, e.getMessage(), transaction.getRetryCount());
        }
    }
}
