package com.leaflog.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaflog.config.LeafLogProperties;
import com.leaflog.dto.IncomingTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Consumes failed transactions from the Dead Letter Queue and retries them.
 *
 * FLOW:
 *   leaflog.dlq → parse envelope (originalTransaction, retryCount, error)
 *                        ↓
 *                retryCount < max-retries?
 *          ┌─── YES ─────┴───── NO ───┐
 *          ↓                           ↓
 *    wait (exponential backoff)     send to leaflog.dlq.dead
 *    clear dedup key
 *    re-publish to leaflog.transactions
 *
 * BACKOFF: base-delay-ms × 5^retryCount (5s, 25s, 125s with defaults).
 *
 * Runs in its own consumer group so retries never block the main pipeline.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DlqRetryConsumer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final DeduplicationService deduplicationService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;
    private final LeafLogProperties properties;

    @KafkaListener(topics = "${leaflog.topics.dlq:leaflog.dlq}", groupId = "leaflog-dlq-processor")
    public void onDlqMessage(String message) {
        try {
            Map<String, Object> envelope = objectMapper.readValue(message, new TypeReference<>() {});

            int retryCount = ((Number) envelope.getOrDefault("retryCount", 0)).intValue();

            if (envelope.containsKey("rawMessage")) {
                log.warn("Unparseable message in DLQ, moving to permanent DLQ: {}", envelope.get("error"));
                deadLetterQueueService.sendToPermanentDlq(message, "Unparseable message, cannot retry");
                return;
            }

            if (!deadLetterQueueService.isRetryable(retryCount)) {
                log.error("CRITICAL: Transaction exhausted all retries (count={}), moving to permanent DLQ",
                        retryCount);
                deadLetterQueueService.sendToPermanentDlq(message, "Max retries exceeded: " + retryCount);
                return;
            }

            Object original = envelope.get("originalTransaction");
            if (original == null) {
                log.error("DLQ message missing originalTransaction field, parking permanently");
                deadLetterQueueService.sendToPermanentDlq(message, "Missing originalTransaction field");
                return;
            }

            IncomingTransaction transaction = objectMapper.convertValue(original, IncomingTransaction.class);

            long delayMs = calculateBackoff(retryCount);
            log.info("Retrying DLQ transaction: signature={}, attempt={}, backoff={}ms",
                    transaction.getSignature(), retryCount + 1, delayMs);

            Thread.sleep(delayMs);

            deduplicationService.clearDedup(transaction.getSignature());

            // The next DLQ entry for this transaction carries the incremented count
            transaction.setRetryCount(retryCount + 1);

            String topic = properties.getTopics().getTransactions();
            kafkaTemplate.send(topic, transaction.getSignature(), objectMapper.writeValueAsString(transaction));

            log.info("Re-published DLQ transaction to {}: signature={}, attempt={}",
                    topic, transaction.getSignature(), retryCount + 1);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("DLQ retry interrupted: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Failed to process DLQ message: {}", e.getMessage(), e);
        }
    }

    long calculateBackoff(int retryCount) {
        long baseDelay = properties.getDlq().getBaseDelayMs();
        return baseDelay * (long) Math.pow(5, retryCount);
    }
}
