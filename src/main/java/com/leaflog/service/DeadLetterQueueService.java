package com.leaflog.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaflog.config.LeafLogProperties;
import com.leaflog.dto.IncomingTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Parks transactions the stream could not index.
 *
 * Three destinations:
 *   leaflog.dlq      → retried by {@link DlqRetryConsumer} with backoff
 *   leaflog.dlq.dead → needs a human; never retried
 *   leaflog.refetch  → logs were truncated; the feeder fetches them again
 *
 * DLQ envelopes carry the original transaction, the error and a retry count.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LeafLogProperties properties;

    public void sendToDlq(IncomingTransaction transaction, String errorMessage, int retryCount) {
        Map<String, Object> envelope = new HashMap<>();
        envelope.put("originalTransaction", transaction);
        envelope.put("error", errorMessage);
        envelope.put("retryCount", retryCount);
        envelope.put("timestamp", System.currentTimeMillis());

        if (publish(properties.getTopics().getDlq(), transaction.getSignature(), envelope)) {
            log.info("Transaction sent to DLQ: signature={}, retryCount={}, error={}",
                    transaction.getSignature(), retryCount, errorMessage);
        }
    }

    public void sendRawToDlq(String rawMessage, String errorMessage) {
        Map<String, Object> envelope = new HashMap<>();
        envelope.put("rawMessage", rawMessage);
        envelope.put("error", errorMessage);
        envelope.put("retryCount", 0);
        envelope.put("timestamp", System.currentTimeMillis());

        if (publish(properties.getTopics().getDlq(), null, envelope)) {
            log.info("Unparseable message sent to DLQ: error={}", errorMessage);
        }
    }

    /**
     * Retries exhausted, or the transaction can never index (malformed logs).
     */
    public void sendToPermanentDlq(String originalMessage, String reason) {
        Map<String, Object> envelope = new HashMap<>();
        envelope.put("originalMessage", originalMessage);
        envelope.put("reason", reason);
        envelope.put("timestamp", System.currentTimeMillis());

        if (publish(properties.getTopics().getDlqDead(), null, envelope)) {
            log.error("CRITICAL: Message moved to permanent DLQ: reason={}", reason);
        }
    }

    /**
     * Ask the feeder for a complete copy of a transaction whose logs were truncated.
     */
    public void sendForRefetch(IncomingTransaction transaction) {
        Map<String, Object> request = new HashMap<>();
        request.put("signature", transaction.getSignature());
        request.put("slot", transaction.getSlot());
        request.put("startSeq", transaction.getStartSeq());
        request.put("endSeq", transaction.getEndSeq());
        request.put("timestamp", System.currentTimeMillis());

        if (publish(properties.getTopics().getRefetch(), transaction.getSignature(), request)) {
            log.info("Requested re-fetch of truncated transaction: signature={}", transaction.getSignature());
        }
    }

    public boolean isRetryable(int retryCount) {
        return retryCount < properties.getDlq().getMaxRetries();
    }

    private boolean publish(String topic, String key, Map<String, Object> body) {
        try {
            String message = objectMapper.writeValueAsString(body);
            if (key == null) {
                kafkaTemplate.send(topic, message);
            } else {
                kafkaTemplate.send(topic, key, message);
            }
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("CRITICAL: Failed to publish to {}: {}", topic, e.getMessage(), e);
            return false;
        }
    }
}
