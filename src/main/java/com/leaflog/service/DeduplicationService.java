package com.leaflog.service;

import com.leaflog.config.LeafLogProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Drops transactions the stream has already delivered, using Redis.
 *
 * HOW IT WORKS:
 *   1. Before indexing, call isDuplicate(signature)
 *   2. This tries SET "leaflog:dedup:{signature}" with NX
 *   3. SET succeeds → first delivery, index it
 *   4. SET fails    → already seen, skip it
 *
 * The key expires after leaflog.dedup.ttl. Storage upserts are idempotent
 * anyway; this only saves re-parsing redelivered transactions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private static final String DEDUP_PREFIX = "leaflog:dedup:";

    private final StringRedisTemplate redisTemplate;
    private final LeafLogProperties properties;

    public boolean isDuplicate(String signature) {
        if (signature == null || signature.isBlank()) {
            return false;
        }

        Boolean wasSet = redisTemplate.opsForValue()
                .setIfAbsent(DEDUP_PREFIX + signature, "1", properties.getDedup().getTtl());

        if (Boolean.TRUE.equals(wasSet)) {
            return false;
        }
        log.warn("Duplicate transaction detected: {}", signature);
        return true;
    }

    /**
     * Forget a signature so a retry or re-fetch of it is indexed again.
     */
    public void clearDedup(String signature) {
        if (signature == null || signature.isBlank()) {
            return;
        }
        redisTemplate.delete(DEDUP_PREFIX + signature);
        log.info("Cleared dedup key: signature={}", signature);
    }
}
