package com.leaflog.service;

import com.leaflog.config.LeafLogProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeduplicationServiceTest {

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private ValueOperations<String, String> valueOps;

    private LeafLogProperties properties;
    private DeduplicationService deduplicationService;

    @BeforeEach
    void setUp() {
        properties = new LeafLogProperties();
        properties.getDedup().setTtl(Duration.ofMinutes(30));
        deduplicationService = new DeduplicationService(redisTemplate, properties);
    }

    @Test
    @DisplayName("First delivery of a signature is not a duplicate")
    void newSignature_shouldNotBeDuplicate() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent("leaflog:dedup:sig-001", "1", Duration.ofMinutes(30))).thenReturn(true);

        assertFalse(deduplicationService.isDuplicate("sig-001"));
    }

    @Test
    @DisplayName("Redelivered signature is a duplicate")
    void repeatedSignature_shouldBeDuplicate() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("leaflog:dedup:sig-001"), eq("1"), any(Duration.class))).thenReturn(false);

        assertTrue(deduplicationService.isDuplicate("sig-001"));
    }

    @Test
    @DisplayName("Null reply from Redis is treated as a duplicate")
    void nullReply_shouldBeDuplicate() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertTrue(deduplicationService.isDuplicate("sig-001"));
    }

    @Test
    @DisplayName("Null or blank signature is never a duplicate")
    void missingSignature_shouldNotBeDuplicate() {
        assertFalse(deduplicationService.isDuplicate(null));
        assertFalse(deduplicationService.isDuplicate("  "));
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("Clearing a signature deletes its key")
    void clearDedup_shouldDeleteKey() {
        deduplicationService.clearDedup("sig-001");

        verify(redisTemplate).delete("leaflog:dedup:sig-001");
    }
}
