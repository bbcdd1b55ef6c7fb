package com.leaflog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralizes program ids, topic names, and retry settings.
 *
 * Bound from application.yml under "leaflog" prefix:
 *   leaflog:
 *     programs:
 *       tree-program-id: GRoLL...
 *       token-program-id: BGUM...
 *     topics:
 *       transactions: leaflog.transactions
 *       dlq: leaflog.dlq
 *       dlq-dead: leaflog.dlq.dead
 *       refetch: leaflog.refetch
 *     dlq:
 *       max-retries: 3
 *       base-delay-ms: 5000
 *     dedup:
 *       ttl: 24h
 *     ingest:
 *       atomic: true
 */
@Component
@ConfigurationProperties(prefix = "leaflog")
@Getter
@Setter
public class LeafLogProperties {

    private Programs programs = new Programs();
    private Topics topics = new Topics();
    private Dlq dlq = new Dlq();
    private Dedup dedup = new Dedup();
    private Ingest ingest = new Ingest();

    @Getter
    @Setter
    public static class Programs {
        private String treeProgramId = "GRoLLMza82AiYN7W9S9KCCtCyyPRAQP2ifBy4v4D5RMD";
        private String tokenProgramId = "BGUMzZr2wWfD2yzrXFEWTK2HbdYhqQCP2EZoPEkZBD6o";
    }

    @Getter
    @Setter
    public static class Topics {
        private String transactions = "leaflog.transactions";
        private String dlq = "leaflog.dlq";
        private String dlqDead = "leaflog.dlq.dead";
        private String refetch = "leaflog.refetch";
    }

    @Getter
    @Setter
    public static class Dlq {
        private int maxRetries = 3;
        private long baseDelayMs = 5000;
    }

    @Getter
    @Setter
    public static class Dedup {
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Ingest {
        // false → stream transactions through the best-effort entry point
        private boolean atomic = true;
    }
}
