package com.leaflog.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.util.List;

/**
 * One executed transaction as delivered by the feeder (Kafka or HTTP).
 *
 * Example JSON:
 * {
 *   "signature": "5h6x...",
 *   "slot": 171234567,
 *   "err": null,
 *   "logs": [
 *     "Program BGUM... invoke [1]",
 *     "Program log: Instruction: Transfer",
 *     "Program data: ...",
 *     "Program BGUM... success"
 *   ],
 *   "startSeq": 41,
 *   "endSeq": 57
 * }
 *
 * - err:              on-chain error object; any non-null value marks the transaction failed
 * - startSeq, endSeq: optional backfill window, both bounds exclusive
 * - retryCount:       stamped by the DLQ retry consumer
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IncomingTransaction {

    @NotBlank
    private String signature;

    @PositiveOrZero
    private long slot;

    private Object err;

    @NotNull
    private List<String> logs;

    private Long startSeq;

    private Long endSeq;

    private int retryCount;

    public boolean failed() {
        return err != null;
    }
}
