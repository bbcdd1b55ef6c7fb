package com.leaflog.dto;

import lombok.*;

/**
 * A run of missing sequence numbers between two stored changelogs.
 * Re-indexing the slots between prevSlot and currSlot with the window
 * (startSeq = prevSeq, endSeq = currSeq) fills exactly the hole.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GapInfo {

    private long prevSeq;
    private long currSeq;
    private long prevSlot;
    private long currSlot;

    public long missingCount() {
        return currSeq - prevSeq - 1;
    }
}
