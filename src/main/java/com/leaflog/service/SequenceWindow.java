package com.leaflog.service;

import lombok.Getter;

/**
 * Optional backfill bounds on changelog sequence numbers.
 *
 * Both bounds are exclusive: a gap report hands out the already-stored
 * neighbours (prevSeq, currSeq) as (startSeq, endSeq), so only the seqs
 * strictly between them are written. A window with startSeq >= endSeq is
 * empty and excludes every seq.
 */
@Getter
public class SequenceWindow {

    private static final SequenceWindow UNBOUNDED = new SequenceWindow(null, null);

    private final Long startSeq;
    private final Long endSeq;

    private SequenceWindow(Long startSeq, Long endSeq) {
        this.startSeq = startSeq;
        this.endSeq = endSeq;
    }

    public static SequenceWindow of(Long startSeq, Long endSeq) {
        if (startSeq == null && endSeq == null) {
            return UNBOUNDED;
        }
        return new SequenceWindow(startSeq, endSeq);
    }

    public static SequenceWindow unbounded() {
        return UNBOUNDED;
    }

    public boolean isEmpty() {
        return startSeq != null && endSeq != null && startSeq >= endSeq;
    }

    public boolean excludes(long seq) {
        return (startSeq != null && seq <= startSeq) || (endSeq != null && seq >= endSeq);
    }

    @Override
    public String toString() {
        return "(" + (startSeq == null ? "-inf" : startSeq) + ", " + (endSeq == null ? "+inf" : endSeq) + ")";
    }
}
