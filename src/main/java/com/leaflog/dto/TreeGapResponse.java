package com.leaflog.dto;

import lombok.*;

import java.util.List;

/**
 * Gap report for one tree. maxSeq and maxSlot are null when nothing is stored.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TreeGapResponse {

    private String treeId;
    private List<GapInfo> gaps;
    private Long maxSeq;
    private Long maxSlot;
}
