package com.leaflog.service;

import com.leaflog.dto.GapInfo;
import com.leaflog.dto.TreeGapResponse;
import com.leaflog.repository.ChangelogNodeRepository;
import com.leaflog.repository.ChangelogNodeRepository.SeqSlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports holes in a tree's stored changelog sequence.
 *
 * Stored (seq, slot) pairs from minSeq upward are walked in order; every
 * jump larger than one is a gap. Each gap's (prevSeq, currSeq) is the
 * exclusive window a backfill should be run with.
 *
 * Example: stored seqs 3, 4, 8, 9 → one gap (4, 8), seqs 5..7 missing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GapFinder {

    private final ChangelogNodeRepository changelogNodeRepository;

    @Transactional(readOnly = true)
    public TreeGapResponse findGaps(String treeId, long minSeq) {
        List<SeqSlot> stored = changelogNodeRepository.findSeqSlots(treeId, minSeq);
        List<GapInfo> gaps = new ArrayList<>();

        for (int i = 0; i < stored.size() - 1; i++) {
            SeqSlot prev = stored.get(i);
            SeqSlot curr = stored.get(i + 1);
            if (curr.getSeq() == prev.getSeq()) {
                throw new DuplicateSequenceException(String.format(
                        "Tree %s has seq %d stored with different slots: %d and %d",
                        treeId, curr.getSeq(), prev.getSlot(), curr.getSlot()));
            }
            if (curr.getSeq() - prev.getSeq() > 1) {
                gaps.add(new GapInfo(prev.getSeq(), curr.getSeq(), prev.getSlot(), curr.getSlot()));
            }
        }

        TreeGapResponse.TreeGapResponseBuilder response = TreeGapResponse.builder()
                .treeId(treeId)
                .gaps(gaps);
        if (!stored.isEmpty()) {
            SeqSlot last = stored.get(stored.size() - 1);
            response.maxSeq(last.getSeq()).maxSlot(last.getSlot());
        }

        log.info("Found {} gaps in tree {} from seq {}", gaps.size(), treeId, minSeq);
        return response.build();
    }
}
