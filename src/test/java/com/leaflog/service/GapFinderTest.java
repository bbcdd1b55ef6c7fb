package com.leaflog.service;

import com.leaflog.dto.GapInfo;
import com.leaflog.dto.TreeGapResponse;
import com.leaflog.repository.ChangelogNodeRepository;
import com.leaflog.repository.ChangelogNodeRepository.SeqSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GapFinderTest {

    @Mock private ChangelogNodeRepository changelogNodeRepository;

    @InjectMocks
    private GapFinder gapFinder;

    private static SeqSlot row(long seq, long slot) {
        return new SeqSlot() {
            @Override
            public long getSeq() {
                return seq;
            }

            @Override
            public long getSlot() {
                return slot;
            }
        };
    }

    @Test
    @DisplayName("Jumps larger than one are reported as gaps with their slots")
    void findsGaps() {
        when(changelogNodeRepository.findSeqSlots("tree-1", 3)).thenReturn(List.of(
                row(3, 100), row(4, 101), row(8, 120), row(9, 121), row(12, 130)));

        TreeGapResponse report = gapFinder.findGaps("tree-1", 3);

        assertEquals(2, report.getGaps().size());
        GapInfo first = report.getGaps().get(0);
        assertEquals(4, first.getPrevSeq());
        assertEquals(8, first.getCurrSeq());
        assertEquals(101, first.getPrevSlot());
        assertEquals(120, first.getCurrSlot());
        assertEquals(3, first.missingCount());
        assertEquals(12L, report.getMaxSeq());
        assertEquals(130L, report.getMaxSlot());
    }

    @Test
    @DisplayName("Contiguous sequence has no gaps")
    void contiguous() {
        when(changelogNodeRepository.findSeqSlots("tree-1", 0)).thenReturn(List.of(row(0, 5), row(1, 6)));

        assertTrue(gapFinder.findGaps("tree-1", 0).getGaps().isEmpty());
    }

    @Test
    @DisplayName("Empty tree has no gaps and no max")
    void empty() {
        when(changelogNodeRepository.findSeqSlots("tree-1", 0)).thenReturn(List.of());

        TreeGapResponse report = gapFinder.findGaps("tree-1", 0);

        assertTrue(report.getGaps().isEmpty());
        assertNull(report.getMaxSeq());
    }

    @Test
    @DisplayName("Same seq stored with two slots is a data-integrity error")
    void duplicateSeq() {
        when(changelogNodeRepository.findSeqSlots("tree-1", 0)).thenReturn(List.of(row(5, 10), row(5, 11)));

        assertThrows(DuplicateSequenceException.class, () -> gapFinder.findGaps("tree-1", 0));
    }
}
