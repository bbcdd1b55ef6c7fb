package com.leaflog.repository;

import com.leaflog.model.ChangelogNode;
import com.leaflog.model.ChangelogNodeId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Database access for changelog path rows.
 *
 * findSeqSlots("tree", 10)
 * → SELECT DISTINCT seq, slot FROM changelog_nodes WHERE tree_id = ? AND seq >= ? ORDER BY seq
 */
public interface ChangelogNodeRepository extends JpaRepository<ChangelogNode, ChangelogNodeId> {

    interface SeqSlot {
        long getSeq();
        long getSlot();
    }

    // Used by the gap finder: one entry per stored changelog, ascending
    @Query("SELECT DISTINCT c.seq AS seq, c.slot AS slot FROM ChangelogNode c "
            + "WHERE c.treeId = :treeId AND c.seq >= :minSeq ORDER BY c.seq")
    List<SeqSlot> findSeqSlots(@Param("treeId") String treeId, @Param("minSeq") long minSeq);
}
