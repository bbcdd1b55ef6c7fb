package com.leaflog.controller;

import com.leaflog.dto.TreeGapResponse;
import com.leaflog.service.GapFinder;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * GET /api/trees/{treeId}/gaps?minSeq=0 → sequence gaps to backfill
 */
@RestController
@RequestMapping("/api/trees")
@RequiredArgsConstructor
public class TreeController {

    private final GapFinder gapFinder;

    @GetMapping("/{treeId}/gaps")
    public ResponseEntity<TreeGapResponse> gaps(@PathVariable String treeId,
                                                @RequestParam(defaultValue = "0") long minSeq) {
        return ResponseEntity.ok(gapFinder.findGaps(treeId, minSeq));
    }
}
