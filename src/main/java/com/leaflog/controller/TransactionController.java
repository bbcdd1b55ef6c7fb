package com.leaflog.controller;

import com.leaflog.dto.IncomingTransaction;
import com.leaflog.dto.IndexResponse;
import com.leaflog.model.IndexStatus;
import com.leaflog.service.TransactionIndexer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Indexes a single transaction synchronously (alternative to Kafka).
 * Useful for backfills and for replaying one signature by hand.
 *
 * POST /api/transactions
 * {
 *   "signature": "5h6x...",
 *   "slot": 171234567,
 *   "logs": ["Program BGUM... invoke [1]", "..."],
 *   "startSeq": 41,
 *   "endSeq": 57
 * }
 *
 * Always answers 200 with the status; malformed logs answer 422.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionIndexer indexer;

    @PostMapping
    public ResponseEntity<IndexResponse> index(@Valid @RequestBody IncomingTransaction transaction) {
        IndexStatus status = indexer.indexAtomic(transaction);
        return ResponseEntity.ok(new IndexResponse(transaction.getSignature(), status));
    }
}
