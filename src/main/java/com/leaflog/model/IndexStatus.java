package com.leaflog.model;

/**
 * Outcome of indexing one transaction atomically.
 * SUCCESS           → parsed and committed (including "nothing to index")
 * TRANSACTION_ERROR → the transaction failed on-chain; logs were not parsed
 * LOG_TRUNCATED     → the log capture is incomplete; re-fetch and retry
 */
public enum IndexStatus {
    SUCCESS,
    TRANSACTION_ERROR,
    LOG_TRUNCATED
}
