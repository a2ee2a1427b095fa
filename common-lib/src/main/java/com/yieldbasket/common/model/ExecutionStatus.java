package com.yieldbasket.common.model;

/** What happened on-chain for a committed decision. */
public enum ExecutionStatus {
    /** HOLD, SKIPPED or a vetoed proposal: nothing to submit. */
    NOT_REQUIRED,
    SUBMITTED,
    /** Execution-time guard re-check refused the submission. */
    BLOCKED,
    SUBMISSION_FAILED
}
