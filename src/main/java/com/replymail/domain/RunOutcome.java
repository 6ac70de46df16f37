package com.replymail.domain;

/**
 * Result of the most recent pipeline cycle
 */
public enum RunOutcome {
    /** No cycle has completed since startup */
    NEVER_RUN,
    /** Every fetched message was replied to or skipped as already processed */
    SUCCESS,
    /** Cycle completed but at least one message failed in isolation */
    PARTIAL_FAILURE,
    /** Mailbox fetch failed after retries */
    FETCH_FAILED,
    /** Mailbox or submission credentials rejected */
    AUTHENTICATION_FAILED,
    /** Ledger commit failed; cycle aborted */
    LEDGER_FAILURE,
    /** Unexpected failure */
    ERROR
}
