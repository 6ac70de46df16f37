package com.replymail.exception;

/**
 * The processed-message ledger could not be read or could not durably record a commit.
 * At-most-once cannot be guaranteed without it, so the cycle is aborted.
 */
public class LedgerWriteException extends AssistantException {

    public LedgerWriteException(String message, Throwable cause) {
        super("LEDGER_WRITE_FAILED", message, cause);
    }
}
