package com.replymail.ledger;

import com.replymail.domain.ProcessedRecord;

import java.time.Instant;
import java.util.List;

/**
 * Durable set of message keys that already received a reply
 *
 * Insertion is the only mutation outside an explicit administrative reset.
 * A successful commit is durable before it returns.
 */
public interface ProcessedLedger {

    /**
     * Load persisted state; called once before first use
     */
    void open();

    boolean isProcessed(String messageId);

    /**
     * Record a message as answered. Idempotent.
     *
     * @return true if newly recorded, false if the key was already present
     * @throws com.replymail.exception.LedgerWriteException when the record could not be made durable
     */
    boolean commit(String messageId, Instant processedAt);

    /**
     * Force pending state to stable storage
     */
    void flush();

    List<ProcessedRecord> records();

    int size();

    /**
     * Administrative reset - removes every record
     *
     * @return number of records removed
     */
    int reset();

    void close();
}
