package com.replymail.ledger;

import com.replymail.domain.ProcessedRecord;
import com.replymail.exception.LedgerWriteException;
import com.replymail.mapper.ProcessedRecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.List;

/**
 * Ledger backed by the processed_message table (MyBatis + SQLite)
 * Each commit is its own auto-committed INSERT OR IGNORE
 */
@Slf4j
@RequiredArgsConstructor
public class SqliteProcessedLedger implements ProcessedLedger {

    private final ProcessedRecordMapper mapper;

    @Override
    public void open() {
        try {
            log.info("Processed ledger (sqlite) opened with {} record(s)", mapper.count());
        } catch (DataAccessException e) {
            throw new LedgerWriteException("Processed ledger table unavailable", e);
        }
    }

    @Override
    public boolean isProcessed(String messageId) {
        try {
            return mapper.existsById(messageId) > 0;
        } catch (DataAccessException e) {
            throw new LedgerWriteException("Ledger lookup failed for " + messageId, e);
        }
    }

    @Override
    public synchronized boolean commit(String messageId, Instant processedAt) {
        try {
            int inserted = mapper.insertIfAbsent(ProcessedRecord.builder()
                    .messageId(messageId)
                    .processedAt(processedAt.toString())
                    .build());
            if (inserted == 0) {
                log.debug("Ledger already contains {}", messageId);
                return false;
            }
            log.debug("Ledger committed {}", messageId);
            return true;
        } catch (DataAccessException e) {
            throw new LedgerWriteException("Ledger commit failed for " + messageId, e);
        }
    }

    @Override
    public void flush() {
        // auto-commit: every INSERT is already durable
    }

    @Override
    public List<ProcessedRecord> records() {
        return mapper.findAll();
    }

    @Override
    public int size() {
        return mapper.count();
    }

    @Override
    public synchronized int reset() {
        try {
            int removed = mapper.deleteAll();
            log.warn("Processed ledger reset, {} record(s) removed", removed);
            return removed;
        } catch (DataAccessException e) {
            throw new LedgerWriteException("Ledger reset failed", e);
        }
    }

    @Override
    public void close() {
        log.info("Processed ledger (sqlite) closed");
    }
}
