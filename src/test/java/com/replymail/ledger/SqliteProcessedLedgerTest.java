package com.replymail.ledger;

import com.replymail.domain.ProcessedRecord;
import com.replymail.exception.LedgerWriteException;
import com.replymail.mapper.ProcessedRecordMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SQLite ledger unit tests
 */
@ExtendWith(MockitoExtension.class)
class SqliteProcessedLedgerTest {

    @Mock
    private ProcessedRecordMapper mapper;

    @InjectMocks
    private SqliteProcessedLedger ledger;

    @Test
    @DisplayName("Commit inserts the id with its timestamp")
    void testCommit() {
        when(mapper.insertIfAbsent(any())).thenReturn(1);
        Instant at = Instant.parse("2024-03-01T12:00:00Z");

        boolean added = ledger.commit("<a@x>", at);

        ArgumentCaptor<ProcessedRecord> captor = ArgumentCaptor.forClass(ProcessedRecord.class);
        verify(mapper).insertIfAbsent(captor.capture());
        assertThat(added).isTrue();
        assertThat(captor.getValue().getMessageId()).isEqualTo("<a@x>");
        assertThat(captor.getValue().getProcessedAt()).isEqualTo("2024-03-01T12:00:00Z");
    }

    @Test
    @DisplayName("Existing id: commit reports no change")
    void testCommitExisting() {
        when(mapper.insertIfAbsent(any())).thenReturn(0);

        assertThat(ledger.commit("<a@x>", Instant.now())).isFalse();
    }

    @Test
    @DisplayName("Database failure on commit surfaces as LedgerWriteException")
    void testCommitFailure() {
        when(mapper.insertIfAbsent(any())).thenThrow(new DataAccessResourceFailureException("database is locked"));

        assertThatThrownBy(() -> ledger.commit("<a@x>", Instant.now()))
                .isInstanceOf(LedgerWriteException.class)
                .hasMessageContaining("<a@x>");
    }

    @Test
    @DisplayName("Lookup delegates to existsById")
    void testIsProcessed() {
        when(mapper.existsById("<a@x>")).thenReturn(1);
        when(mapper.existsById("<b@x>")).thenReturn(0);

        assertThat(ledger.isProcessed("<a@x>")).isTrue();
        assertThat(ledger.isProcessed("<b@x>")).isFalse();
    }

    @Test
    @DisplayName("Reset returns the number of removed rows")
    void testReset() {
        when(mapper.deleteAll()).thenReturn(3);

        assertThat(ledger.reset()).isEqualTo(3);
    }
}
