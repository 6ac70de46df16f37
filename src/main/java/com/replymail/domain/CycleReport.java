package com.replymail.domain;

import java.time.Instant;

/**
 * Summary of one polling cycle
 */
public record CycleReport(
        Instant startedAt,
        Instant finishedAt,
        RunOutcome outcome,
        int fetched,
        int replied,
        int skipped,
        int failed,
        String error) {
}
