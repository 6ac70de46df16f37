package com.replymail.domain;

import com.replymail.pipeline.PipelineStage;

import java.time.Instant;

/**
 * Lock-free snapshot of orchestrator state for the control surface
 */
public record RunStatus(
        boolean running,
        PipelineStage currentStage,
        Instant lastRunAt,
        RunOutcome lastOutcome,
        long processedCount,
        String lastError,
        CycleReport lastReport) {

    public static RunStatus initial() {
        return new RunStatus(false, PipelineStage.IDLE, null, RunOutcome.NEVER_RUN, 0L, null, null);
    }

    public RunStatus withStage(PipelineStage stage) {
        return new RunStatus(running, stage, lastRunAt, lastOutcome, processedCount, lastError, lastReport);
    }

    public RunStatus started() {
        return new RunStatus(true, PipelineStage.FETCHING, lastRunAt, lastOutcome, processedCount, lastError, lastReport);
    }

    public RunStatus finished(CycleReport report) {
        return new RunStatus(false, PipelineStage.IDLE, report.startedAt(), report.outcome(),
                processedCount + report.replied(), report.error(), report);
    }
}
