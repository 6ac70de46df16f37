package com.replymail.pipeline;

/**
 * Per-message pipeline state machine
 * IDLE -> FETCHING -> PARSING -> EVALUATING -> (RETRIEVING) -> GENERATING -> SENDING -> COMMITTING -> IDLE
 */
public enum PipelineStage {
    IDLE,
    FETCHING,
    PARSING,
    EVALUATING,
    RETRIEVING,
    GENERATING,
    SENDING,
    COMMITTING
}
