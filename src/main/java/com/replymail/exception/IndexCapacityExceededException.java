package com.replymail.exception;

import lombok.Getter;

/**
 * Ingestion rejected because the retrieval index is full. The index is left untouched.
 */
@Getter
public class IndexCapacityExceededException extends AssistantException {

    private final int currentSize;
    private final int requested;
    private final int maxSize;

    public IndexCapacityExceededException(int currentSize, int requested, int maxSize) {
        super("INDEX_CAPACITY_EXCEEDED", String.format(
                "Index holds %d of %d chunks, cannot add %d more", currentSize, maxSize, requested));
        this.currentSize = currentSize;
        this.requested = requested;
        this.maxSize = maxSize;
    }
}
