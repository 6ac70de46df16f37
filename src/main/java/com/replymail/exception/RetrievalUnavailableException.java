package com.replymail.exception;

/**
 * Embedding service or index storage failed while searching or ingesting
 */
public class RetrievalUnavailableException extends AssistantException {

    public RetrievalUnavailableException(String message, Throwable cause) {
        super("RETRIEVAL_UNAVAILABLE", message, cause);
    }
}
