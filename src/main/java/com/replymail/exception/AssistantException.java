package com.replymail.exception;

import lombok.Getter;

/**
 * Base exception for the reply pipeline.
 * Carries a stable error code that ends up in logs and the control surface.
 */
@Getter
public class AssistantException extends RuntimeException {

    private final String errorCode;

    public AssistantException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AssistantException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
