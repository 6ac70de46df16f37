package com.replymail.exception;

/**
 * Network blip, timeout or temporary server refusal. Retried with bounded backoff.
 */
public class TransientTransportException extends AssistantException {

    public TransientTransportException(String message) {
        super("TRANSIENT_TRANSPORT", message);
    }

    public TransientTransportException(String message, Throwable cause) {
        super("TRANSIENT_TRANSPORT", message, cause);
    }
}
