package com.replymail.exception;

/**
 * Permanent rejection of an outgoing reply (bad recipient, message refused)
 */
public class MailSendException extends AssistantException {

    public MailSendException(String message, Throwable cause) {
        super("SEND_REPLY_FAILED", message, cause);
    }
}
