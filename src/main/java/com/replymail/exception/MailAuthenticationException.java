package com.replymail.exception;

/**
 * Mailbox or submission credentials rejected. Never retried; aborts the cycle.
 */
public class MailAuthenticationException extends AssistantException {

    public MailAuthenticationException(String message, Throwable cause) {
        super("MAIL_AUTHENTICATION_FAILED", message, cause);
    }
}
