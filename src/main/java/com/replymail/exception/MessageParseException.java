package com.replymail.exception;

/**
 * A single raw message could not be turned into an InboxMessage
 */
public class MessageParseException extends AssistantException {

    public MessageParseException(String message) {
        super("MESSAGE_PARSE_FAILED", message);
    }

    public MessageParseException(String message, Throwable cause) {
        super("MESSAGE_PARSE_FAILED", message, cause);
    }
}
