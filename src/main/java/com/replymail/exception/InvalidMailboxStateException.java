package com.replymail.exception;

import com.replymail.mail.MailboxState;
import lombok.Getter;

/**
 * An inbound mailbox operation was attempted in a state that does not permit it.
 * Recoverable: the transport reconnects and retries the operation.
 */
@Getter
public class InvalidMailboxStateException extends AssistantException {

    private final MailboxState actual;

    public InvalidMailboxStateException(String operation, MailboxState actual) {
        super("INVALID_MAILBOX_STATE", operation + " is not allowed in state " + actual);
        this.actual = actual;
    }
}
