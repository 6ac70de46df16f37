package com.replymail.mail;

/**
 * Inbound mailbox session state machine (4-state model)
 */
public enum MailboxState {
    /** No store connection */
    DISCONNECTED,
    /** Logged in - no folder open */
    AUTHENTICATED,
    /** A folder is open - search, fetch and flag operations allowed */
    SELECTED,
    /** Folder released after a batch, store connection kept */
    IDLE
}
