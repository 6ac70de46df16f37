package com.replymail.mail;

import com.replymail.exception.InvalidMailboxStateException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;

/**
 * Inbound mailbox session context
 * Every state-changing operation is checked against the current state first
 */
@Slf4j
public class MailboxSession {

    @Getter
    private volatile MailboxState state = MailboxState.DISCONNECTED;

    /**
     * DISCONNECTED -> AUTHENTICATED
     */
    public synchronized void authenticated() {
        require("LOGIN", EnumSet.of(MailboxState.DISCONNECTED));
        transition(MailboxState.AUTHENTICATED);
    }

    /**
     * AUTHENTICATED | IDLE -> SELECTED
     */
    public synchronized void selected() {
        require("SELECT", EnumSet.of(MailboxState.AUTHENTICATED, MailboxState.IDLE));
        transition(MailboxState.SELECTED);
    }

    /**
     * SELECTED -> IDLE
     */
    public synchronized void released() {
        require("CLOSE", EnumSet.of(MailboxState.SELECTED));
        transition(MailboxState.IDLE);
    }

    /**
     * Any state -> DISCONNECTED
     */
    public synchronized void disconnected() {
        transition(MailboxState.DISCONNECTED);
    }

    /**
     * Operations that need an open folder (SEARCH, FETCH, STORE)
     */
    public void requireSelected(String operation) {
        require(operation, EnumSet.of(MailboxState.SELECTED));
    }

    public boolean isConnected() {
        return state != MailboxState.DISCONNECTED;
    }

    private void require(String operation, Set<MailboxState> allowed) {
        MailboxState current = state;
        if (!allowed.contains(current)) {
            throw new InvalidMailboxStateException(operation, current);
        }
    }

    private void transition(MailboxState next) {
        if (state != next) {
            log.debug("Mailbox session {} -> {}", state, next);
        }
        state = next;
    }
}
