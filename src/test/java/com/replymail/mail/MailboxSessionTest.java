package com.replymail.mail;

import com.replymail.exception.InvalidMailboxStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Mailbox session state machine unit tests
 */
class MailboxSessionTest {

    private MailboxSession session;

    @BeforeEach
    void setUp() {
        session = new MailboxSession();
    }

    @Test
    @DisplayName("Initial state: DISCONNECTED")
    void testInitialState() {
        assertThat(session.getState()).isEqualTo(MailboxState.DISCONNECTED);
        assertThat(session.isConnected()).isFalse();
    }

    @Test
    @DisplayName("LOGIN -> SELECT -> CLOSE -> SELECT")
    void testHappyPath() {
        session.authenticated();
        assertThat(session.getState()).isEqualTo(MailboxState.AUTHENTICATED);

        session.selected();
        assertThat(session.getState()).isEqualTo(MailboxState.SELECTED);
        session.requireSelected("FETCH");

        session.released();
        assertThat(session.getState()).isEqualTo(MailboxState.IDLE);
        assertThat(session.isConnected()).isTrue();

        session.selected();
        assertThat(session.getState()).isEqualTo(MailboxState.SELECTED);
    }

    @Test
    @DisplayName("SELECT before LOGIN is rejected")
    void testSelectBeforeLogin() {
        assertThatThrownBy(() -> session.selected())
                .isInstanceOf(InvalidMailboxStateException.class)
                .hasMessageContaining("SELECT")
                .hasMessageContaining("DISCONNECTED");
    }

    @Test
    @DisplayName("FETCH without a selected folder is rejected")
    void testFetchWithoutSelect() {
        session.authenticated();

        assertThatThrownBy(() -> session.requireSelected("FETCH"))
                .isInstanceOf(InvalidMailboxStateException.class)
                .satisfies(e -> assertThat(((InvalidMailboxStateException) e).getActual())
                        .isEqualTo(MailboxState.AUTHENTICATED));
    }

    @Test
    @DisplayName("Second LOGIN on a live session is rejected")
    void testDoubleLogin() {
        session.authenticated();

        assertThatThrownBy(() -> session.authenticated())
                .isInstanceOf(InvalidMailboxStateException.class);
    }

    @Test
    @DisplayName("Disconnect is allowed from any state")
    void testDisconnect() {
        session.authenticated();
        session.selected();

        session.disconnected();

        assertThat(session.getState()).isEqualTo(MailboxState.DISCONNECTED);
        session.disconnected();
        assertThat(session.getState()).isEqualTo(MailboxState.DISCONNECTED);
    }
}
