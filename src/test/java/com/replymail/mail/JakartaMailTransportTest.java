package com.replymail.mail;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.OutgoingReply;
import com.replymail.exception.TransientTransportException;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * JakartaMailTransport submission unit tests
 */
@ExtendWith(MockitoExtension.class)
class JakartaMailTransportTest {

    @Mock
    private Transport smtp;

    private JakartaMailTransport mailTransport;

    @BeforeEach
    void setUp() {
        AssistantProperties.Mail config = new AssistantProperties.Mail();
        config.setUsername("assistant@example.com");
        config.setPassword("secret");
        mailTransport = new JakartaMailTransport(config) {
            @Override
            Transport openSmtpTransport() {
                return smtp;
            }
        };
    }

    private static OutgoingReply reply() {
        return OutgoingReply.builder()
                .toAddress("alice@example.com")
                .toName("Alice")
                .subject("Re: Refund?")
                .body("Refunds take 10 days.")
                .inReplyTo("<q1@example.com>")
                .build();
    }

    @Test
    @DisplayName("Accepted message with a failing QUIT is not reported as a send failure")
    void testCloseFailureAfterDelivery() throws Exception {
        doThrow(new MessagingException("connection reset during QUIT")).when(smtp).close();

        assertThatCode(() -> mailTransport.send(reply())).doesNotThrowAnyException();

        verify(smtp, times(1)).sendMessage(any(Message.class), any(Address[].class));
        verify(smtp).close();
    }

    @Test
    @DisplayName("Threading headers set on the submitted message")
    void testThreadingHeaders() throws Exception {
        mailTransport.send(reply());

        ArgumentCaptor<Message> sent = ArgumentCaptor.forClass(Message.class);
        verify(smtp).sendMessage(sent.capture(), any(Address[].class));
        MimeMessage message = (MimeMessage) sent.getValue();
        assertThat(message.getHeader("In-Reply-To", null)).isEqualTo("<q1@example.com>");
        assertThat(message.getHeader("References", null)).isEqualTo("<q1@example.com>");
        assertThat(message.getSubject()).isEqualTo("Re: Refund?");
    }

    @Test
    @DisplayName("Submission failure stays transient and the connection is still closed")
    void testSubmissionFailure() throws Exception {
        doThrow(new MessagingException("451 local error")).when(smtp)
                .sendMessage(any(Message.class), any(Address[].class));

        assertThatThrownBy(() -> mailTransport.send(reply()))
                .isInstanceOf(TransientTransportException.class)
                .hasMessageContaining("451");

        verify(smtp).close();
    }
}
