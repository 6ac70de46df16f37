package com.replymail.domain;

import lombok.Builder;

import java.util.Locale;

/**
 * Reply ready for submission
 */
@Builder
public record OutgoingReply(
        String toAddress,
        String toName,
        String subject,
        String body,
        String inReplyTo) {

    private static final String REPLY_PREFIX = "Re: ";

    /**
     * Reply addressed to the sender, threaded on the inbound Message-ID
     */
    public static OutgoingReply answering(InboxMessage message, String body) {
        return OutgoingReply.builder()
                .toAddress(message.senderAddress())
                .toName(message.senderName())
                .subject(replySubject(message.subject()))
                .body(body)
                .inReplyTo(message.messageId().orElse(null))
                .build();
    }

    /**
     * "Re: " prefix unless the subject already carries one
     */
    public static String replySubject(String subject) {
        String base = subject == null ? "" : subject.strip();
        if (base.toLowerCase(Locale.ROOT).startsWith("re:")) {
            return base;
        }
        return REPLY_PREFIX + base;
    }
}
