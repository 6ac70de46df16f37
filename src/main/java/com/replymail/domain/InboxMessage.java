package com.replymail.domain;

import lombok.Builder;

import java.time.Instant;
import java.util.Optional;

/**
 * Normalized inbound message. Immutable once parsed.
 * All text fields are NFC-normalized UTF-8 with exotic whitespace collapsed.
 */
@Builder
public record InboxMessage(
        long uid,
        String folder,
        long uidValidity,
        String messageIdHeader,
        String senderAddress,
        String senderName,
        String subject,
        String body,
        int attachmentCount,
        int linkCount,
        Instant receivedAt) {

    public Optional<String> messageId() {
        return Optional.ofNullable(messageIdHeader).filter(id -> !id.isBlank());
    }

    /**
     * Key under which the message is recorded in the processed ledger.
     * Message-ID when present, otherwise folder:uidvalidity:uid.
     */
    public String ledgerKey() {
        return messageId().orElse(folder + ":" + uidValidity + ":" + uid);
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
