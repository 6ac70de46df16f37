package com.replymail.domain;

import java.time.Instant;

/**
 * Undecoded message as fetched from the mailbox
 *
 * @param uid        protocol-assigned UID, unique within the folder
 * @param folder     folder the message was fetched from
 * @param uidValidity UIDVALIDITY of the folder at fetch time
 * @param content    raw RFC 5322 bytes
 * @param internalDate server receive date, may be null
 */
public record RawMessage(long uid, String folder, long uidValidity, byte[] content, Instant internalDate) {

    public int size() {
        return content == null ? 0 : content.length;
    }
}
