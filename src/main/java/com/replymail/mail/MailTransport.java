package com.replymail.mail;

import com.replymail.domain.OutgoingReply;
import com.replymail.domain.RawMessage;

import java.util.List;

/**
 * Mailbox transport: inbound scan and outbound submission
 */
public interface MailTransport extends AutoCloseable {

    /**
     * Open the inbox and return unread messages, oldest UID first.
     * Messages are not flagged as read.
     *
     * @param limit maximum number of messages to download, 0 for no limit
     */
    List<RawMessage> fetchUnread(int limit);

    /**
     * Set the read flag on one message of the selected folder
     */
    void markRead(long uid);

    /**
     * Authenticated submission of one reply
     */
    void send(OutgoingReply reply);

    /**
     * Release the folder and the store connection
     */
    void disconnect();

    MailboxState state();

    @Override
    default void close() {
        disconnect();
    }
}
