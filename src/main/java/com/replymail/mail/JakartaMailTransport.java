package com.replymail.mail;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.OutgoingReply;
import com.replymail.domain.RawMessage;
import com.replymail.exception.AssistantException;
import com.replymail.exception.InvalidMailboxStateException;
import com.replymail.exception.MailAuthenticationException;
import com.replymail.exception.MailSendException;
import com.replymail.exception.TransientTransportException;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.Transport;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.FlagTerm;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * Jakarta Mail transport
 * - IMAP(S) inbound: login, select, search UNSEEN, fetch with PEEK, flag SEEN
 * - SMTP submission with STARTTLS or implicit TLS
 * - Invalid session state triggers one reconnect and retry
 */
@Slf4j
public class JakartaMailTransport implements MailTransport {

    private static final String CHARSET = "UTF-8";

    private final AssistantProperties.Mail config;
    private final String storeProtocol;
    private final Session imapSession;
    private final Session smtpSession;
    private final MailboxSession session = new MailboxSession();

    private Store store;
    private Folder folder;

    public JakartaMailTransport(AssistantProperties.Mail config) {
        this.config = config;
        this.storeProtocol = config.isImapSsl() ? "imaps" : "imap";
        this.imapSession = Session.getInstance(buildImapProperties());
        this.smtpSession = Session.getInstance(buildSmtpProperties());
        this.imapSession.setDebug(config.isDebug());
        this.smtpSession.setDebug(config.isDebug());
    }

    private Properties buildImapProperties() {
        String p = "mail." + storeProtocol;
        Properties props = new Properties();
        props.put("mail.store.protocol", storeProtocol);
        props.put(p + ".host", config.getImapHost());
        props.put(p + ".port", String.valueOf(config.getImapPort()));
        props.put(p + ".ssl.enable", String.valueOf(config.isImapSsl()));
        props.put(p + ".connectiontimeout", String.valueOf(config.getConnectionTimeout()));
        props.put(p + ".timeout", String.valueOf(config.getTimeout()));
        // BODY.PEEK: fetching must not set \Seen
        props.put(p + ".peek", "true");
        props.put("mail.mime.charset", CHARSET);
        props.put("mail.mime.address.strict", "false");
        return props;
    }

    private Properties buildSmtpProperties() {
        Properties props = new Properties();
        props.put("mail.smtp.host", config.getSmtpHost());
        props.put("mail.smtp.port", String.valueOf(config.getSmtpPort()));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", String.valueOf(config.isSmtpStartTls()));
        props.put("mail.smtp.starttls.required", String.valueOf(config.isSmtpStartTls()));
        props.put("mail.smtp.ssl.enable", String.valueOf(config.isSmtpSsl()));
        props.put("mail.smtp.connectiontimeout", String.valueOf(config.getConnectionTimeout()));
        props.put("mail.smtp.timeout", String.valueOf(config.getTimeout()));
        props.put("mail.smtp.writetimeout", String.valueOf(config.getTimeout()));
        props.put("mail.mime.charset", CHARSET);
        return props;
    }

    @Override
    public synchronized List<RawMessage> fetchUnread(int limit) {
        try {
            return doFetchUnread(limit);
        } catch (InvalidMailboxStateException e) {
            log.warn("Mailbox session in state {} during fetch, reconnecting", e.getActual());
            disconnect();
            return doFetchUnread(limit);
        }
    }

    private List<RawMessage> doFetchUnread(int limit) {
        ensureSelected();
        session.requireSelected("SEARCH");
        try {
            UIDFolder uidFolder = (UIDFolder) folder;
            long uidValidity = uidFolder.getUIDValidity();

            Message[] unread = folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
            FetchProfile profile = new FetchProfile();
            profile.add(UIDFolder.FetchProfileItem.UID);
            folder.fetch(unread, profile);

            List<Message> ordered = new ArrayList<>(Arrays.asList(unread));
            ordered.sort(Comparator.comparingLong(m -> uidOf(uidFolder, m)));
            if (limit > 0 && ordered.size() > limit) {
                log.info("{} unread messages, fetching the oldest {}", ordered.size(), limit);
                ordered = ordered.subList(0, limit);
            }

            session.requireSelected("FETCH");
            List<RawMessage> result = new ArrayList<>(ordered.size());
            for (Message message : ordered) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                message.writeTo(out);
                Date received = message.getReceivedDate();
                result.add(new RawMessage(
                        uidFolder.getUID(message),
                        folder.getFullName(),
                        uidValidity,
                        out.toByteArray(),
                        received == null ? null : received.toInstant()));
            }
            log.info("Fetched {} unread message(s) from {}", result.size(), config.getFolder());
            return result;

        } catch (MessagingException e) {
            throw translate("fetch", e);
        } catch (IOException e) {
            throw new TransientTransportException("Message download interrupted", e);
        }
    }

    private static long uidOf(UIDFolder uidFolder, Message message) {
        try {
            return uidFolder.getUID(message);
        } catch (MessagingException e) {
            throw new TransientTransportException("UID lookup failed", e);
        }
    }

    @Override
    public synchronized void markRead(long uid) {
        try {
            doMarkRead(uid);
        } catch (InvalidMailboxStateException e) {
            log.warn("Mailbox session in state {} during mark-read, reconnecting", e.getActual());
            disconnect();
            ensureSelected();
            doMarkRead(uid);
        }
    }

    private void doMarkRead(long uid) {
        session.requireSelected("STORE");
        try {
            Message message = ((UIDFolder) folder).getMessageByUID(uid);
            if (message == null) {
                log.warn("Message uid={} no longer in {}", uid, config.getFolder());
                return;
            }
            message.setFlag(Flags.Flag.SEEN, true);
            log.debug("Marked uid={} as read", uid);
        } catch (MessagingException e) {
            throw translate("markRead", e);
        }
    }

    @Override
    public void send(OutgoingReply reply) {
        try {
            MimeMessage message = new MimeMessage(smtpSession);
            message.setFrom(new InternetAddress(config.getEffectiveFromAddress(), config.getFromName(), CHARSET));
            message.setRecipient(Message.RecipientType.TO,
                    new InternetAddress(reply.toAddress(), reply.toName(), CHARSET));
            message.setSubject(reply.subject(), CHARSET);
            if (reply.inReplyTo() != null && !reply.inReplyTo().isBlank()) {
                message.setHeader("In-Reply-To", reply.inReplyTo());
                message.setHeader("References", reply.inReplyTo());
            }
            message.setText(reply.body(), CHARSET);
            message.setSentDate(new Date());
            message.saveChanges();

            Transport transport = openSmtpTransport();
            try {
                transport.connect(config.getSmtpHost(), config.getSmtpPort(),
                        config.getUsername(), config.getPassword());
                transport.sendMessage(message, message.getAllRecipients());
                log.info("Reply sent to {} subject={}", reply.toAddress(), reply.subject());
            } finally {
                closeSmtpTransport(transport);
            }

        } catch (SendFailedException e) {
            if (e.getInvalidAddresses() != null && e.getInvalidAddresses().length > 0) {
                throw new MailSendException("Recipient rejected: " + reply.toAddress(), e);
            }
            throw new TransientTransportException("Submission refused: " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw translate("send", e);
        } catch (UnsupportedEncodingException e) {
            throw new MailSendException("Unencodable address for " + reply.toAddress(), e);
        }
    }

    Transport openSmtpTransport() throws MessagingException {
        return smtpSession.getTransport("smtp");
    }

    /**
     * QUIT failures never fail the send: the message was already accepted, or the primary error is propagating.
     */
    private void closeSmtpTransport(Transport transport) {
        try {
            transport.close();
        } catch (MessagingException e) {
            log.warn("SMTP connection close failed: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void disconnect() {
        try {
            if (folder != null && folder.isOpen()) {
                folder.close(false);
            }
            if (session.getState() == MailboxState.SELECTED) {
                session.released();
            }
            if (store != null && store.isConnected()) {
                store.close();
                log.info("Disconnected from {}", config.getImapHost());
            }
        } catch (MessagingException e) {
            log.warn("Error closing mailbox connection: {}", e.getMessage());
        } finally {
            folder = null;
            store = null;
            session.disconnected();
        }
    }

    @Override
    public MailboxState state() {
        return session.getState();
    }

    private void ensureSelected() {
        try {
            if (session.getState() == MailboxState.SELECTED
                    && (folder == null || !folder.isOpen() || store == null || !store.isConnected())) {
                log.warn("Mailbox connection lost, resetting session");
                disconnect();
            }
            if (session.getState() == MailboxState.DISCONNECTED) {
                connect();
            }
            if (session.getState() != MailboxState.SELECTED) {
                openFolder();
            }
        } catch (MessagingException e) {
            throw translate("select", e);
        }
    }

    private void connect() throws MessagingException {
        store = imapSession.getStore(storeProtocol);
        store.connect(config.getImapHost(), config.getImapPort(), config.getUsername(), config.getPassword());
        session.authenticated();
        log.info("Connected to {}:{} as {}", config.getImapHost(), config.getImapPort(), config.getUsername());
    }

    private void openFolder() throws MessagingException {
        Folder candidate = store.getFolder(config.getFolder());
        if (candidate == null || !candidate.exists()) {
            throw new AssistantException("FOLDER_NOT_FOUND", "Folder '" + config.getFolder() + "' does not exist");
        }
        candidate.open(Folder.READ_WRITE);
        folder = candidate;
        session.selected();
    }

    private RuntimeException translate(String operation, MessagingException e) {
        if (e instanceof AuthenticationFailedException) {
            log.error("Mailbox authentication failed for '{}': {}", config.getUsername(), e.getMessage());
            return new MailAuthenticationException("Authentication rejected during " + operation, e);
        }
        log.warn("Mailbox {} failed: {}", operation, e.getMessage());
        return new TransientTransportException(operation + " failed: " + e.getMessage(), e);
    }
}
