package com.replymail.util;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * EML parsing utilities based on Jakarta Mail
 * Lenient: malformed encoded words and addresses tolerated.
 * Raw 8-bit header octets are kept one char per byte and decoded by {@link #decodeHeaderOctets}.
 */
public final class EmlParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.allowutf8", "false");
        props.setProperty("mail.mime.decodetext.strict", "false");
        props.setProperty("mail.mime.address.strict", "false");
        props.setProperty("mail.mime.parameters.strict", "false");
        props.setProperty("mail.mime.multipart.allowempty", "true");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws Exception {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        }
    }

    /**
     * Message-ID header, or null when the sender did not set one
     */
    public static String extractMessageId(MimeMessage message) throws Exception {
        String messageId = message.getMessageID();
        return messageId == null || messageId.isBlank() ? null : messageId.trim();
    }

    /**
     * Decoded Subject: raw 8-bit octets by inferred charset, then RFC 2047 encoded words
     */
    public static String extractSubject(MimeMessage message) throws Exception {
        String subject = decodeHeader(message.getHeader("Subject", null));
        return subject != null ? subject : "(No Subject)";
    }

    /**
     * Header value with raw octets and encoded words decoded; null stays null
     */
    public static String decodeHeader(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        String text = MimeUtility.unfold(decodeHeaderOctets(rawValue));
        try {
            return MimeUtility.decodeText(text);
        } catch (UnsupportedEncodingException e) {
            // unknown charset in an encoded word: keep the header as received
            return text;
        }
    }

    /**
     * Recover raw 8-bit header octets (parsed one char per byte) and decode them
     * as UTF-8 when valid, windows-1252 otherwise. Pure ASCII is returned unchanged.
     */
    public static String decodeHeaderOctets(String rawValue) {
        if (rawValue == null || rawValue.chars().allMatch(c -> c < 0x80)) {
            return rawValue;
        }
        if (rawValue.chars().anyMatch(c -> c > 0xFF)) {
            return rawValue;
        }
        return TextNormalizer.decodeInferred(rawValue.getBytes(StandardCharsets.ISO_8859_1));
    }
}
