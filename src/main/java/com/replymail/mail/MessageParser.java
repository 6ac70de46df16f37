package com.replymail.mail;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.InboxMessage;
import com.replymail.domain.RawMessage;
import com.replymail.exception.MessageParseException;
import com.replymail.util.EmlParser;
import com.replymail.util.TextNormalizer;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw mailbox message -> InboxMessage
 * - Any declared charset decoded to UTF-8, bad bytes replaced
 * - Plain text body preferred, HTML stripped to text as fallback
 * - Attachments counted without decoding their payloads
 * - Links counted from plain text URLs and HTML anchors
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageParser {

    private static final Pattern URL_PATTERN =
            Pattern.compile("https?://[^\\s<>\"'()\\[\\]{}]+", Pattern.CASE_INSENSITIVE);
    private static final String BLOCK_TAGS = "p, div, li, tr, h1, h2, h3, h4, h5, h6, blockquote";
    private static final int MAX_MIME_DEPTH = 10;

    private final AssistantProperties properties;

    /**
     * Parse one fetched message
     *
     * @throws MessageParseException when the message is empty, oversized, or has no usable sender
     */
    public InboxMessage parse(RawMessage raw) {
        if (raw == null || raw.size() == 0) {
            throw new MessageParseException("Empty message" + (raw == null ? "" : " uid=" + raw.uid()));
        }
        long maxBytes = properties.getMail().getMaxMessageBytes();
        if (maxBytes > 0 && raw.size() > maxBytes) {
            throw new MessageParseException(String.format("Message uid=%d too large (%d bytes, limit %d)",
                    raw.uid(), raw.size(), maxBytes));
        }

        MimeMessage mime;
        try {
            mime = EmlParser.parse(raw.content());
        } catch (Exception e) {
            throw new MessageParseException("Unreadable message uid=" + raw.uid(), e);
        }

        try {
            InternetAddress sender = extractSender(mime, raw.uid());
            String senderAddress = TextNormalizer.clean(sender.getAddress()).toLowerCase(Locale.ROOT);
            String senderName = sender.getPersonal() != null && !sender.getPersonal().isBlank()
                    ? TextNormalizer.clean(sender.getPersonal())
                    : senderAddress;

            BodyParts parts = new BodyParts();
            collect(mime, parts, 0);

            String body;
            if (parts.plain != null) {
                body = parts.plain;
            } else if (parts.html != null) {
                body = htmlToText(parts.html);
            } else {
                body = "";
            }
            body = TextNormalizer.normalize(body);

            Set<String> links = new LinkedHashSet<>();
            collectUrls(parts.plain, links);
            if (parts.html != null) {
                collectAnchors(parts.html, links);
            }

            InboxMessage message = InboxMessage.builder()
                    .uid(raw.uid())
                    .folder(raw.folder())
                    .uidValidity(raw.uidValidity())
                    .messageIdHeader(EmlParser.extractMessageId(mime))
                    .senderAddress(senderAddress)
                    .senderName(senderName)
                    .subject(TextNormalizer.clean(EmlParser.extractSubject(mime)))
                    .body(body)
                    .attachmentCount(parts.attachments)
                    .linkCount(links.size())
                    .receivedAt(receivedAt(raw, mime))
                    .build();

            log.debug("Parsed uid={} from={} subject={} bodyLength={} attachments={} links={}",
                    raw.uid(), message.senderAddress(), message.subject(), body.length(),
                    parts.attachments, links.size());
            return message;

        } catch (MessageParseException e) {
            throw e;
        } catch (Exception e) {
            throw new MessageParseException("Malformed message uid=" + raw.uid(), e);
        }
    }

    private InternetAddress extractSender(MimeMessage mime, long uid) throws MessagingException {
        String header = mime.getHeader("From", ",");
        if (header == null || header.isBlank()) {
            header = mime.getHeader("Sender", ",");
        }
        if (header == null || header.isBlank()) {
            throw new MessageParseException("Missing sender in uid=" + uid);
        }
        Address[] from;
        try {
            from = InternetAddress.parseHeader(
                    EmlParser.decodeHeaderOctets(MimeUtility.unfold(header)), false);
        } catch (AddressException e) {
            throw new MessageParseException("Unparseable From header in uid=" + uid, e);
        }
        if (from == null || from.length == 0 || !(from[0] instanceof InternetAddress address)) {
            throw new MessageParseException("Missing sender in uid=" + uid);
        }
        String value = address.getAddress();
        if (value == null || value.isBlank() || !value.contains("@")) {
            throw new MessageParseException("Invalid sender address in uid=" + uid);
        }
        return address;
    }

    /**
     * Walk the MIME tree; first text/plain and first text/html win, every other leaf is an attachment
     */
    private void collect(Part part, BodyParts acc, int depth) throws MessagingException, IOException {
        if (depth > MAX_MIME_DEPTH) {
            return;
        }
        if (part.isMimeType("multipart/*")) {
            Object content = part.getContent();
            if (content instanceof Multipart multipart) {
                for (int i = 0; i < multipart.getCount(); i++) {
                    collect(multipart.getBodyPart(i), acc, depth + 1);
                }
            }
            return;
        }

        boolean attachedFile = Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition());
        if (!attachedFile && part.isMimeType("text/plain")) {
            if (acc.plain == null) {
                acc.plain = readText(part);
            }
            return;
        }
        if (!attachedFile && part.isMimeType("text/html")) {
            if (acc.html == null) {
                acc.html = readText(part);
            }
            return;
        }
        acc.attachments++;
    }

    private String readText(Part part) throws MessagingException, IOException {
        byte[] bytes;
        try (InputStream in = part.getInputStream()) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            // Unknown transfer encoding: fall back to the undecoded bytes
            bytes = readRaw(part);
        }

        String charsetName = null;
        try {
            charsetName = new ContentType(part.getContentType()).getParameter("charset");
        } catch (MessagingException e) {
            log.debug("Unparseable Content-Type: {}", part.getContentType());
        }
        if (charsetName == null || charsetName.isBlank()) {
            return TextNormalizer.decodeInferred(bytes);
        }
        try {
            return TextNormalizer.decode(bytes, Charset.forName(MimeUtility.javaCharset(charsetName.trim())));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.debug("Unsupported charset '{}', inferring", charsetName);
            return TextNormalizer.decodeInferred(bytes);
        }
    }

    private byte[] readRaw(Part part) throws MessagingException, IOException {
        InputStream raw;
        if (part instanceof MimeBodyPart bodyPart) {
            raw = bodyPart.getRawInputStream();
        } else if (part instanceof MimeMessage message) {
            raw = message.getRawInputStream();
        } else {
            return new byte[0];
        }
        try (InputStream in = raw) {
            return in.readAllBytes();
        }
    }

    private String htmlToText(String html) {
        Document doc = Jsoup.parse(html);
        doc.select("script, style, head").remove();
        for (Element br : doc.select("br")) {
            br.after(new TextNode("\n"));
        }
        for (Element block : doc.select(BLOCK_TAGS)) {
            block.before(new TextNode("\n"));
        }
        return doc.body().wholeText();
    }

    private void collectUrls(String text, Set<String> links) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            links.add(stripTrailingPunctuation(matcher.group()));
        }
    }

    private void collectAnchors(String html, Set<String> links) {
        Document doc = Jsoup.parse(html);
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("href").trim();
            String lower = href.toLowerCase(Locale.ROOT);
            if (lower.startsWith("http://") || lower.startsWith("https://")) {
                links.add(stripTrailingPunctuation(href));
            }
        }
        collectUrls(doc.text(), links);
    }

    private static String stripTrailingPunctuation(String url) {
        int end = url.length();
        while (end > 0 && ".,;:!?".indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }

    private static Instant receivedAt(RawMessage raw, MimeMessage mime) throws MessagingException {
        if (raw.internalDate() != null) {
            return raw.internalDate();
        }
        if (mime.getSentDate() != null) {
            return mime.getSentDate().toInstant();
        }
        return Instant.now();
    }

    private static final class BodyParts {
        private String plain;
        private String html;
        private int attachments;
    }
}
