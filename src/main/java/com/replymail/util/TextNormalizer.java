package com.replymail.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Encoding-safe text utilities
 * - NFC composition
 * - Non-breaking and exotic whitespace collapsed to a plain space
 * - Zero-width characters and unpaired surrogates removed/replaced
 */
public final class TextNormalizer {

    private static final char REPLACEMENT = '\uFFFD';

    // NBSP, Ogham space, en/em spaces..hair space, narrow NBSP, medium math space, ideographic space
    private static final Pattern EXOTIC_SPACE =
            Pattern.compile("[\\u00A0\\u1680\\u2000-\\u200A\\u202F\\u205F\\u3000]");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B-\\u200D\\u2060\\uFEFF]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern HORIZONTAL_RUN = Pattern.compile("[ \\t]{2,}");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private TextNormalizer() {}

    /**
     * Normalize text for storage, matching and prompts
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String s = replaceUnpairedSurrogates(text);
        s = Normalizer.normalize(s, Normalizer.Form.NFC);
        s = s.replace("\r\n", "\n").replace('\r', '\n');
        s = EXOTIC_SPACE.matcher(s).replaceAll(" ");
        s = ZERO_WIDTH.matcher(s).replaceAll("");
        s = CONTROL.matcher(s).replaceAll("");
        s = HORIZONTAL_RUN.matcher(s).replaceAll(" ");
        s = BLANK_LINES.matcher(s).replaceAll("\n\n");
        return s.strip();
    }

    /**
     * Single-line variant for headers and log arguments
     */
    public static String clean(String text) {
        return normalize(text).replace('\n', ' ').replace('\t', ' ');
    }

    /**
     * Decode bytes; malformed or unmappable input becomes U+FFFD, never an error
     */
    public static String decode(byte[] bytes, Charset charset) {
        if (bytes == null || bytes.length == 0) {
            return "";
        }
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // unreachable with REPLACE actions
            return new String(bytes, charset);
        }
    }

    /**
     * Decode bytes with no declared charset: strict UTF-8 first, windows-1252 otherwise
     */
    public static String decodeInferred(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return "";
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return decode(bytes, Charset.forName("windows-1252"));
        }
    }

    /**
     * Truncate to at most maxChars, appending an ellipsis when cut
     */
    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "...";
    }

    private static String replaceUnpairedSurrogates(String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean broken = false;
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                    if (sb != null) {
                        sb.append(c).append(text.charAt(i + 1));
                    }
                    i++;
                    continue;
                }
                broken = true;
            } else if (Character.isLowSurrogate(c)) {
                broken = true;
            }
            if (broken && sb == null) {
                sb = new StringBuilder(text.length());
                sb.append(text, 0, i);
            }
            if (sb != null) {
                sb.append(broken ? REPLACEMENT : c);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
