package mirror.email.app.provider;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Builds the RFC 822 bytes of a plain-text message.
 * No Date or Message-ID header is written, so equal inputs give equal bytes.
 */
public class RawMessageBuilder {
    private static final String CRLF = "\r\n";
    // 39 bytes encode to 52 base64 chars; with "=?UTF-8?B?" and "?=" a word is 64 chars,
    // so even the first line after "Subject: " stays within 76
    private static final int MAX_ENCODED_WORD_BYTES = 39;

    public byte[] build(String to, String subject, String body) {
        StringBuilder raw = new StringBuilder();
        raw.append("To: ").append(stripLineBreaks(to)).append(CRLF);
        raw.append("Subject: ").append(encodeHeader(subject == null ? "" : subject)).append(CRLF);
        raw.append("MIME-Version: 1.0").append(CRLF);
        raw.append("Content-Type: text/plain; charset=\"UTF-8\"").append(CRLF);
        raw.append("Content-Transfer-Encoding: 8bit").append(CRLF);
        raw.append(CRLF);
        raw.append(normalizeLineEndings(body == null ? "" : body));
        return raw.toString().getBytes(StandardCharsets.UTF_8);
    }

    static String encodeHeader(String value) {
        String singleLine = stripLineBreaks(value);
        boolean ascii = singleLine.chars().allMatch(c -> c >= 0x20 && c < 0x7f);
        if (ascii) {
            return singleLine;
        }
        // RFC 2047 encoded words, split on code point boundaries and folded onto continuation lines
        StringBuilder encoded = new StringBuilder();
        int start = 0;
        while (start < singleLine.length()) {
            int end = start;
            int bytes = 0;
            while (end < singleLine.length()) {
                int codePoint = singleLine.codePointAt(end);
                int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
                if (bytes + width > MAX_ENCODED_WORD_BYTES) {
                    break;
                }
                bytes += width;
                end += Character.charCount(codePoint);
            }
            if (encoded.length() > 0) {
                encoded.append(CRLF).append(' ');
            }
            byte[] chunk = singleLine.substring(start, end).getBytes(StandardCharsets.UTF_8);
            encoded.append("=?UTF-8?B?").append(Base64.getEncoder().encodeToString(chunk)).append("?=");
            start = end;
        }
        return encoded.toString();
    }

    private static String stripLineBreaks(String value) {
        return value.replace("\r", "").replace("\n", " ");
    }

    private static String normalizeLineEndings(String body) {
        return body.replace("\r\n", "\n").replace("\r", "\n").replace("\n", CRLF);
    }
}
