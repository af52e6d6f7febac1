package ai.attackframework.tools.searchengine.template;

import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding helpers for URL templates.
 *
 * <p>{@link #encodeTerm} encodes everything except RFC 3986 unreserved characters.
 * The lenient variants only escape what would make {@link java.net.URI} reject the
 * string and keep existing {@code %XX} escapes untouched.</p>
 */
public final class UriEncoding {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final String ILLEGAL_IN_URI = "\"<>\\^`{|}";
    private static final String RESERVED_IN_QUERY_COMPONENT = "&=+#;";

    private UriEncoding() {}

    /**
     * Encodes a user-supplied search term.
     *
     * @param term raw term; {@code null} is treated as empty
     * @return term with all non-unreserved UTF-8 bytes as {@code %XX}
     */
    public static String encodeTerm(String term) {
        if (term == null || term.isEmpty()) return "";
        StringBuilder out = new StringBuilder(term.length() * 3);
        for (byte b : term.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (isUnreserved(c)) {
                out.append((char) c);
            } else {
                appendEscaped(out, c);
            }
        }
        return out.toString();
    }

    /** Escapes only characters that are illegal anywhere in a URI. */
    public static String lenient(String raw) {
        return escape(raw, "");
    }

    /** Like {@link #lenient} but also escapes query delimiters, for keys and values. */
    public static String queryComponent(String raw) {
        return escape(raw, RESERVED_IN_QUERY_COMPONENT);
    }

    private static String escape(String raw, String extra) {
        if (raw == null || raw.isEmpty()) return "";
        StringBuilder out = new StringBuilder(raw.length() + 16);
        int i = 0;
        while (i < raw.length()) {
            char ch = raw.charAt(i);
            if (ch == '%' && isEscapeAt(raw, i)) {
                out.append(raw, i, i + 3);
                i += 3;
                continue;
            }
            if (ch == '%' || ch <= 0x20 || ch >= 0x7F || ILLEGAL_IN_URI.indexOf(ch) >= 0 || extra.indexOf(ch) >= 0) {
                int cp = raw.codePointAt(i);
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    appendEscaped(out, b & 0xFF);
                }
                i += Character.charCount(cp);
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean isEscapeAt(String s, int i) {
        return i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2));
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

    private static void appendEscaped(StringBuilder out, int c) {
        out.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
    }
}
