package org.oddo.compiler.frontend.lexer;

/**
 * Decodes JavaScript-style escape sequences. Used for string literals by the {@link Lexer}
 * and for the cooked text of template literals.
 */
public final class StringEscapes {

    private StringEscapes() {
        // Utility class
    }

    /**
     * Replaces every escape sequence in the given raw text with the character it denotes.
     * Unknown escapes such as {@code \q} stand for the escaped character itself, a backslash
     * followed by a line break is a line continuation and produces nothing.
     *
     * @param raw The raw literal content without delimiters.
     * @return The decoded value.
     * @throws IllegalArgumentException if a hex or unicode escape is malformed.
     */
    public static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                i = decode(raw, i + 1, out);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int decode(String text, int index, StringBuilder out) {
        char e = text.charAt(index);
        switch (e) {
            case 'n': out.append('\n'); return index + 1;
            case 't': out.append('\t'); return index + 1;
            case 'r': out.append('\r'); return index + 1;
            case 'b': out.append('\b'); return index + 1;
            case 'f': out.append('\f'); return index + 1;
            case 'v': out.append('\u000B'); return index + 1;
            case '0':
                if (index + 1 < text.length() && Character.isDigit(text.charAt(index + 1))) {
                    out.append('0');
                } else {
                    out.append('\0');
                }
                return index + 1;
            case 'x':
                return appendHex(text, index + 1, 2, out);
            case 'u':
                if (index + 1 < text.length() && text.charAt(index + 1) == '{') {
                    int close = text.indexOf('}', index + 2);
                    if (close < 0) {
                        throw new IllegalArgumentException("Invalid unicode escape sequence");
                    }
                    out.appendCodePoint(parseHex(text.substring(index + 2, close)));
                    return close + 1;
                }
                return appendHex(text, index + 1, 4, out);
            case '\r':
                return index + 1 < text.length() && text.charAt(index + 1) == '\n' ? index + 2 : index + 1;
            case '\n':
            case '\u2028':
            case '\u2029':
                return index + 1;
            default:
                out.append(e);
                return index + 1;
        }
    }

    private static int appendHex(String text, int from, int length, StringBuilder out) {
        if (from + length > text.length()) {
            throw new IllegalArgumentException("Invalid hexadecimal escape sequence");
        }
        out.appendCodePoint(parseHex(text.substring(from, from + length)));
        return from + length;
    }

    private static int parseHex(String digits) {
        if (digits.isEmpty() || digits.charAt(0) == '-' || digits.charAt(0) == '+') {
            throw new IllegalArgumentException("Invalid escape sequence with digits '" + digits + "'");
        }
        try {
            int codePoint = Integer.parseInt(digits, 16);
            if (codePoint > Character.MAX_CODE_POINT) {
                throw new IllegalArgumentException("Escape sequence out of range: " + digits);
            }
            return codePoint;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid escape sequence with digits '" + digits + "'", e);
        }
    }
}
