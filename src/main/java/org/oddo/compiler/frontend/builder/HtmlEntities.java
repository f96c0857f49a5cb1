package org.oddo.compiler.frontend.builder;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the named and numeric HTML character references allowed in JSX text.
 * Unknown named references are left as written.
 */
public final class HtmlEntities {

    private static final Pattern REFERENCE = Pattern.compile("&(#[0-9]+|#[xX][0-9a-fA-F]+|[a-zA-Z][a-zA-Z0-9]*);");

    private static final Map<String, String> NAMED = Map.ofEntries(
            Map.entry("nbsp", "\u00A0"),
            Map.entry("lt", "<"),
            Map.entry("gt", ">"),
            Map.entry("amp", "&"),
            Map.entry("quot", "\""),
            Map.entry("apos", "'"),
            Map.entry("cent", "¢"),
            Map.entry("pound", "£"),
            Map.entry("yen", "¥"),
            Map.entry("euro", "€"),
            Map.entry("copy", "©"),
            Map.entry("reg", "®"),
            Map.entry("trade", "™"),
            Map.entry("mdash", "—"),
            Map.entry("ndash", "–"),
            Map.entry("hellip", "…"),
            Map.entry("laquo", "«"),
            Map.entry("raquo", "»"),
            Map.entry("ldquo", "“"),
            Map.entry("rdquo", "”"),
            Map.entry("lsquo", "‘"),
            Map.entry("rsquo", "’"),
            Map.entry("bull", "•"),
            Map.entry("deg", "°"),
            Map.entry("plusmn", "±"),
            Map.entry("times", "×"),
            Map.entry("divide", "÷"),
            Map.entry("ne", "≠"),
            Map.entry("le", "≤"),
            Map.entry("ge", "≥"),
            Map.entry("infin", "∞"),
            Map.entry("sum", "∑"),
            Map.entry("prod", "∏"),
            Map.entry("larr", "←"),
            Map.entry("uarr", "↑"),
            Map.entry("rarr", "→"),
            Map.entry("darr", "↓"),
            Map.entry("harr", "↔")
    );

    private HtmlEntities() {
        // Utility class
    }

    /**
     * Replaces every known character reference in the given text.
     * @param text The raw JSX text.
     * @return The decoded text.
     */
    public static String decode(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement = resolve(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String resolve(String reference) {
        if (reference.charAt(0) != '#') {
            return NAMED.get(reference);
        }
        boolean hex = reference.length() > 1 && (reference.charAt(1) == 'x' || reference.charAt(1) == 'X');
        try {
            int codePoint = hex
                    ? Integer.parseInt(reference.substring(2), 16)
                    : Integer.parseInt(reference.substring(1));
            return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : null;
        } catch (NumberFormatException e) {
            // Too many digits for a code point; keep the reference as written.
            return null;
        }
    }
}
