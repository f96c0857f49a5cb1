package org.oddo.compiler.frontend.lexer;

/**
 * Finds the end of template literals and of their {@code ${...}} interpolations in raw source text.
 * <p>
 * An interpolation holds a full expression, so its closing brace is found by skipping nested braces,
 * string literals, nested templates and JSX elements. JSX text is not scanned for quotes, so an
 * apostrophe such as {@code <p>don't</p>} does not open a string.
 * <p>
 * All methods return {@code -1} when the input ends before the construct is closed.
 */
public final class InterpolationScanner {

    private InterpolationScanner() {
        // Utility class
    }

    /**
     * Finds the end of a template literal.
     * @param text The text to scan.
     * @param from The index just after the opening backtick.
     * @return The index just after the closing backtick, or {@code -1}.
     */
    public static int templateEnd(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '`') {
                return i + 1;
            }
            if (c == '\\') {
                i += 2;
            } else if (c == '$' && charAt(text, i + 1) == '{') {
                int close = closingBrace(text, i + 2);
                if (close < 0) {
                    return -1;
                }
                i = close + 1;
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * Finds the brace that closes an expression, such as the body of an interpolation.
     * @param text The text to scan.
     * @param from The index just after the opening brace.
     * @return The index of the closing {@code '}'}, or {@code -1}.
     */
    public static int closingBrace(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '}') {
                return i;
            }
            if (c == '{') {
                i = after(closingBrace(text, i + 1));
            } else if (c == '"' || c == '\'') {
                i = quoted(text, i + 1, c);
            } else if (c == '`') {
                i = templateEnd(text, i + 1);
            } else if (c == '<' && startsJsx(text, from, i)) {
                i = element(text, i + 1);
            } else {
                i++;
            }
            if (i < 0) {
                return -1;
            }
        }
        return -1;
    }

    // The same rule as the lexer: '<' opens JSX unless it follows an operand.
    private static boolean startsJsx(String text, int expressionStart, int index) {
        char next = charAt(text, index + 1);
        if (!isIdentifierStart(next) && next != '>') {
            return false;
        }
        int i = index - 1;
        while (i >= expressionStart && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        if (i < expressionStart) {
            return true;
        }
        char previous = text.charAt(i);
        return !(isIdentifierStart(previous) || Character.isDigit(previous)
                || previous == ')' || previous == ']' || previous == '}');
    }

    // 'from' is just after the '<'; returns the index after the element.
    private static int element(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '/' && charAt(text, i + 1) == '>') {
                return i + 2;
            }
            if (c == '>') {
                return children(text, i + 1);
            }
            if (c == '"' || c == '\'') {
                // Attribute strings have no escapes.
                int close = text.indexOf(c, i + 1);
                i = close < 0 ? -1 : close + 1;
            } else if (c == '{') {
                i = after(closingBrace(text, i + 1));
            } else {
                i++;
            }
            if (i < 0) {
                return -1;
            }
        }
        return -1;
    }

    private static int children(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '<' && charAt(text, i + 1) == '/') {
                int close = text.indexOf('>', i);
                return close < 0 ? -1 : close + 1;
            }
            if (c == '<') {
                i = element(text, i + 1);
            } else if (c == '{') {
                i = after(closingBrace(text, i + 1));
            } else {
                i++;
            }
            if (i < 0) {
                return -1;
            }
        }
        return -1;
    }

    private static int quoted(String text, int from, char quote) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n') {
                return -1;
            }
            i += c == '\\' ? 2 : 1;
        }
        return -1;
    }

    private static int after(int index) {
        return index < 0 ? -1 : index + 1;
    }

    private static char charAt(String text, int index) {
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }
}
