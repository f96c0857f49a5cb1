package org.oddo.compiler.frontend.lexer;

import org.oddo.compiler.api.SourcePosition;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., IDENTIFIER, NUMBER, JSX_TEXT).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (e.g., the numeric value of a number,
 *              the decoded content of a string or the name of a modifier), or {@code null}.
 * @param start The zero-based offset of the first character of the token.
 * @param end The zero-based offset just past the last character of the token.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int start,
        int end,
        int line,
        int column
) {

    /**
     * @return The position of the first character of this token.
     */
    public SourcePosition position() {
        return new SourcePosition(start, line, column);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
