package org.oddo.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param offset The zero-based character offset into the source text.
 * @param line   The one-based line number.
 * @param column The one-based column number.
 */
public record SourcePosition(int offset, int line, int column) {

    @Override
    public String toString() {
        return String.format("%d:%d (offset %d)", line, column, offset);
    }
}
