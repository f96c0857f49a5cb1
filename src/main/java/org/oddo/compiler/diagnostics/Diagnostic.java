package org.oddo.compiler.diagnostics;

/**
 * Represents a single diagnostic message that occurs during the compilation process.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param sourceName The name of the source where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String sourceName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, sourceName, lineNumber, columnNumber, message);
    }
}
