package org.oddo.compiler.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * An engine for collecting the diagnostic messages
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param sourceName The source in which the error occurred.
     * @param line       The line number of the error.
     * @param column     The column number of the error.
     */
    public void reportError(String message, String sourceName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, sourceName, line, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns only the collected errors.
     *
     * @return The error diagnostics in reporting order.
     */
    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }
}
