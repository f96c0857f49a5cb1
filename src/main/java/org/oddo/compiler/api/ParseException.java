package org.oddo.compiler.api;

import org.oddo.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by the parser when the token stream violates the grammar.
 * Carries every syntax error found in the input; no partial tree is produced.
 */
public class ParseException extends CompilationException {

    private final List<Diagnostic> diagnostics;

    /**
     * @param diagnostics All syntax errors collected during parsing. Must not be empty.
     */
    public ParseException(List<Diagnostic> diagnostics) {
        super(CompilerErrorCode.SYNTAX_ERROR, diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The collected syntax errors in the order they were found.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
