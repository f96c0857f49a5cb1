package org.oddo.compiler.api;

/**
 * Thrown by the lexer when the source contains input it cannot tokenize.
 */
public class LexException extends CompilationException {

    private final SourcePosition position;

    /**
     * @param code The error code.
     * @param message The detail message, without position information.
     * @param position Where the offending input starts.
     */
    public LexException(CompilerErrorCode code, String message, SourcePosition position) {
        super(code, message, position);
        this.position = position;
    }

    /**
     * @return The position of the offending input.
     */
    public SourcePosition getPosition() {
        return position;
    }

    /**
     * @return The zero-based character offset of the offending input.
     */
    public int getOffset() {
        return position.offset();
    }
}
