package org.oddo.compiler.api;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and the common base of the phase-specific failures
 * ({@link LexException}, {@link ParseException}, {@link AstBuildException}, {@link CompileException}).
 * Callers usually only need {@link #getMessage()} to present the failure to a user.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode code;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param code The error code classifying the failure.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode code, String message) {
        super(message, null);
        this.code = code;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param code The error code classifying the failure.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and source position.
     * @param code The error code classifying the failure.
     * @param message The detail message.
     * @param position The position in the source the failure refers to.
     */
    public CompilationException(CompilerErrorCode code, String message, SourcePosition position) {
        super(String.format("%s at %s", message, position), null);
        this.code = code;
    }

    /**
     * @return The error code classifying this failure.
     */
    public CompilerErrorCode getCode() {
        return code;
    }
}
