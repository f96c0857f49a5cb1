package org.oddo.compiler.api;

/**
 * Thrown when a syntactically valid program cannot be lowered to JavaScript: an unknown modifier,
 * a {@code @mutate} value that is not a function, a declaration with an invalid target,
 * or a node the code generator does not handle.
 */
public class CompileException extends CompilationException {

    /**
     * @param code The error code.
     * @param message The detail message.
     */
    public CompileException(CompilerErrorCode code, String message) {
        super(code, message);
    }
}
