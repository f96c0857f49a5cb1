package org.oddo.compiler.api;

/**
 * Thrown while normalizing the concrete syntax tree when a required substructure is missing
 * or a construct cannot be turned into a valid AST node.
 */
public class AstBuildException extends CompilationException {

    /**
     * @param code The error code.
     * @param message The detail message.
     */
    public AstBuildException(CompilerErrorCode code, String message) {
        super(code, message);
    }

    /**
     * @param code The error code.
     * @param message The detail message.
     * @param position The position of the offending construct.
     */
    public AstBuildException(CompilerErrorCode code, String message, SourcePosition position) {
        super(code, message, position);
    }
}
