package org.oddo.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that starts no token. */
    UNRECOGNIZED_CHARACTER,
    /** A string literal without its closing quote. */
    UNTERMINATED_STRING,
    /** A template literal without its closing backtick. */
    UNTERMINATED_TEMPLATE,
    /** A block comment without its closing marker. */
    UNTERMINATED_COMMENT,
    /** A JSX element or fragment still open at the end of the input. */
    UNTERMINATED_JSX,
    /** A malformed escape sequence in a string literal. */
    INVALID_ESCAPE,
    /** A numeric literal that cannot be parsed. */
    INVALID_NUMBER,
    /** A dedent to a column that matches no enclosing indentation level. */
    INCONSISTENT_INDENTATION,
    // endregion

    // region Parser Errors
    /** One or more grammar violations. */
    SYNTAX_ERROR,
    // endregion

    // region AST Builder Errors
    /** A required part of a construct is missing. */
    MISSING_SUBSTRUCTURE,
    /** A rest element or rest property that is not in the last position. */
    REST_NOT_LAST,
    /** An expression used where a parameter or destructuring pattern is required. */
    INVALID_PATTERN,
    /** A cover-grammar construct (e.g. {@code {a = 1}}) used as an ordinary expression. */
    INVALID_EXPRESSION,
    // endregion

    // region Code Generation Errors
    /** A member access or array slice declared with {@code =} instead of {@code :=}. */
    INVALID_DECLARATION_TARGET,
    /** A modifier name with no registered rule. */
    UNKNOWN_MODIFIER,
    /** A {@code @mutate} value that is not an arrow function. */
    MUTATE_REQUIRES_FUNCTION,
    /** A node type the code generator does not handle. */
    UNSUPPORTED_NODE
    // endregion
}
