package org.oddo.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier, such as a variable name. Inside JSX tags it may contain '-'. */
    IDENTIFIER,
    /** A numeric literal (decimal, hex, binary or octal). */
    NUMBER,
    /** A string literal in single or double quotes. */
    STRING,
    /** A template literal including its backticks. */
    TEMPLATE,
    /** A modifier such as {@code @state}; the value holds the name without '@'. */
    MODIFIER,

    // Keywords.
    RETURN,
    TRUE,
    FALSE,
    NULL,
    TYPEOF,
    VOID,
    DELETE,
    INSTANCEOF,
    IN,
    EXPORT,
    IMPORT,
    DEFAULT,

    // Punctuation.
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    DOT,
    /** The '...' token, used for spreads, rest elements and array slices. */
    ELLIPSIS,
    SEMICOLON,
    COLON,
    QUESTION,
    /** The '?.' optional chaining token. */
    QUESTION_DOT,
    /** The '=>' token separating arrow function parameters from the body. */
    ARROW,

    // Operators.
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    STAR_STAR,
    PLUS_PLUS,
    MINUS_MINUS,
    LESS,
    GREATER,
    LESS_EQUAL,
    GREATER_EQUAL,
    EQUAL_EQUAL,
    BANG_EQUAL,
    AMP,
    PIPE,
    CARET,
    TILDE,
    BANG,
    AMP_AMP,
    PIPE_PIPE,
    QUESTION_QUESTION,
    SHIFT_LEFT,
    SHIFT_RIGHT,
    SHIFT_RIGHT_UNSIGNED,
    /** The pipe operator '|>'. */
    PIPE_GREATER,
    /** The compose operator '&lt;|'. */
    LESS_PIPE,

    // Declaration and assignment.
    /** The '=' token: a declaration in statements, a default value in patterns and JSX attributes. */
    EQUAL,
    /** The ':=' assignment token. */
    COLON_EQUAL,
    /** A compound assignment such as '+:=' or '>>>:='; the text holds the exact spelling. */
    COMPOUND_ASSIGN,

    // JSX.
    /** The '&lt;' that opens a JSX element or fragment. */
    JSX_TAG_OPEN,
    /** The '&lt;/' that opens a JSX closing tag. */
    JSX_CLOSE_TAG_OPEN,
    /** The '&gt;' that ends a JSX opening or closing tag. */
    JSX_TAG_END,
    /** The '/&gt;' that ends a self-closing JSX element. */
    JSX_SELF_CLOSE,
    /** A raw run of JSX child text, whitespace included. */
    JSX_TEXT,

    // Layout.
    /** The end of a logical line outside any bracket or JSX context. */
    NEWLINE,
    /** An increase of the indentation level. */
    INDENT,
    /** A decrease of the indentation level. */
    DEDENT,
    /** Represents the end of the source file. */
    END_OF_FILE
}
