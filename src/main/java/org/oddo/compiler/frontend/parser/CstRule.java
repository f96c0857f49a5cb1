package org.oddo.compiler.frontend.parser;

/**
 * The grammar rules that produce {@link CstNode}s.
 */
public enum CstRule {
    // Statements.
    PROGRAM,
    BLOCK,
    MODIFIER_BLOCK,
    EXPRESSION_STATEMENT,
    RETURN_STATEMENT,
    EXPORT_DEFAULT,
    EXPORT_NAMED,
    EXPORT_SPECIFIER,
    EXPORT_DECLARATION,
    IMPORT,
    IMPORT_NAMESPACE,
    IMPORT_SPECIFIER,

    // Precedence ladder, lowest first.
    ASSIGNMENT,
    CONDITIONAL,
    LOGICAL_OR,
    PIPE,
    COMPOSE,
    NULLISH_COALESCING,
    LOGICAL_AND,
    BITWISE_OR,
    BITWISE_XOR,
    BITWISE_AND,
    EQUALITY,
    RELATIONAL,
    SHIFT,
    ADDITIVE,
    MULTIPLICATIVE,
    EXPONENTIATION,
    UNARY,
    PREFIX_UPDATE,
    POSTFIX_UPDATE,
    CALL_CHAIN,

    // Links of a call chain.
    MEMBER,
    INDEX,
    SLICE,
    ARGUMENTS,
    TAGGED_TEMPLATE,

    // Primaries.
    LITERAL,
    IDENTIFIER,
    TEMPLATE,
    ARRAY,
    SPREAD,
    OBJECT,
    PROPERTY,
    COMPUTED_PROPERTY,
    SHORTHAND_PROPERTY,
    PARENTHESIZED,
    ARROW_FUNCTION,

    // JSX.
    JSX_ELEMENT,
    JSX_FRAGMENT,
    JSX_NAME,
    JSX_ATTRIBUTE,
    JSX_SPREAD_ATTRIBUTE,
    JSX_EXPRESSION
}
