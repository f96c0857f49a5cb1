package org.oddo.compiler.frontend.parser;

import org.oddo.compiler.api.ParseException;
import org.oddo.compiler.diagnostics.DiagnosticsEngine;
import org.oddo.compiler.frontend.lexer.Token;
import org.oddo.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static org.oddo.compiler.frontend.lexer.TokenType.*;

/**
 * The main parser for the Oddo language. It consumes a list of tokens
 * from the {@link org.oddo.compiler.frontend.lexer.Lexer} and produces a concrete syntax tree (CST).
 * <p>
 * Expressions are parsed by recursive descent over the precedence ladder
 * assignment, conditional, logicalOr, pipe, compose, nullishCoalescing, logicalAnd, bitwise or/xor/and,
 * equality, relational, shift, additive, multiplicative, exponentiation, unary, postfix, call chain, primary.
 * <p>
 * Syntax errors are reported to the {@link DiagnosticsEngine}; the parser then resynchronizes at the next
 * statement so that all errors of the input are collected. If any error was reported, no tree is returned
 * and a {@link ParseException} carrying every error is thrown instead.
 */
public class Parser {

    private static final Set<TokenType> LAYOUT = EnumSet.of(NEWLINE, INDENT, DEDENT);
    private static final Set<TokenType> KEYWORDS = EnumSet.of(
            RETURN, TRUE, FALSE, NULL, TYPEOF, VOID, DELETE, INSTANCEOF, IN, EXPORT, IMPORT, DEFAULT);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String sourceName;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors.
     * @param sourceName The name of the source, used in error messages.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String sourceName) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.sourceName = sourceName;
    }

    /**
     * Creates a parser for a standalone expression. Layout tokens are irrelevant inside a single
     * expression and are dropped, so the expression may span several lines.
     * @param tokens The tokens of the expression source.
     * @param diagnostics The engine for reporting errors.
     * @param sourceName The name of the source, used in error messages.
     * @return A parser positioned at the start of the expression.
     */
    public static Parser forExpression(List<Token> tokens, DiagnosticsEngine diagnostics, String sourceName) {
        List<Token> filtered = tokens.stream().filter(t -> !LAYOUT.contains(t.type())).toList();
        return new Parser(filtered, diagnostics, sourceName);
    }

    /**
     * Parses the entire token stream as a program.
     * @return The {@link CstRule#PROGRAM} node holding one child per statement.
     * @throws ParseException if the tokens violate the grammar.
     */
    public CstNode parseProgram() throws ParseException {
        List<CstElement> statements = new ArrayList<>();
        skipSeparators();
        while (!isAtEnd()) {
            CstNode statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
            skipSeparators();
        }
        if (diagnostics.hasErrors()) {
            throw new ParseException(diagnostics.getErrors());
        }
        return new CstNode(CstRule.PROGRAM, statements);
    }

    /**
     * Parses the entire token stream as a single expression.
     * @return The CST of the expression.
     * @throws ParseException if the tokens do not form exactly one expression.
     */
    public CstNode parseExpression() throws ParseException {
        try {
            CstNode expression = expression();
            if (!isAtEnd()) {
                throw error(peek(), "Unexpected " + describe(peek()) + " after expression");
            }
            return expression;
        } catch (SyntaxError e) {
            throw new ParseException(diagnostics.getErrors());
        }
    }

    // region Statements

    private CstNode declaration() {
        try {
            CstNode statement = statement();
            endOfStatement();
            return statement;
        } catch (SyntaxError e) {
            synchronize();
            return null;
        }
    }

    private CstNode statement() {
        if (check(MODIFIER) && checkNext(COLON)) {
            return modifierBlock();
        }
        if (check(EXPORT)) {
            return exportStatement();
        }
        if (check(IMPORT)) {
            return importStatement();
        }
        if (check(INDENT)) {
            throw error(peek(), "Unexpected indentation");
        }
        List<CstElement> parts = new ArrayList<>();
        if (check(MODIFIER)) {
            parts.add(leaf(advance()));
        }
        if (match(RETURN)) {
            parts.add(leaf(previous()));
            if (!atStatementEnd()) {
                parts.add(expression());
            }
            return new CstNode(CstRule.RETURN_STATEMENT, parts);
        }
        parts.add(expression());
        return new CstNode(CstRule.EXPRESSION_STATEMENT, parts);
    }

    private void endOfStatement() {
        if (match(NEWLINE, SEMICOLON)) {
            return;
        }
        if (atStatementEnd() || previous().type() == DEDENT) {
            return;
        }
        throw error(peek(), "Expected end of statement but found " + describe(peek())
                + " (statements must be on separate lines)");
    }

    private boolean atStatementEnd() {
        return check(NEWLINE) || check(SEMICOLON) || check(DEDENT) || isAtEnd();
    }

    private CstNode modifierBlock() {
        Token modifier = advance();
        Token colon = advance();
        return node(CstRule.MODIFIER_BLOCK, leaf(modifier), leaf(colon), block("'" + modifier.text() + ":'"));
    }

    private CstNode block(String header) {
        consume(NEWLINE, "Expected a line break after " + header);
        consume(INDENT, "Expected an indented block after " + header);
        List<CstElement> statements = new ArrayList<>();
        skipSeparators();
        while (!check(DEDENT) && !isAtEnd()) {
            CstNode statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
            skipSeparators();
        }
        consume(DEDENT, "Expected the end of the indented block");
        return new CstNode(CstRule.BLOCK, statements);
    }

    private CstNode exportStatement() {
        Token export = advance();
        if (match(DEFAULT)) {
            return node(CstRule.EXPORT_DEFAULT, leaf(export), leaf(previous()), expression());
        }
        if (match(LEFT_BRACE)) {
            List<CstElement> parts = new ArrayList<>(List.of(leaf(export), leaf(previous())));
            while (!check(RIGHT_BRACE)) {
                List<CstElement> specifier = new ArrayList<>();
                specifier.add(leaf(consume(IDENTIFIER, "Expected an exported name")));
                if (matchContextual("as")) {
                    specifier.add(leaf(previous()));
                    specifier.add(leaf(check(DEFAULT) ? advance() : consume(IDENTIFIER, "Expected a name after 'as'")));
                }
                parts.add(new CstNode(CstRule.EXPORT_SPECIFIER, specifier));
                if (!match(COMMA)) {
                    break;
                }
            }
            parts.add(leaf(consume(RIGHT_BRACE, "Expected '}' after export specifiers")));
            return new CstNode(CstRule.EXPORT_NAMED, parts);
        }
        return node(CstRule.EXPORT_DECLARATION, leaf(export), expression());
    }

    private CstNode importStatement() {
        List<CstElement> parts = new ArrayList<>();
        parts.add(leaf(advance()));
        if (match(STAR)) {
            parts.add(leaf(previous()));
            parts.add(leaf(consumeContextual("as", "Expected 'as' after 'import *'")));
            parts.add(leaf(consume(IDENTIFIER, "Expected a namespace name")));
            parts.add(leaf(consumeContextual("from", "Expected 'from' after the namespace name")));
            parts.add(leaf(consume(STRING, "Expected a module name string")));
            return new CstNode(CstRule.IMPORT_NAMESPACE, parts);
        }
        boolean hasBindings = false;
        if (check(IDENTIFIER) && !checkContextual("from")) {
            parts.add(leaf(advance()));
            hasBindings = true;
            if (match(COMMA)) {
                parts.add(leaf(previous()));
                if (!check(LEFT_BRACE)) {
                    throw error(peek(), "Expected '{' after ',' in import");
                }
            }
        }
        if (match(LEFT_BRACE)) {
            hasBindings = true;
            parts.add(leaf(previous()));
            while (!check(RIGHT_BRACE)) {
                List<CstElement> specifier = new ArrayList<>();
                specifier.add(leaf(check(DEFAULT) ? advance() : consume(IDENTIFIER, "Expected an imported name")));
                if (matchContextual("as")) {
                    specifier.add(leaf(previous()));
                    specifier.add(leaf(consume(IDENTIFIER, "Expected a local name after 'as'")));
                }
                parts.add(new CstNode(CstRule.IMPORT_SPECIFIER, specifier));
                if (!match(COMMA)) {
                    break;
                }
            }
            parts.add(leaf(consume(RIGHT_BRACE, "Expected '}' after import specifiers")));
        }
        if (!hasBindings) {
            throw error(peek(), "Expected import bindings but found " + describe(peek()));
        }
        parts.add(leaf(consumeContextual("from", "Expected 'from' in import")));
        parts.add(leaf(consume(STRING, "Expected a module name string")));
        return new CstNode(CstRule.IMPORT, parts);
    }

    // endregion

    // region Expressions

    private CstNode expression() {
        return assignment();
    }

    private CstNode assignment() {
        CstNode target = conditional();
        if (matchOperator(EQUAL, COLON_EQUAL, COMPOUND_ASSIGN)) {
            Token operator = previous();
            return node(CstRule.ASSIGNMENT, target, leaf(operator), assignment());
        }
        return target;
    }

    private CstNode conditional() {
        CstNode test = logicalOr();
        if (matchOperator(QUESTION)) {
            Token question = previous();
            CstNode consequent = assignment();
            Token colon = consume(COLON, "Expected ':' in conditional expression");
            return node(CstRule.CONDITIONAL, test, leaf(question), consequent, leaf(colon), conditional());
        }
        return test;
    }

    private CstNode logicalOr() {
        return leftAssociative(CstRule.LOGICAL_OR, this::pipe, PIPE_PIPE);
    }

    private CstNode pipe() {
        return leftAssociative(CstRule.PIPE, this::compose, PIPE_GREATER);
    }

    private CstNode compose() {
        CstNode left = nullishCoalescing();
        if (matchOperator(LESS_PIPE)) {
            Token operator = previous();
            return node(CstRule.COMPOSE, left, leaf(operator), compose());
        }
        return left;
    }

    private CstNode nullishCoalescing() {
        return leftAssociative(CstRule.NULLISH_COALESCING, this::logicalAnd, QUESTION_QUESTION);
    }

    private CstNode logicalAnd() {
        return leftAssociative(CstRule.LOGICAL_AND, this::bitwiseOr, AMP_AMP);
    }

    private CstNode bitwiseOr() {
        return leftAssociative(CstRule.BITWISE_OR, this::bitwiseXor, PIPE);
    }

    private CstNode bitwiseXor() {
        return leftAssociative(CstRule.BITWISE_XOR, this::bitwiseAnd, CARET);
    }

    private CstNode bitwiseAnd() {
        return leftAssociative(CstRule.BITWISE_AND, this::equality, AMP);
    }

    private CstNode equality() {
        return leftAssociative(CstRule.EQUALITY, this::relational, EQUAL_EQUAL, BANG_EQUAL);
    }

    private CstNode relational() {
        return leftAssociative(CstRule.RELATIONAL, this::shift,
                LESS, GREATER, LESS_EQUAL, GREATER_EQUAL, INSTANCEOF, IN);
    }

    private CstNode shift() {
        return leftAssociative(CstRule.SHIFT, this::additive, SHIFT_LEFT, SHIFT_RIGHT, SHIFT_RIGHT_UNSIGNED);
    }

    private CstNode additive() {
        return leftAssociative(CstRule.ADDITIVE, this::multiplicative, PLUS, MINUS);
    }

    private CstNode multiplicative() {
        return leftAssociative(CstRule.MULTIPLICATIVE, this::exponentiation, STAR, SLASH, PERCENT);
    }

    private CstNode exponentiation() {
        CstNode base = unary();
        if (matchOperator(STAR_STAR)) {
            Token operator = previous();
            return node(CstRule.EXPONENTIATION, base, leaf(operator), exponentiation());
        }
        return base;
    }

    private CstNode unary() {
        if (match(BANG, TILDE, PLUS, MINUS, TYPEOF, VOID, DELETE)) {
            Token operator = previous();
            return node(CstRule.UNARY, leaf(operator), unary());
        }
        if (match(PLUS_PLUS, MINUS_MINUS)) {
            Token operator = previous();
            return node(CstRule.PREFIX_UPDATE, leaf(operator), unary());
        }
        return postfix();
    }

    private CstNode postfix() {
        CstNode operand = callChain();
        if (matchOperator(PLUS_PLUS, MINUS_MINUS)) {
            return node(CstRule.POSTFIX_UPDATE, operand, leaf(previous()));
        }
        return operand;
    }

    private CstNode leftAssociative(CstRule rule, Supplier<CstNode> operand, TokenType... operators) {
        CstNode left = operand.get();
        if (!checkOperator(operators)) {
            return left;
        }
        List<CstElement> parts = new ArrayList<>();
        parts.add(left);
        while (matchOperator(operators)) {
            parts.add(leaf(previous()));
            parts.add(operand.get());
        }
        return new CstNode(rule, parts);
    }

    private CstNode callChain() {
        CstNode primary = primary();
        List<CstElement> parts = null;
        CstNode link;
        while ((link = chainLink()) != null) {
            if (parts == null) {
                parts = new ArrayList<>();
                parts.add(primary);
            }
            parts.add(link);
        }
        return parts == null ? primary : new CstNode(CstRule.CALL_CHAIN, parts);
    }

    private CstNode chainLink() {
        if (previous().type() == DEDENT) {
            return null;
        }
        if (match(DOT)) {
            Token dot = previous();
            return node(CstRule.MEMBER, leaf(dot), leaf(consumeName("Expected a property name after '.'")));
        }
        if (match(QUESTION_DOT)) {
            Token optional = previous();
            if (match(LEFT_PAREN)) {
                return arguments(optional);
            }
            if (match(LEFT_BRACKET)) {
                return bracketAccess(optional);
            }
            return node(CstRule.MEMBER, leaf(optional), leaf(consumeName("Expected a property name after '?.'")));
        }
        if (match(LEFT_PAREN)) {
            return arguments(null);
        }
        if (match(LEFT_BRACKET)) {
            return bracketAccess(null);
        }
        if (check(TEMPLATE)) {
            return node(CstRule.TAGGED_TEMPLATE, leaf(advance()));
        }
        return null;
    }

    private CstNode arguments(Token optional) {
        List<CstElement> parts = new ArrayList<>();
        if (optional != null) {
            parts.add(leaf(optional));
        }
        parts.add(leaf(previous()));
        while (!check(RIGHT_PAREN)) {
            parts.add(spreadOrAssignment());
            if (!match(COMMA)) {
                break;
            }
            parts.add(leaf(previous()));
        }
        parts.add(leaf(consume(RIGHT_PAREN, "Expected ')' after arguments")));
        return new CstNode(CstRule.ARGUMENTS, parts);
    }

    private CstNode bracketAccess(Token optional) {
        List<CstElement> parts = new ArrayList<>();
        if (optional != null) {
            parts.add(leaf(optional));
        }
        Token open = previous();
        parts.add(leaf(open));
        if (!check(ELLIPSIS)) {
            parts.add(expression());
        }
        if (match(ELLIPSIS)) {
            if (optional != null) {
                throw error(previous(), "An array slice cannot use optional chaining");
            }
            parts.add(leaf(previous()));
            if (!check(RIGHT_BRACKET)) {
                parts.add(expression());
            }
            parts.add(leaf(consume(RIGHT_BRACKET, "Expected ']' after array slice")));
            return new CstNode(CstRule.SLICE, parts);
        }
        parts.add(leaf(consume(RIGHT_BRACKET, "Expected ']' after index expression")));
        return new CstNode(CstRule.INDEX, parts);
    }

    private CstNode primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER, STRING, TRUE, FALSE, NULL:
                return node(CstRule.LITERAL, leaf(advance()));
            case TEMPLATE:
                return node(CstRule.TEMPLATE, leaf(advance()));
            case IDENTIFIER:
                CstNode identifier = node(CstRule.IDENTIFIER, leaf(advance()));
                return check(ARROW) ? arrowFunction(identifier) : identifier;
            case LEFT_PAREN:
                return parenthesized();
            case LEFT_BRACKET:
                return array();
            case LEFT_BRACE:
                return object();
            case JSX_TAG_OPEN:
                return jsx();
            default:
                throw error(token, "Expected an expression but found " + describe(token));
        }
    }

    private CstNode parenthesized() {
        List<CstElement> parts = new ArrayList<>();
        parts.add(leaf(advance()));
        while (!check(RIGHT_PAREN)) {
            parts.add(spreadOrAssignment());
            if (!match(COMMA)) {
                break;
            }
            parts.add(leaf(previous()));
        }
        parts.add(leaf(consume(RIGHT_PAREN, "Expected ')'")));
        CstNode group = new CstNode(CstRule.PARENTHESIZED, parts);
        if (check(ARROW)) {
            return arrowFunction(group);
        }
        // Without a following '=>' the group must be a plain parenthesized expression.
        List<CstNode> items = group.nodes();
        if (items.size() != 1 || items.get(0).rule() == CstRule.SPREAD || group.has(COMMA)) {
            throw error(peek(), "Expected '=>' after parameter list but found " + describe(peek()));
        }
        return group;
    }

    private CstNode arrowFunction(CstNode parameters) {
        Token arrow = advance();
        CstNode body = check(NEWLINE) ? block("'=>'") : assignment();
        return node(CstRule.ARROW_FUNCTION, parameters, leaf(arrow), body);
    }

    private CstNode array() {
        List<CstElement> parts = new ArrayList<>();
        parts.add(leaf(advance()));
        while (!check(RIGHT_BRACKET)) {
            parts.add(spreadOrAssignment());
            if (!match(COMMA)) {
                break;
            }
            parts.add(leaf(previous()));
        }
        parts.add(leaf(consume(RIGHT_BRACKET, "Expected ']' after array elements")));
        return new CstNode(CstRule.ARRAY, parts);
    }

    private CstNode object() {
        List<CstElement> parts = new ArrayList<>();
        parts.add(leaf(advance()));
        while (!check(RIGHT_BRACE)) {
            parts.add(objectMember());
            if (!match(COMMA)) {
                break;
            }
            parts.add(leaf(previous()));
        }
        parts.add(leaf(consume(RIGHT_BRACE, "Expected '}' after object properties")));
        return new CstNode(CstRule.OBJECT, parts);
    }

    private CstNode objectMember() {
        if (match(ELLIPSIS)) {
            Token ellipsis = previous();
            return node(CstRule.SPREAD, leaf(ellipsis), assignment());
        }
        if (match(LEFT_BRACKET)) {
            List<CstElement> parts = new ArrayList<>();
            parts.add(leaf(previous()));
            if (!check(RIGHT_BRACKET)) {
                parts.add(assignment());
            }
            parts.add(leaf(consume(RIGHT_BRACKET, "Expected ']' after computed key")));
            // A missing value is reported while building the AST.
            if (match(COLON)) {
                parts.add(leaf(previous()));
                parts.add(assignment());
            }
            return new CstNode(CstRule.COMPUTED_PROPERTY, parts);
        }
        if (check(STRING) || check(NUMBER)) {
            Token key = advance();
            Token colon = consume(COLON, "Expected ':' after property key");
            return node(CstRule.PROPERTY, leaf(key), leaf(colon), assignment());
        }
        Token name = consumeName("Expected a property name");
        if (match(COLON)) {
            Token colon = previous();
            return node(CstRule.PROPERTY, leaf(name), leaf(colon), assignment());
        }
        if (name.type() != IDENTIFIER) {
            throw error(name, "Expected ':' after property name '" + name.text() + "'");
        }
        if (match(EQUAL)) {
            Token equal = previous();
            return node(CstRule.SHORTHAND_PROPERTY, leaf(name), leaf(equal), assignment());
        }
        return node(CstRule.SHORTHAND_PROPERTY, leaf(name));
    }

    private CstNode spreadOrAssignment() {
        if (match(ELLIPSIS)) {
            Token ellipsis = previous();
            return node(CstRule.SPREAD, leaf(ellipsis), assignment());
        }
        return assignment();
    }

    // endregion

    // region JSX

    private CstNode jsx() {
        List<CstElement> parts = new ArrayList<>();
        parts.add(leaf(advance()));
        if (match(JSX_TAG_END)) {
            parts.add(leaf(previous()));
            jsxChildren(parts);
            parts.add(leaf(consume(JSX_CLOSE_TAG_OPEN, "Expected '</>' to close the fragment")));
            parts.add(leaf(consume(JSX_TAG_END, "Expected '>' to close the fragment")));
            return new CstNode(CstRule.JSX_FRAGMENT, parts);
        }
        CstNode name = jsxName();
        parts.add(name);
        while (!check(JSX_TAG_END) && !check(JSX_SELF_CLOSE) && !isAtEnd()) {
            parts.add(jsxAttribute());
        }
        if (match(JSX_SELF_CLOSE)) {
            parts.add(leaf(previous()));
            return new CstNode(CstRule.JSX_ELEMENT, parts);
        }
        parts.add(leaf(consume(JSX_TAG_END, "Expected '>' after the attributes of <" + jsxNameText(name) + ">")));
        jsxChildren(parts);
        parts.add(leaf(consume(JSX_CLOSE_TAG_OPEN, "Expected closing tag </" + jsxNameText(name) + ">")));
        CstNode closing = jsxName();
        if (!jsxNameText(closing).equals(jsxNameText(name))) {
            throw error(closing.firstToken(), "Expected closing tag </" + jsxNameText(name)
                    + "> but found </" + jsxNameText(closing) + ">");
        }
        parts.add(closing);
        parts.add(leaf(consume(JSX_TAG_END, "Expected '>' after closing tag name")));
        return new CstNode(CstRule.JSX_ELEMENT, parts);
    }

    private void jsxChildren(List<CstElement> parts) {
        while (!check(JSX_CLOSE_TAG_OPEN) && !isAtEnd()) {
            if (check(JSX_TEXT)) {
                parts.add(leaf(advance()));
            } else if (check(JSX_TAG_OPEN)) {
                parts.add(jsx());
            } else if (match(LEFT_BRACE)) {
                List<CstElement> container = new ArrayList<>();
                container.add(leaf(previous()));
                if (!check(RIGHT_BRACE)) {
                    container.add(expression());
                }
                container.add(leaf(consume(RIGHT_BRACE, "Expected '}' after JSX expression")));
                parts.add(new CstNode(CstRule.JSX_EXPRESSION, container));
            } else {
                throw error(peek(), "Unexpected " + describe(peek()) + " in JSX children");
            }
        }
    }

    private CstNode jsxAttribute() {
        if (match(LEFT_BRACE)) {
            Token open = previous();
            Token ellipsis = consume(ELLIPSIS, "Expected '...' in JSX spread attribute");
            CstNode argument = assignment();
            Token close = consume(RIGHT_BRACE, "Expected '}' after JSX spread attribute");
            return node(CstRule.JSX_SPREAD_ATTRIBUTE, leaf(open), leaf(ellipsis), argument, leaf(close));
        }
        Token name = consume(IDENTIFIER, "Expected an attribute name");
        if (!match(EQUAL)) {
            return node(CstRule.JSX_ATTRIBUTE, leaf(name));
        }
        Token equal = previous();
        if (check(STRING)) {
            return node(CstRule.JSX_ATTRIBUTE, leaf(name), leaf(equal), leaf(advance()));
        }
        if (match(LEFT_BRACE)) {
            Token open = previous();
            CstNode value = expression();
            Token close = consume(RIGHT_BRACE, "Expected '}' after attribute value");
            return node(CstRule.JSX_ATTRIBUTE, leaf(name), leaf(equal),
                    node(CstRule.JSX_EXPRESSION, leaf(open), value, leaf(close)));
        }
        throw error(peek(), "Expected a string or '{' after '" + name.text() + "='");
    }

    private CstNode jsxName() {
        List<CstElement> parts = new ArrayList<>();
        parts.add(leaf(consume(IDENTIFIER, "Expected a JSX tag name")));
        while (match(DOT)) {
            parts.add(leaf(previous()));
            parts.add(leaf(consume(IDENTIFIER, "Expected a name after '.' in JSX tag name")));
        }
        return new CstNode(CstRule.JSX_NAME, parts);
    }

    private static String jsxNameText(CstNode name) {
        StringBuilder text = new StringBuilder();
        for (CstElement part : name.children()) {
            text.append(((CstToken) part).token().text());
        }
        return text.toString();
    }

    // endregion

    // region Token helpers

    private void synchronize() {
        int depth = 0;
        while (!isAtEnd()) {
            TokenType type = peek().type();
            if (type == INDENT) {
                depth++;
            } else if (type == DEDENT) {
                if (depth == 0) {
                    return;
                }
                depth--;
                if (depth == 0) {
                    advance();
                    return;
                }
            } else if (type == NEWLINE && depth == 0) {
                advance();
                return;
            }
            advance();
        }
    }

    private void skipSeparators() {
        while (match(NEWLINE, SEMICOLON)) {
            // empty lines and stray separators
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    // Operators never continue an expression that ended with an indented block.
    private boolean matchOperator(TokenType... types) {
        return checkOperator(types) && match(types);
    }

    private boolean checkOperator(TokenType... types) {
        if (current > 0 && previous().type() == DEDENT) {
            return false;
        }
        return Arrays.stream(types).anyMatch(this::check);
    }

    private boolean matchContextual(String word) {
        if (checkContextual(word)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean checkContextual(String word) {
        return check(IDENTIFIER) && peek().text().equals(word);
    }

    private Token consumeContextual(String word, String errorMessage) {
        if (checkContextual(word)) {
            return advance();
        }
        throw error(peek(), errorMessage + " but found " + describe(peek()));
    }

    private Token consumeName(String errorMessage) {
        if (check(IDENTIFIER) || KEYWORDS.contains(peek().type())) {
            return advance();
        }
        throw error(peek(), errorMessage + " but found " + describe(peek()));
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) {
            return type == END_OF_FILE;
        }
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) {
            return false;
        }
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), errorMessage + " but found " + describe(peek()));
    }

    private SyntaxError error(Token token, String message) {
        diagnostics.reportError(message, sourceName, token.line(), token.column());
        return new SyntaxError(message);
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case END_OF_FILE -> "end of input";
            case NEWLINE -> "end of line";
            case INDENT -> "indentation";
            case DEDENT -> "end of block";
            default -> "'" + token.text() + "'";
        };
    }

    private static CstToken leaf(Token token) {
        return new CstToken(token);
    }

    private static CstNode node(CstRule rule, CstElement... children) {
        return new CstNode(rule, List.of(children));
    }

    // endregion

    /**
     * Unwinds the parser to the enclosing statement after an error has been reported.
     */
    private static final class SyntaxError extends RuntimeException {
        SyntaxError(String message) {
            super(message, null, false, false);
        }
    }
}
