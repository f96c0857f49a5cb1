package org.oddo.compiler.frontend.parser;

import org.oddo.compiler.frontend.lexer.Token;
import org.oddo.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * A node of the concrete syntax tree produced by the {@link Parser}.
 * <p>
 * The children are stored as one list in source order, tokens and nodes interleaved.
 * The per-kind accessors ({@link #children(CstRule)}, {@link #tokens(TokenType)}) return
 * the matches of one kind, again in source order.
 *
 * @param rule     The grammar rule this node was produced by.
 * @param children The child elements in source order.
 */
public record CstNode(CstRule rule, List<CstElement> children) implements CstElement {

    public CstNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Returns all child nodes produced by the given rule.
     * @param kind The rule to filter by.
     * @return The matching child nodes in source order.
     */
    public List<CstNode> children(CstRule kind) {
        return children.stream()
                .filter(c -> c instanceof CstNode n && n.rule() == kind)
                .map(CstNode.class::cast)
                .toList();
    }

    /**
     * @return The child nodes (no tokens) in source order.
     */
    public List<CstNode> nodes() {
        return children.stream()
                .filter(CstNode.class::isInstance)
                .map(CstNode.class::cast)
                .toList();
    }

    /**
     * Returns the first child node produced by the given rule.
     * @param kind The rule to look for.
     * @return The child node, or {@code null} if there is none.
     */
    public CstNode child(CstRule kind) {
        List<CstNode> matches = children(kind);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /**
     * Returns all direct child tokens of the given type.
     * @param type The token type to filter by.
     * @return The matching tokens in source order.
     */
    public List<Token> tokens(TokenType type) {
        return children.stream()
                .filter(c -> c instanceof CstToken t && t.type() == type)
                .map(c -> ((CstToken) c).token())
                .toList();
    }

    /**
     * Returns the first direct child token of the given type.
     * @param type The token type to look for.
     * @return The token, or {@code null} if there is none.
     */
    public Token token(TokenType type) {
        List<Token> matches = tokens(type);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /**
     * @param type The token type to look for.
     * @return {@code true} if a direct child token of the given type exists.
     */
    public boolean has(TokenType type) {
        return token(type) != null;
    }

    /**
     * @return The first token covered by this node.
     */
    public Token firstToken() {
        CstElement first = children.get(0);
        return first instanceof CstToken t ? t.token() : ((CstNode) first).firstToken();
    }

    @Override
    public int start() {
        return children.isEmpty() ? -1 : children.get(0).start();
    }

    @Override
    public int end() {
        return children.isEmpty() ? -1 : children.get(children.size() - 1).end();
    }
}
