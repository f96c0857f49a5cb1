package org.oddo.compiler.frontend.parser;

import org.oddo.compiler.frontend.lexer.Token;
import org.oddo.compiler.frontend.lexer.TokenType;

/**
 * A token leaf of the concrete syntax tree.
 *
 * @param token The wrapped token.
 */
public record CstToken(Token token) implements CstElement {

    @Override
    public int start() {
        return token.start();
    }

    @Override
    public int end() {
        return token.end();
    }

    /**
     * @return The type of the wrapped token.
     */
    public TokenType type() {
        return token.type();
    }
}
