package org.oddo.compiler.frontend.parser.ast;

/**
 * The {@code null} literal.
 */
public record NullLiteral() implements Expression {

    @Override
    public String type() {
        return "nullLiteral";
    }
}
