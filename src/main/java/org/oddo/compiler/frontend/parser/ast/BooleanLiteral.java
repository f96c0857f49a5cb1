package org.oddo.compiler.frontend.parser.ast;

/**
 * @param value The boolean value.
 */
public record BooleanLiteral(boolean value) implements Expression {

    @Override
    public String type() {
        return "booleanLiteral";
    }
}
