package org.oddo.compiler.frontend.parser.ast;

/**
 * @param value The decoded string value.
 */
public record StringLiteral(String value) implements Expression {

    @Override
    public String type() {
        return "stringLiteral";
    }
}
