package org.oddo.compiler.frontend.parser.ast;

/**
 * A numeric literal.
 *
 * @param value The numeric value.
 * @param raw The spelling as written for hex, binary, octal, fractional and exponent forms, otherwise {@code null}.
 */
public record NumberLiteral(double value, String raw) implements Expression {

    @Override
    public String type() {
        return "numberLiteral";
    }
}
