package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An arithmetic, bitwise, comparison, {@code instanceof} or {@code in} operation.
 *
 * @param operator The operator as written in Oddo, e.g. {@code ==}.
 * @param left The left operand.
 * @param right The right operand.
 */
public record Binary(String operator, Expression left, Expression right) implements Expression {

    @Override
    public String type() {
        return "binary";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(left, right);
    }
}
