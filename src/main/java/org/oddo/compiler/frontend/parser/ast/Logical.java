package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param operator {@code &&} or {@code ||}.
 * @param left The left operand.
 * @param right The right operand.
 */
public record Logical(String operator, Expression left, Expression right) implements Expression {

    @Override
    public String type() {
        return "logical";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(left, right);
    }
}
