package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code left ?? right}.
 *
 * @param left The left operand.
 * @param right The fallback.
 */
public record NullishCoalescing(Expression left, Expression right) implements Expression {

    @Override
    public String type() {
        return "nullishCoalescing";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(left, right);
    }
}
