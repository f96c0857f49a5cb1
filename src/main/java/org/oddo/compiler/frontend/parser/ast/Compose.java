package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code left <| right}, applying {@code left} to {@code right}.
 *
 * @param left The function.
 * @param right The argument.
 */
public record Compose(Expression left, Expression right) implements Expression {

    @Override
    public String type() {
        return "compose";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(left, right);
    }
}
