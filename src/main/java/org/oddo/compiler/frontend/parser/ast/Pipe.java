package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code left |> right}, applying {@code right} to {@code left}.
 *
 * @param left The value.
 * @param right The function.
 */
public record Pipe(Expression left, Expression right) implements Expression {

    @Override
    public String type() {
        return "pipe";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(left, right);
    }
}
