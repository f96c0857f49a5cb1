package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code ++x}, {@code --x}, {@code x++} or {@code x--}.
 *
 * @param operator {@code ++} or {@code --}.
 * @param prefix Whether the operator precedes the operand.
 * @param argument The updated expression.
 */
public record Update(String operator, boolean prefix, Expression argument) implements Expression {

    @Override
    public String type() {
        return prefix ? "prefixUpdate" : "postfixUpdate";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(argument);
    }
}
