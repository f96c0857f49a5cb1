package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code ...expr} inside an array literal or an argument list.
 *
 * @param argument The spread expression.
 */
public record SpreadElement(Expression argument) implements Expression {

    @Override
    public String type() {
        return "spreadElement";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(argument);
    }
}
