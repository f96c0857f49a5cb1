package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param expression The embedded expression.
 */
public record JsxExpressionContainer(Expression expression) implements JsxChild {

    @Override
    public String type() {
        return "jsxExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(expression);
    }
}
