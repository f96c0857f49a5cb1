package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param test The condition.
 * @param consequent The value if the condition holds.
 * @param alternate The value otherwise.
 */
public record Conditional(Expression test, Expression consequent, Expression alternate) implements Expression {

    @Override
    public String type() {
        return "conditional";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(test, consequent, alternate);
    }
}
