package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An expression used as a statement, optionally carrying a modifier such as {@code @state}.
 *
 * @param modifier The modifier name without {@code @}, or {@code null}.
 * @param expression The expression.
 */
public record ExpressionStatement(String modifier, Expression expression) implements Statement {

    @Override
    public String type() {
        return "expressionStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(expression);
    }
}
