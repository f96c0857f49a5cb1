package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code return} statement.
 *
 * @param modifier The modifier name without {@code @}, or {@code null}.
 * @param argument The returned value, or {@code null}.
 */
public record ReturnStatement(String modifier, Expression argument) implements Statement {

    @Override
    public String type() {
        return "returnStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(argument);
    }
}
