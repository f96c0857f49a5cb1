package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A new binding introduced with {@code =}; lowered to a {@code const} declaration.
 *
 * @param target The bound identifier or destructuring pattern.
 * @param value The initial value.
 */
public record Declaration(PatternTarget target, Expression value) implements Expression {

    @Override
    public String type() {
        return "variableDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(target, value);
    }
}
