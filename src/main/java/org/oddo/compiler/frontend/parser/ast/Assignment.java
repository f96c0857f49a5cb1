package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A mutation of an existing binding with {@code :=} or a compound form such as {@code +:=}.
 *
 * @param operator The operator as written in Oddo.
 * @param target An identifier, member access or destructuring pattern.
 * @param value The assigned value.
 */
public record Assignment(String operator, AstNode target, Expression value) implements Expression {

    @Override
    public String type() {
        return "assignment";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(target, value);
    }
}
