package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param operator One of {@code ! ~ + - typeof void delete}.
 * @param argument The operand.
 */
public record Unary(String operator, Expression argument) implements Expression {

    @Override
    public String type() {
        return "unary";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(argument);
    }
}
