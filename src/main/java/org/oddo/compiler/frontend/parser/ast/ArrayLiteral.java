package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param elements The elements, possibly {@link SpreadElement}s.
 */
public record ArrayLiteral(List<Expression> elements) implements Expression {

    public ArrayLiteral {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public String type() {
        return "array";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(elements);
    }
}
