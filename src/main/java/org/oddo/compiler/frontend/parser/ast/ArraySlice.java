package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code a[start...end]}; either bound may be absent.
 *
 * @param object The sliced array.
 * @param start The first index, or {@code null}.
 * @param end The index after the last element, or {@code null}.
 */
public record ArraySlice(Expression object, Expression start, Expression end) implements Expression {

    @Override
    public String type() {
        return "arraySlice";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(object, start, end);
    }
}
