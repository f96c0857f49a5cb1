package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code a[start...end] := value}, replacing the sliced range in place.
 *
 * @param slice The replaced range.
 * @param value The replacement elements.
 */
public record ArraySliceAssignment(ArraySlice slice, Expression value) implements Expression {

    @Override
    public String type() {
        return "arraySliceAssignment";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(slice, value);
    }
}
