package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An arrow function.
 *
 * @param parameters The parameters in declaration order.
 * @param body Either an {@link Expression} or a {@link BlockStatement}.
 */
public record ArrowFunction(List<Parameter> parameters, AstNode body) implements Expression {

    public ArrowFunction {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    @Override
    public String type() {
        return "arrowFunction";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(parameters, body);
    }
}
