package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param callee The called expression.
 * @param arguments The arguments, possibly {@link SpreadElement}s.
 * @param optional Whether the call was written {@code f?.(...)}.
 */
public record Call(Expression callee, List<Expression> arguments, boolean optional) implements Expression {

    public Call {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "call";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(callee, arguments);
    }
}
