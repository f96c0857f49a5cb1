package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of a compiled unit.
 *
 * @param body The top-level statements in source order.
 */
public record Program(List<Statement> body) implements AstNode {

    public Program {
        body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public String type() {
        return "program";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(body);
    }
}
