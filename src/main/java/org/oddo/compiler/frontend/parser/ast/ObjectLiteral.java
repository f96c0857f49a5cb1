package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param properties The properties and spreads in source order.
 */
public record ObjectLiteral(List<ObjectMember> properties) implements Expression {

    public ObjectLiteral {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    @Override
    public String type() {
        return "object";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(properties);
    }
}
