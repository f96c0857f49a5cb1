package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param argument The object spread into the literal.
 */
public record SpreadProperty(Expression argument) implements ObjectMember {

    @Override
    public String type() {
        return "spreadProperty";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(argument);
    }
}
