package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param name The parameter name.
 * @param defaultValue The default value, or {@code null}.
 */
public record SimpleParameter(String name, Expression defaultValue) implements Parameter {

    @Override
    public String type() {
        return "parameter";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(defaultValue);
    }
}
