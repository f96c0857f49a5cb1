package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An array pattern element with a default value, {@code [a = 1]}.
 *
 * @param target The bound target.
 * @param defaultValue The value used when the element is {@code undefined}.
 */
public record PatternDefault(PatternTarget target, Expression defaultValue) implements AstNode {

    @Override
    public String type() {
        return "assignmentPattern";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(target, defaultValue);
    }
}
