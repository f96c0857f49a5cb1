package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param properties The destructured properties.
 * @param rest The rest target, or {@code null}.
 */
public record ObjectPattern(List<PatternProperty> properties, PatternTarget rest) implements PatternTarget {

    public ObjectPattern {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    @Override
    public String type() {
        return "objectPattern";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(properties, rest);
    }
}
