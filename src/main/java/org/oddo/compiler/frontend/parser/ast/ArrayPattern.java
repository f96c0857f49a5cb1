package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param elements The element targets: {@link PatternTarget}s or {@link PatternDefault}s.
 * @param rest The rest target, or {@code null}.
 */
public record ArrayPattern(List<AstNode> elements, PatternTarget rest) implements PatternTarget {

    public ArrayPattern {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public String type() {
        return "arrayPattern";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(elements, rest);
    }
}
