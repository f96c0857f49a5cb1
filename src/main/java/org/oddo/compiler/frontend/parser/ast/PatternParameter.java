package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A destructured parameter such as {@code {x, y = 3}}.
 *
 * @param pattern The array or object pattern.
 * @param defaultValue The default for the whole parameter, or {@code null}.
 */
public record PatternParameter(PatternTarget pattern, Expression defaultValue) implements Parameter {

    @Override
    public String type() {
        return "destructuringPattern";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(pattern, defaultValue);
    }
}
