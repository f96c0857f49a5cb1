package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A property of an object pattern: {@code a}, {@code a: b}, {@code "a": b}, {@code a = 1} or {@code a: {b}}.
 *
 * @param key An {@link Identifier} or {@link StringLiteral} naming the property.
 * @param value The target the property is bound to.
 * @param shorthand Whether the property was written without {@code :}.
 * @param defaultValue The default value, or {@code null}.
 */
public record PatternProperty(Expression key, PatternTarget value, boolean shorthand, Expression defaultValue) implements AstNode {

    @Override
    public String type() {
        return "property";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(value, defaultValue);
    }
}
