package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A property of an object literal.
 *
 * @param key The key: an {@link Identifier}, a literal, or any expression when computed.
 * @param value The value.
 * @param shorthand Whether the property was written as {@code { name }}.
 * @param computed Whether the key was written as {@code [expr]}.
 */
public record Property(Expression key, Expression value, boolean shorthand, boolean computed) implements ObjectMember {

    @Override
    public String type() {
        return "property";
    }

    @Override
    public List<AstNode> getChildren() {
        // A plain key is a name, not a reference.
        return computed ? AstNode.nodes(key, value) : AstNode.nodes(value);
    }
}
