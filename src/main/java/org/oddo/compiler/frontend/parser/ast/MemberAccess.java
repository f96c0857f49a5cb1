package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code a.b}, {@code a?.b}, {@code a[i]} or {@code a?.[i]}.
 *
 * @param object The accessed object.
 * @param property An {@link Identifier} naming the property, or the index expression when computed.
 * @param computed Whether the property was written in brackets.
 * @param optional Whether optional chaining was used.
 */
public record MemberAccess(Expression object, Expression property, boolean computed, boolean optional) implements Expression {

    @Override
    public String type() {
        return "memberAccess";
    }

    @Override
    public List<AstNode> getChildren() {
        return computed ? AstNode.nodes(object, property) : AstNode.nodes(object);
    }
}
