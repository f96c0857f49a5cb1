package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A JSX element.
 *
 * @param name The tag name, member names joined with {@code .}.
 * @param attributes The attributes and spreads in source order.
 * @param children The normalized children.
 * @param selfClosing Whether the element was written as {@code <name />}.
 */
public record JsxElement(String name, List<JsxAttributeItem> attributes, List<JsxChild> children, boolean selfClosing) implements Expression, JsxChild {

    public JsxElement {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public String type() {
        return "jsxElement";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(attributes, children);
    }
}
