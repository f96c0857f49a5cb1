package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param children The normalized children of {@code <>...</>}.
 */
public record JsxFragment(List<JsxChild> children) implements Expression, JsxChild {

    public JsxFragment {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public String type() {
        return "jsxFragment";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(children);
    }
}
