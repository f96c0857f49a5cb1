package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param argument The object spread into the attributes, {@code {...props}}.
 */
public record JsxSpreadAttribute(Expression argument) implements JsxAttributeItem {

    @Override
    public String type() {
        return "jsxSpread";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(argument);
    }
}
