package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param name The attribute name, possibly hyphenated.
 * @param value A {@link StringLiteral} for quoted values, any expression for {@code {expr}},
 *              or {@code null} for boolean shorthand.
 */
public record JsxAttribute(String name, Expression value) implements JsxAttributeItem {

    @Override
    public String type() {
        return "jsxAttribute";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(value);
    }
}
