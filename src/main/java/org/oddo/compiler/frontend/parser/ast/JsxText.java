package org.oddo.compiler.frontend.parser.ast;

/**
 * @param value The text with HTML entities decoded.
 */
public record JsxText(String value) implements JsxChild {

    @Override
    public String type() {
        return "jsxText";
    }
}
