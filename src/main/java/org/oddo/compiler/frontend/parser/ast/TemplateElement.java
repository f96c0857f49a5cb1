package org.oddo.compiler.frontend.parser.ast;

/**
 * A literal segment of a template literal.
 *
 * @param raw The segment exactly as written.
 * @param cooked The segment with escape sequences decoded.
 * @param tail Whether this is the last segment.
 */
public record TemplateElement(String raw, String cooked, boolean tail) implements AstNode {

    @Override
    public String type() {
        return "templateElement";
    }
}
