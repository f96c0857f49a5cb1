package org.oddo.compiler.frontend.parser.ast;

/**
 * A reference to, or binding of, a name.
 *
 * @param name The identifier text.
 */
public record Identifier(String name) implements Expression, PatternTarget {

    @Override
    public String type() {
        return "identifier";
    }
}
