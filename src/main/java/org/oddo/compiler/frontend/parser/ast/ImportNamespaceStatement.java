package org.oddo.compiler.frontend.parser.ast;

/**
 * {@code import * as ns from "m"}.
 *
 * @param namespace The namespace binding.
 * @param source The module specifier.
 */
public record ImportNamespaceStatement(String namespace, String source) implements Statement {

    @Override
    public String type() {
        return "importNamespaceStatement";
    }
}
