package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code import d, { x, y as z } from "m"} and its partial forms.
 *
 * @param defaultImport The default import binding, or {@code null}.
 * @param specifiers The named imports.
 * @param source The module specifier.
 */
public record ImportStatement(String defaultImport, List<ImportSpecifier> specifiers, String source) implements Statement {

    public ImportStatement {
        specifiers = specifiers == null ? List.of() : List.copyOf(specifiers);
    }

    @Override
    public String type() {
        return "importStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(specifiers);
    }
}
