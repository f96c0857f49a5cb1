package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Either {@code export x = v} (a declaration) or {@code export { a, b as c }} (specifiers).
 *
 * @param declaration The exported declaration, or {@code null} for the specifier form.
 * @param specifiers The specifiers, empty for the declaration form.
 */
public record ExportNamedStatement(Declaration declaration, List<ExportSpecifier> specifiers) implements Statement {

    public ExportNamedStatement {
        specifiers = specifiers == null ? List.of() : List.copyOf(specifiers);
    }

    @Override
    public String type() {
        return "exportNamedStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(declaration, specifiers);
    }
}
