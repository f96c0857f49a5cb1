package org.oddo.compiler.frontend.parser.ast;

/**
 * @param local The local binding name.
 * @param exported The name the binding is exported as.
 */
public record ExportSpecifier(String local, String exported) implements AstNode {

    @Override
    public String type() {
        return "exportSpecifier";
    }
}
