package org.oddo.compiler.frontend.parser.ast;

/**
 * @param imported The name exported by the module.
 * @param local The local binding name.
 */
public record ImportSpecifier(String imported, String local) implements AstNode {

    @Override
    public String type() {
        return "importSpecifier";
    }
}
