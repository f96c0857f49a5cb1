package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code export default expr}.
 *
 * @param declaration The exported expression.
 */
public record ExportDefaultStatement(Expression declaration) implements Statement {

    @Override
    public String type() {
        return "exportDefaultStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(declaration);
    }
}
