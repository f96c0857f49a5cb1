package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An indented statement block, used as a modifier block body and as an arrow function body.
 *
 * @param body The statements of the block.
 */
public record BlockStatement(List<Statement> body) implements Statement {

    public BlockStatement {
        body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public String type() {
        return "blockStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(body);
    }
}
