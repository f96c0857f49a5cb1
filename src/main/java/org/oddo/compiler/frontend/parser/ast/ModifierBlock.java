package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A block whose statements all carry the same modifier unless they declare their own:
 * <pre>
 * &#64;state:
 *   x = 1
 *   y = 2
 * </pre>
 *
 * @param modifier The modifier name without {@code @}.
 * @param block The statements the modifier applies to.
 */
public record ModifierBlock(String modifier, BlockStatement block) implements Statement {

    @Override
    public String type() {
        return "modifierBlock";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(block);
    }
}
