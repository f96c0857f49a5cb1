package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * @param tag The tag function.
 * @param template The template passed to the tag.
 */
public record TaggedTemplate(Expression tag, TemplateLiteral template) implements Expression {

    @Override
    public String type() {
        return "taggedTemplate";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(tag, template);
    }
}
