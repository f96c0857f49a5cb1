package org.oddo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A template literal. There is always one more quasi than expressions; the last quasi is the tail.
 *
 * @param quasis The literal text segments.
 * @param expressions The interpolated expressions.
 */
public record TemplateLiteral(List<TemplateElement> quasis, List<Expression> expressions) implements Expression {

    public TemplateLiteral {
        quasis = quasis == null ? List.of() : List.copyOf(quasis);
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
    }

    @Override
    public String type() {
        return "templateLiteral";
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.nodes(quasis, expressions);
    }
}
