package org.oddo.compiler.frontend.parser.ast;

/**
 * An entry in the attribute list of a JSX element.
 */
public interface JsxAttributeItem extends AstNode {
}
