package org.oddo.compiler.frontend.parser.ast;

/**
 * A child of a JSX element or fragment.
 */
public interface JsxChild extends AstNode {
}
