package org.oddo.compiler.frontend.parser.ast;

/**
 * A parameter of an arrow function.
 */
public interface Parameter extends AstNode {
}
