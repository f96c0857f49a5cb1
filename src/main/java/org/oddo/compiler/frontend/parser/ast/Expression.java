package org.oddo.compiler.frontend.parser.ast;

/**
 * An expression node.
 */
public interface Expression extends AstNode {
}
