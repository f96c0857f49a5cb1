package org.oddo.compiler.frontend.parser.ast;

/**
 * A statement of a program or block.
 */
public interface Statement extends AstNode {
}
