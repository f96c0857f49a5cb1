package org.oddo.compiler.frontend.parser.ast;

/**
 * A binding target: an identifier or a destructuring pattern.
 */
public interface PatternTarget extends AstNode {
}
