package org.oddo.compiler.frontend.parser.ast;

/**
 * A member of an object literal: a property or a spread.
 */
public interface ObjectMember extends AstNode {
}
