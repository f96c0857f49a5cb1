package org.oddo.compiler.frontend.parser;

/**
 * An element of the concrete syntax tree: either a {@link CstNode} or a {@link CstToken}.
 */
public interface CstElement {

    /**
     * @return The zero-based offset of the first character covered by this element.
     */
    int start();

    /**
     * @return The zero-based offset just past the last character covered by this element.
     */
    int end();
}
