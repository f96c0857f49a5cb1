package org.oddo.compiler.frontend;

import org.oddo.compiler.frontend.parser.ast.AstNode;

import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between compiler phases and the AST structure.
 * <p>
 * Nodes whose class is registered as a scope boundary are not entered: neither their handler
 * nor the handlers of their descendants run.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;
    private final Set<Class<? extends AstNode>> boundaries;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     * @param boundaries Node classes the walker does not enter.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers,
                      Set<Class<? extends AstNode>> boundaries) {
        this.handlers = handlers;
        this.boundaries = boundaries;
    }

    /**
     * Walks a single AST node and its children recursively, in the order of {@link AstNode#getChildren()}.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null || boundaries.contains(node.getClass())) {
            return;
        }

        // Execute the handler for the current node if one is registered.
        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        // Descend recursively into ALL children without knowing their type.
        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }
}
