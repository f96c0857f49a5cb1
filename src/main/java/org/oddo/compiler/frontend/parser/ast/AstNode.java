package org.oddo.compiler.frontend.parser.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Every node carries a stable type tag, which is also the discriminator written when the
 * tree is serialized to JSON.
 */
@JsonPropertyOrder({"type"})
public interface AstNode {

    /**
     * @return The tag identifying the kind of this node, e.g. {@code "binary"} or {@code "jsxElement"}.
     */
    @JsonProperty("type")
    String type();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    @JsonIgnore
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Collects child nodes for {@link #getChildren()}, skipping {@code null} entries and flattening collections.
     * @param parts Nodes, collections of nodes or {@code null}.
     * @return The non-null nodes in the given order.
     */
    static List<AstNode> nodes(Object... parts) {
        List<AstNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode node) {
                result.add(node);
            } else if (part instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element instanceof AstNode node) {
                        result.add(node);
                    }
                }
            }
        }
        return result;
    }
}
