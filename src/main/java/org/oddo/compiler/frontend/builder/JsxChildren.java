package org.oddo.compiler.frontend.builder;

import org.oddo.compiler.frontend.parser.ast.JsxChild;
import org.oddo.compiler.frontend.parser.ast.JsxText;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the whitespace between JSX children.
 * <p>
 * Text children arrive trimmed to their non-whitespace span. Between two consecutive children,
 * a non-empty gap that consists of whitespace only and contains no line break becomes a single
 * {@code " "} text node. Empty expression containers ({@code {}} or a comment) are dropped after
 * they have delimited their gaps. Adjacent text nodes are merged last.
 */
final class JsxChildren {

    /**
     * A child together with the source range it covers.
     *
     * @param start The start offset of the child.
     * @param end The end offset of the child.
     * @param child The built child, or {@code null} for an empty expression container.
     */
    record Span(int start, int end, JsxChild child) {
    }

    private JsxChildren() {
        // Utility class
    }

    /**
     * @param spans The children in source order.
     * @param context The build context holding the source the offsets refer to.
     * @return The normalized children.
     */
    static List<JsxChild> normalize(List<Span> spans, BuildContext context) {
        List<JsxChild> children = new ArrayList<>();
        Span previous = null;
        for (Span span : spans) {
            if (previous != null) {
                String gap = context.slice(previous.end(), span.start());
                if (!gap.isEmpty() && gap.isBlank() && gap.indexOf('\n') < 0) {
                    children.add(new JsxText(" "));
                }
            }
            if (span.child() != null) {
                children.add(span.child());
            }
            previous = span;
        }
        return mergeText(children);
    }

    private static List<JsxChild> mergeText(List<JsxChild> children) {
        List<JsxChild> merged = new ArrayList<>();
        for (JsxChild child : children) {
            int last = merged.size() - 1;
            if (child instanceof JsxText text && last >= 0 && merged.get(last) instanceof JsxText previous) {
                merged.set(last, new JsxText(previous.value() + text.value()));
            } else {
                merged.add(child);
            }
        }
        return merged;
    }
}
