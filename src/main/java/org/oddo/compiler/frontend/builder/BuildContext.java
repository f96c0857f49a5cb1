package org.oddo.compiler.frontend.builder;

/**
 * The immutable input shared by all steps of one AST build: the text the CST was parsed from.
 * JSX whitespace handling slices this text, so every builder call receives it explicitly.
 *
 * @param source The complete source text the CST offsets refer to.
 * @param sourceName The name of the source, used in error messages.
 */
public record BuildContext(String source, String sourceName) {

    /**
     * Returns the source text between two offsets.
     * @param start The start offset, inclusive.
     * @param end The end offset, exclusive.
     * @return The text in between.
     */
    public String slice(int start, int end) {
        return source.substring(start, end);
    }

    /**
     * Derives a context for an expression embedded in this source, such as a template interpolation.
     * @param embeddedSource The text of the embedded expression.
     * @return A context for the embedded text with the same source name.
     */
    public BuildContext embedded(String embeddedSource) {
        return new BuildContext(embeddedSource, sourceName);
    }
}
