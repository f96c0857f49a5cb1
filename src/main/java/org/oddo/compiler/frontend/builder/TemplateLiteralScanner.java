package org.oddo.compiler.frontend.builder;

import org.oddo.compiler.api.AstBuildException;
import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.frontend.lexer.InterpolationScanner;
import org.oddo.compiler.frontend.lexer.StringEscapes;
import org.oddo.compiler.frontend.parser.ast.TemplateElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the raw text of a template literal into literal segments and the source text
 * of its {@code ${...}} interpolations. Escapes are kept in the raw text; interpolation bounds
 * come from the {@link InterpolationScanner} the lexer uses as well.
 */
final class TemplateLiteralScanner {

    /**
     * The result of scanning one template literal.
     *
     * @param quasis The literal segments; the last one is the tail.
     * @param expressions The source text of each interpolation, in order.
     */
    record Scan(List<TemplateElement> quasis, List<String> expressions) {
    }

    private TemplateLiteralScanner() {
        // Utility class
    }

    /**
     * Scans the text between the backticks of a template literal.
     * @param raw The raw template text.
     * @return The segments and interpolation sources.
     * @throws AstBuildException if an interpolation is not closed or a segment has a malformed escape.
     */
    static Scan scan(String raw) throws AstBuildException {
        List<TemplateElement> quasis = new ArrayList<>();
        List<String> expressions = new ArrayList<>();
        StringBuilder segment = new StringBuilder();
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                segment.append(c).append(raw.charAt(i + 1));
                i += 2;
            } else if (c == '$' && i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
                int close = InterpolationScanner.closingBrace(raw, i + 2);
                if (close < 0) {
                    throw new AstBuildException(CompilerErrorCode.MISSING_SUBSTRUCTURE,
                            "Unterminated interpolation in template literal");
                }
                quasis.add(element(segment.toString(), false));
                expressions.add(raw.substring(i + 2, close));
                segment.setLength(0);
                i = close + 1;
            } else {
                segment.append(c);
                i++;
            }
        }
        quasis.add(element(segment.toString(), true));
        return new Scan(quasis, expressions);
    }

    private static TemplateElement element(String raw, boolean tail) throws AstBuildException {
        try {
            return new TemplateElement(raw, StringEscapes.unescape(raw), tail);
        } catch (IllegalArgumentException e) {
            throw new AstBuildException(CompilerErrorCode.MISSING_SUBSTRUCTURE,
                    "Invalid escape in template literal: " + e.getMessage());
        }
    }
}
