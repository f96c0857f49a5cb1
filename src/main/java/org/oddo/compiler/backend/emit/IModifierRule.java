package org.oddo.compiler.backend.emit;

import org.oddo.compiler.api.CompileException;
import org.oddo.compiler.frontend.parser.ast.Expression;

/**
 * A rule that expands a {@code @modifier} into a call to the reactive runtime.
 * <p>
 * The code generator decides which expression a modifier applies to (the initializer of a
 * declaration, the value of an assignment, a returned value or a bare expression) and passes
 * it to {@link #apply(Expression, ModifierContext)}; the rule returns its replacement.
 */
public interface IModifierRule {

    /**
     * @return The modifier name without the leading {@code @}, e.g. {@code "state"}.
     */
    String name();

    /**
     * @return {@code true} if the rewritten code references the runtime identifier,
     *         so that the runtime import must be emitted.
     */
    default boolean requiresRuntimeImport() {
        return true;
    }

    /**
     * Rewrites the modified expression.
     *
     * @param value   The expression the modifier applies to.
     * @param context Access to the runtime identifier and free-variable analysis.
     * @return The replacement expression.
     * @throws CompileException if the modifier cannot be applied to the expression.
     */
    Expression apply(Expression value, ModifierContext context) throws CompileException;
}
