package org.oddo.compiler.backend.emit.features;

import org.oddo.compiler.api.CompileException;
import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.backend.emit.IModifierRule;
import org.oddo.compiler.backend.emit.ModifierContext;
import org.oddo.compiler.frontend.parser.ast.ArrowFunction;
import org.oddo.compiler.frontend.parser.ast.Expression;

/**
 * {@code @mutate f = (x) => ...} becomes {@code const f = $Oddo.mutate((x) => ...)}.
 * The modified value must be an arrow function.
 */
public class MutateModifier implements IModifierRule {

    @Override
    public String name() {
        return "mutate";
    }

    @Override
    public Expression apply(Expression value, ModifierContext context) throws CompileException {
        if (!(value instanceof ArrowFunction)) {
            throw new CompileException(CompilerErrorCode.MUTATE_REQUIRES_FUNCTION, "mutate modifier must be a function");
        }
        return context.runtimeCall(name(), value);
    }
}
