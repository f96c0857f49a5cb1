package org.oddo.compiler.backend.emit.features;

import org.oddo.compiler.backend.emit.IModifierRule;
import org.oddo.compiler.backend.emit.ModifierContext;
import org.oddo.compiler.frontend.parser.ast.Expression;

/**
 * {@code @state x = v} becomes {@code const x = $Oddo.state(v)}.
 */
public class StateModifier implements IModifierRule {

    @Override
    public String name() {
        return "state";
    }

    @Override
    public Expression apply(Expression value, ModifierContext context) {
        return context.runtimeCall(name(), value);
    }
}
