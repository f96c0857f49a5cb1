package org.oddo.compiler.backend.emit.features;

import org.oddo.compiler.backend.emit.IModifierRule;
import org.oddo.compiler.backend.emit.ModifierContext;
import org.oddo.compiler.frontend.parser.ast.ArrayLiteral;
import org.oddo.compiler.frontend.parser.ast.ArrowFunction;
import org.oddo.compiler.frontend.parser.ast.Expression;
import org.oddo.compiler.frontend.parser.ast.Identifier;
import org.oddo.compiler.frontend.parser.ast.Parameter;
import org.oddo.compiler.frontend.parser.ast.SimpleParameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for modifiers that re-evaluate an expression when its inputs change.
 * <p>
 * The expression becomes the body of an arrow function whose parameters are its free variables,
 * and the same variables are passed as the dependency array:
 * {@code (a, b) => a + b, [a, b]}.
 */
public abstract class DependencyTrackingModifier implements IModifierRule {

    @Override
    public Expression apply(Expression value, ModifierContext context) {
        List<String> names = context.freeVariables().collect(value);
        List<Parameter> parameters = new ArrayList<>();
        List<Expression> dependencies = new ArrayList<>();
        for (String name : names) {
            parameters.add(new SimpleParameter(name, null));
            dependencies.add(new Identifier(name));
        }
        return context.runtimeCall(name(), new ArrowFunction(parameters, value), new ArrayLiteral(dependencies));
    }
}
