package org.oddo.compiler.backend.emit;

import org.oddo.compiler.frontend.parser.ast.Call;
import org.oddo.compiler.frontend.parser.ast.Expression;
import org.oddo.compiler.frontend.parser.ast.Identifier;
import org.oddo.compiler.frontend.parser.ast.MemberAccess;

import java.util.List;

/**
 * What a {@link IModifierRule} needs to build its replacement.
 *
 * @param runtimeIdentifier The name the runtime library is imported under, e.g. {@code $Oddo}.
 * @param freeVariables The analysis used by dependency-tracking modifiers.
 */
public record ModifierContext(String runtimeIdentifier, FreeVariableCollector freeVariables) {

    /**
     * Builds {@code <runtime>.<function>(arguments...)}.
     * @param function The runtime function to call.
     * @param arguments The call arguments.
     * @return The call expression.
     */
    public Call runtimeCall(String function, Expression... arguments) {
        MemberAccess callee = new MemberAccess(new Identifier(runtimeIdentifier), new Identifier(function), false, false);
        return new Call(callee, List.of(arguments), false);
    }
}
