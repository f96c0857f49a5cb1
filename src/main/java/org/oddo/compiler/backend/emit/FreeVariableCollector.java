package org.oddo.compiler.backend.emit;

import org.oddo.compiler.frontend.TreeWalker;
import org.oddo.compiler.frontend.parser.ast.ArrowFunction;
import org.oddo.compiler.frontend.parser.ast.AstNode;
import org.oddo.compiler.frontend.parser.ast.Expression;
import org.oddo.compiler.frontend.parser.ast.Identifier;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Collects the names an expression reads from its enclosing scope, in order of first occurrence.
 * <p>
 * Arrow functions open a scope of their own and are skipped entirely. Property names of
 * non-computed member accesses and object keys are not references and never appear, because
 * the AST does not report them as children.
 */
public final class FreeVariableCollector {

    /**
     * @param expression The expression to inspect.
     * @return The distinct identifier names, in order of first occurrence.
     */
    public List<String> collect(Expression expression) {
        Set<String> names = new LinkedHashSet<>();
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers =
                Map.of(Identifier.class, node -> names.add(((Identifier) node).name()));
        new TreeWalker(handlers, Set.of(ArrowFunction.class)).walk(expression);
        return new ArrayList<>(names);
    }
}
