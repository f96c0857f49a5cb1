package org.oddo.compiler.backend.emit;

import org.oddo.compiler.api.CompileException;
import org.oddo.compiler.api.CompilerConfig;
import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.frontend.parser.ast.ArraySliceAssignment;
import org.oddo.compiler.frontend.parser.ast.Assignment;
import org.oddo.compiler.frontend.parser.ast.BlockStatement;
import org.oddo.compiler.frontend.parser.ast.Declaration;
import org.oddo.compiler.frontend.parser.ast.ExportDefaultStatement;
import org.oddo.compiler.frontend.parser.ast.ExportNamedStatement;
import org.oddo.compiler.frontend.parser.ast.ExportSpecifier;
import org.oddo.compiler.frontend.parser.ast.Expression;
import org.oddo.compiler.frontend.parser.ast.ExpressionStatement;
import org.oddo.compiler.frontend.parser.ast.ImportNamespaceStatement;
import org.oddo.compiler.frontend.parser.ast.ImportSpecifier;
import org.oddo.compiler.frontend.parser.ast.ImportStatement;
import org.oddo.compiler.frontend.parser.ast.ModifierBlock;
import org.oddo.compiler.frontend.parser.ast.Program;
import org.oddo.compiler.frontend.parser.ast.ReturnStatement;
import org.oddo.compiler.frontend.parser.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * The final phase of the compiler: lowers an Oddo AST to an ES module.
 * <p>
 * Modifiers are expanded through the {@link ModifierRegistry}; modifier blocks are flattened into
 * the enclosing statement list. The runtime import is emitted once, as the first statement, and
 * only when an expanded modifier needs it. Expressions are delegated to an {@link ExpressionPrinter}.
 * <p>
 * A generator keeps state while it runs and is meant for a single {@link #generate(Program)} call.
 */
public class CodeGenerator {

    private static final String INDENT = "  ";

    private final CompilerConfig config;
    private final ModifierRegistry modifiers;
    private final ModifierContext modifierContext;
    private final ExpressionPrinter expressions;
    private int depth = 0;
    private boolean runtimeUsed = false;

    /**
     * Constructs a new CodeGenerator.
     * @param config The code generation options.
     * @param modifiers The modifier rules available to the program.
     */
    public CodeGenerator(CompilerConfig config, ModifierRegistry modifiers) {
        this.config = config;
        this.modifiers = modifiers;
        this.modifierContext = new ModifierContext(config.runtimeIdentifier(), new FreeVariableCollector());
        this.expressions = new ExpressionPrinter(this);
    }

    /**
     * Generates the JavaScript module for a program.
     * @param program The program AST.
     * @return The module source, one statement per line.
     * @throws CompileException if the program uses an unknown modifier or a construct with no JavaScript form.
     */
    public String generate(Program program) throws CompileException {
        List<String> lines = new ArrayList<>();
        for (Statement statement : program.body()) {
            emit(statement, null, lines);
        }
        StringBuilder out = new StringBuilder();
        if (runtimeUsed) {
            out.append("import ").append(config.runtimeIdentifier())
                    .append(" from ").append(ExpressionPrinter.quote(config.runtimeLibrary())).append(";\n");
        }
        for (String line : lines) {
            out.append(line).append('\n');
        }
        return out.toString();
    }

    /**
     * @return {@code true} once a modifier that needs the runtime import has been expanded.
     */
    public boolean isRuntimeUsed() {
        return runtimeUsed;
    }

    /**
     * Prints a function body one level deeper than the statement currently being generated.
     * @param body The statements of the block.
     * @return The block including its braces.
     * @throws CompileException if a statement of the block cannot be generated.
     */
    String block(List<Statement> body) throws CompileException {
        List<String> lines = new ArrayList<>();
        depth++;
        try {
            for (Statement statement : body) {
                emit(statement, null, lines);
            }
        } finally {
            depth--;
        }
        if (lines.isEmpty()) {
            return "{}";
        }
        StringBuilder text = new StringBuilder("{\n");
        for (String line : lines) {
            text.append(INDENT.repeat(depth + 1)).append(line).append('\n');
        }
        return text.append(INDENT.repeat(depth)).append('}').toString();
    }

    // region Statements

    private void emit(Statement statement, String inherited, List<String> out) throws CompileException {
        if (statement instanceof ModifierBlock block) {
            // Checked even if every child carries its own modifier.
            resolve(block.modifier());
            // Nested blocks pass their own modifier on; a statement's own modifier always wins.
            for (Statement child : block.block().body()) {
                emit(child, block.modifier(), out);
            }
        } else if (statement instanceof BlockStatement block) {
            for (Statement child : block.body()) {
                emit(child, inherited, out);
            }
        } else if (statement instanceof ExpressionStatement expression) {
            String modifier = expression.modifier() != null ? expression.modifier() : inherited;
            out.add(expressionStatement(applyModifier(modifier, expression.expression())));
        } else if (statement instanceof ReturnStatement ret) {
            out.add(returnStatement(ret, inherited));
        } else if (statement instanceof ExportDefaultStatement export) {
            out.add("export default " + expressions.print(export.declaration(), ExpressionPrinter.ASSIGNMENT) + ";");
        } else if (statement instanceof ExportNamedStatement export) {
            out.add(exportNamed(export, inherited));
        } else if (statement instanceof ImportStatement imported) {
            out.add(importStatement(imported));
        } else if (statement instanceof ImportNamespaceStatement namespace) {
            out.add("import * as " + namespace.namespace() + " from " + ExpressionPrinter.quote(namespace.source()) + ";");
        } else {
            throw new CompileException(CompilerErrorCode.UNSUPPORTED_NODE, "Unsupported statement: " + statement.type());
        }
    }

    private String expressionStatement(Expression expression) throws CompileException {
        if (expression instanceof Declaration declaration) {
            return declaration(declaration) + ";";
        }
        String text = expressions.print(expression, ExpressionPrinter.LOWEST);
        // A statement starting with '{' would be read as a block.
        return (text.startsWith("{") ? "(" + text + ")" : text) + ";";
    }

    private String declaration(Declaration declaration) throws CompileException {
        return "const " + expressions.pattern(declaration.target()) + " = "
                + expressions.print(declaration.value(), ExpressionPrinter.ASSIGNMENT);
    }

    private String returnStatement(ReturnStatement ret, String inherited) throws CompileException {
        String modifier = ret.modifier() != null ? ret.modifier() : inherited;
        if (ret.argument() == null) {
            if (modifier != null) {
                resolve(modifier);
            }
            return "return;";
        }
        Expression argument = modifier != null ? applyTo(resolve(modifier), ret.argument()) : ret.argument();
        return "return " + expressions.print(argument, ExpressionPrinter.LOWEST) + ";";
    }

    private String exportNamed(ExportNamedStatement export, String inherited) throws CompileException {
        if (export.declaration() != null) {
            Declaration declaration = (Declaration) applyModifier(inherited, export.declaration());
            return "export " + declaration(declaration) + ";";
        }
        List<String> specifiers = new ArrayList<>();
        for (ExportSpecifier specifier : export.specifiers()) {
            specifiers.add(specifier.local().equals(specifier.exported())
                    ? specifier.local()
                    : specifier.local() + " as " + specifier.exported());
        }
        return specifiers.isEmpty() ? "export {};" : "export { " + String.join(", ", specifiers) + " };";
    }

    private String importStatement(ImportStatement imported) {
        List<String> bindings = new ArrayList<>();
        if (imported.defaultImport() != null) {
            bindings.add(imported.defaultImport());
        }
        if (!imported.specifiers().isEmpty() || imported.defaultImport() == null) {
            List<String> specifiers = new ArrayList<>();
            for (ImportSpecifier specifier : imported.specifiers()) {
                specifiers.add(specifier.imported().equals(specifier.local())
                        ? specifier.local()
                        : specifier.imported() + " as " + specifier.local());
            }
            bindings.add(specifiers.isEmpty() ? "{}" : "{ " + String.join(", ", specifiers) + " }");
        }
        return "import " + String.join(", ", bindings) + " from " + ExpressionPrinter.quote(imported.source()) + ";";
    }

    // endregion

    // region Modifiers

    // Declarations and assignments keep their shape; only the value is wrapped.
    private Expression applyModifier(String modifier, Expression expression) throws CompileException {
        if (modifier == null) {
            return expression;
        }
        IModifierRule rule = resolve(modifier);
        if (expression instanceof Declaration declaration) {
            return new Declaration(declaration.target(), applyTo(rule, declaration.value()));
        }
        if (expression instanceof Assignment assignment) {
            return new Assignment(assignment.operator(), assignment.target(), applyTo(rule, assignment.value()));
        }
        if (expression instanceof ArraySliceAssignment assignment) {
            return new ArraySliceAssignment(assignment.slice(), applyTo(rule, assignment.value()));
        }
        return applyTo(rule, expression);
    }

    private Expression applyTo(IModifierRule rule, Expression value) throws CompileException {
        Expression replaced = rule.apply(value, modifierContext);
        if (rule.requiresRuntimeImport()) {
            runtimeUsed = true;
        }
        return replaced;
    }

    private IModifierRule resolve(String modifier) throws CompileException {
        return modifiers.find(modifier).orElseThrow(() ->
                new CompileException(CompilerErrorCode.UNKNOWN_MODIFIER, "Unknown modifier: @" + modifier));
    }

    // endregion
}
