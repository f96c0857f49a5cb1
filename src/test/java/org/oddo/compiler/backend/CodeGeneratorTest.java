package org.oddo.compiler.backend;

import org.oddo.compiler.OddoCompiler;
import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.api.CompileException;
import org.oddo.compiler.api.CompilerConfig;
import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.backend.emit.CodeGenerator;
import org.oddo.compiler.backend.emit.IModifierRule;
import org.oddo.compiler.backend.emit.ModifierContext;
import org.oddo.compiler.backend.emit.ModifierRegistry;
import org.oddo.compiler.frontend.parser.ast.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link CodeGenerator}.
 * The tests cover statement emission, modifier expansion through the {@link ModifierRegistry}
 * and the lowering of Oddo-only expressions to JavaScript.
 * These are unit tests and do not require external resources.
 */
public class CodeGeneratorTest {

    private final OddoCompiler compiler = new OddoCompiler();

    private String generate(String source) throws CompilationException {
        return generate(source, CompilerConfig.defaults(), ModifierRegistry.initializeWithDefaults());
    }

    private String generate(String source, CompilerConfig config, ModifierRegistry registry) throws CompilationException {
        return new CodeGenerator(config, registry).generate(compiler.parseProgram(source));
    }

    /**
     * Verifies that declarations become const bindings and assignments keep their JavaScript operator.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testDeclarationsAndAssignments() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "count = 0",
                "count := 1",
                "count +:= 2",
                "flag ??:= true"
        );

        // Act
        String output = generate(source);

        // Assert
        assertThat(output).isEqualTo(String.join("\n",
                "const count = 0;",
                "count = 1;",
                "count += 2;",
                "flag ??= true;",
                ""));
    }

    /**
     * Verifies that a program without modifiers does not import the runtime.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testNoRuntimeImportWithoutModifiers() throws CompilationException {
        // Arrange
        CodeGenerator generator = new CodeGenerator(CompilerConfig.defaults(), ModifierRegistry.initializeWithDefaults());

        // Act
        String output = generator.generate(compiler.parseProgram("x = 1"));

        // Assert
        assertThat(output).isEqualTo("const x = 1;\n");
        assertThat(generator.isRuntimeUsed()).isFalse();
    }

    /**
     * Verifies that the runtime import uses the configured library and identifier.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testRuntimeImportFollowsConfiguration() throws CompilationException {
        // Arrange
        CompilerConfig config = new CompilerConfig("my-runtime", "R");

        // Act
        String output = generate("@state x = 3", config, ModifierRegistry.initializeWithDefaults());

        // Assert
        assertThat(output).isEqualTo("import R from \"my-runtime\";\nconst x = R.state(3);\n");
    }

    /**
     * Verifies that computed and react modifiers pass the free variables as parameters and dependencies.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testDependencyTrackingModifiers() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "@computed sum = a + b",
                "@computed one = 1",
                "@react console.log(sum)"
        );

        // Act
        String output = generate(source);

        // Assert
        assertThat(output).isEqualTo(String.join("\n",
                "import $Oddo from \"@oddo/ui\";",
                "const sum = $Oddo.computed((a, b) => a + b, [a, b]);",
                "const one = $Oddo.computed(() => 1, []);",
                "$Oddo.react((console, sum) => console.log(sum), [console, sum]);",
                ""));
    }

    /**
     * Verifies that the mutate modifier wraps functions and rejects anything else.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testMutateModifier() throws CompilationException {
        // Act
        String output = generate("@mutate add = (item) => items := [...items, item]");

        // Assert
        assertThat(output).endsWith("const add = $Oddo.mutate(item => items = [...items, item]);\n");
        assertThatThrownBy(() -> generate("@mutate total = a + b"))
                .isInstanceOf(CompileException.class)
                .hasMessage("mutate modifier must be a function")
                .extracting(e -> ((CompileException) e).getCode())
                .isEqualTo(CompilerErrorCode.MUTATE_REQUIRES_FUNCTION);
    }

    /**
     * Verifies that an unregistered modifier is reported by name.
     * This is a unit test for the code generator's error handling.
     */
    @Test
    @Tag("unit")
    void testUnknownModifier() {
        assertThatThrownBy(() -> generate("@memo x = 1"))
                .isInstanceOf(CompileException.class)
                .hasMessage("Unknown modifier: @memo");
    }

    /**
     * Verifies that the modifier of a block is checked even when no statement inside inherits it.
     * This is a unit test for the code generator's error handling.
     */
    @Test
    @Tag("unit")
    void testUnknownBlockModifier() {
        // Arrange
        String overridden = String.join("\n",
                "@foo:",
                "  @state x = 1"
        );
        String importsOnly = String.join("\n",
                "@foo:",
                "  import { a } from \"b\""
        );

        // Act & Assert
        assertThatThrownBy(() -> generate(overridden))
                .isInstanceOf(CompileException.class)
                .hasMessage("Unknown modifier: @foo");
        assertThatThrownBy(() -> generate(importsOnly))
                .isInstanceOf(CompileException.class)
                .hasMessage("Unknown modifier: @foo");
    }

    /**
     * Verifies that a modifier block applies its modifier to every statement and that a
     * statement's own modifier takes precedence.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testModifierBlock() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "@state:",
                "  a = 1",
                "  @computed b = a * 2",
                "c = 3"
        );

        // Act
        String output = generate(source);

        // Assert
        assertThat(output).isEqualTo(String.join("\n",
                "import $Oddo from \"@oddo/ui\";",
                "const a = $Oddo.state(1);",
                "const b = $Oddo.computed(a => a * 2, [a]);",
                "const c = 3;",
                ""));
    }

    /**
     * Verifies that custom modifier rules can be registered, and that a rule without a runtime
     * dependency does not add the runtime import.
     * This is a unit test for the modifier registry.
     */
    @Test
    @Tag("unit")
    void testCustomModifierRule() throws CompilationException {
        // Arrange
        IModifierRule trace = mock(IModifierRule.class);
        when(trace.name()).thenReturn("trace");
        when(trace.requiresRuntimeImport()).thenReturn(false);
        when(trace.apply(any(Expression.class), any(ModifierContext.class)))
                .thenAnswer(invocation -> new Call(new Identifier("trace"), List.of(invocation.<Expression>getArgument(0)), false));
        ModifierRegistry registry = ModifierRegistry.initializeWithDefaults();
        registry.register(trace);

        // Act
        String output = generate("@trace x = 1", CompilerConfig.defaults(), registry);

        // Assert
        assertThat(output).isEqualTo("const x = trace(1);\n");
        verify(trace).apply(eq(new NumberLiteral(1, "1")), any(ModifierContext.class));
    }

    /**
     * Verifies the lowering of equality, pipes, composition and slices.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testOperatorLowering() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "same = a == b",
                "different = a != b",
                "piped = a |> f |> g",
                "composed = f <| g <| x",
                "copy = numbers[...]",
                "part = numbers[1...3]",
                "head = numbers[...2]"
        );

        // Act
        String output = generate(source);

        // Assert
        assertThat(output).isEqualTo(String.join("\n",
                "const same = a === b;",
                "const different = a !== b;",
                "const piped = g(f(a));",
                "const composed = f(g(x));",
                "const copy = numbers.slice(0);",
                "const part = numbers.slice(1, 3);",
                "const head = numbers.slice(0, 2);",
                ""));
    }

    /**
     * Verifies the splice call emitted for the different slice assignment forms.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testSliceAssignmentLowering() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "arr[3...6] := [-3, -4]",
                "arr[2...] := rest",
                "arr[...] := all",
                "arr[i...j] := part"
        );

        // Act
        String output = generate(source);

        // Assert
        assertThat(output).isEqualTo(String.join("\n",
                "Array.prototype.splice.apply(arr, [3, 3].concat([-3, -4]));",
                "Array.prototype.splice.apply(arr, [2, arr.length - 2].concat(rest));",
                "Array.prototype.splice.apply(arr, [0, arr.length].concat(all));",
                "Array.prototype.splice.apply(arr, [i, j - i].concat(part));",
                ""));
    }

    /**
     * Verifies that parentheses are inserted only where JavaScript precedence requires them.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testParenthesesFromPrecedence() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "a = (x + y) * z",
                "b = x + y * z",
                "c = (-2) ** 2",
                "d = -(-1)",
                "e = (a ?? b) || c",
                "f = 1 .toString()"
        );

        // Act
        String output = generate(source);

        // Assert
        assertThat(output).isEqualTo(String.join("\n",
                "const a = (x + y) * z;",
                "const b = x + y * z;",
                "const c = (-2) ** 2;",
                "const d = -(-1);",
                "const e = (a ?? b) || c;",
                "const f = (1).toString();",
                ""));
    }

    /**
     * Verifies that block bodies of arrow functions are indented and that an object body is parenthesized.
     * This is a unit test for the code generator.
     */
    @Test
    @Tag("unit")
    void testArrowFunctionBodies() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "add = (a, b) =>",
                "  sum = a + b",
                "  return sum",
                "make = () => ({ a: 1 })",
                "noop = () =>",
                "  return"
        );

        // Act
        String output = generate(source);

        // Assert
        assertThat(output).isEqualTo(String.join("\n",
                "const add = (a, b) => {",
                "  const sum = a + b;",
                "  return sum;",
                "};",
                "const make = () => ({ a: 1 });",
                "const noop = () => {",
                "  return;",
                "};",
                ""));
    }

    /**
     * Verifies that a declaration nested inside another expression is rejected.
     * This is a unit test for the code generator's error handling.
     */
    @Test
    @Tag("unit")
    void testNestedDeclarationIsRejected() {
        // Arrange
        Program program = new Program(List.of(new ExpressionStatement(null,
                new Call(new Identifier("f"), List.of(new Declaration(new Identifier("x"), new NumberLiteral(1, "1"))), false))));
        CodeGenerator generator = new CodeGenerator(CompilerConfig.defaults(), ModifierRegistry.initializeWithDefaults());

        // Act & Assert
        assertThatThrownBy(() -> generator.generate(program))
                .isInstanceOf(CompileException.class)
                .extracting(e -> ((CompileException) e).getCode())
                .isEqualTo(CompilerErrorCode.INVALID_DECLARATION_TARGET);
    }
}
