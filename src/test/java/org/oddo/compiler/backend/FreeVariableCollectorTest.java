package org.oddo.compiler.backend;

import org.oddo.compiler.OddoCompiler;
import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.backend.emit.FreeVariableCollector;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link FreeVariableCollector}.
 * These are unit tests and do not require external resources.
 */
public class FreeVariableCollectorTest {

    private final OddoCompiler compiler = new OddoCompiler();
    private final FreeVariableCollector collector = new FreeVariableCollector();

    /**
     * Verifies that names are reported once each, in order of first occurrence.
     * This is a unit test for the free variable collector.
     */
    @Test
    @Tag("unit")
    void testDistinctNamesInOrder() throws CompilationException {
        // Act
        List<String> names = collector.collect(compiler.parseExpression("b * a + b - c"));

        // Assert
        assertThat(names).containsExactly("b", "a", "c");
    }

    /**
     * Verifies that property names of member accesses and object keys are not references,
     * while computed properties and shorthand values are.
     * This is a unit test for the free variable collector.
     */
    @Test
    @Tag("unit")
    void testPropertyNamesAreNotReferences() throws CompilationException {
        // Act
        List<String> names = collector.collect(compiler.parseExpression("({ total: user.price, count, [key]: 1 })"));

        // Assert
        assertThat(names).containsExactly("user", "count", "key");
    }

    /**
     * Verifies that nested arrow functions are not searched.
     * This is a unit test for the free variable collector.
     */
    @Test
    @Tag("unit")
    void testArrowFunctionsAreSkipped() throws CompilationException {
        // Act
        List<String> names = collector.collect(compiler.parseExpression("items.map(item => item * factor)"));

        // Assert
        assertThat(names).containsExactly("items");
    }
}
