package org.oddo.compiler;

import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.api.CompilerConfig;
import org.oddo.compiler.frontend.parser.ast.Expression;
import org.oddo.compiler.frontend.parser.ast.Program;

/**
 * Static entry points backed by a shared {@link OddoCompiler} with the default options.
 */
public final class Oddo {

    private static final OddoCompiler COMPILER = new OddoCompiler();

    private Oddo() {
        // Static facade
    }

    public static String compile(String source) throws CompilationException {
        return COMPILER.compile(source);
    }

    public static String compile(String source, CompilerConfig config) throws CompilationException {
        return COMPILER.compile(source, config);
    }

    public static Program parseProgram(String source) throws CompilationException {
        return COMPILER.parseProgram(source);
    }

    public static Expression parseExpression(String source) throws CompilationException {
        return COMPILER.parseExpression(source);
    }
}
