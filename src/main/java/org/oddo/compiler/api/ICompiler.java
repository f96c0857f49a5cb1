package org.oddo.compiler.api;

import org.oddo.compiler.frontend.parser.ast.Expression;
import org.oddo.compiler.frontend.parser.ast.Program;

/**
 * Defines the public, clean interface for the Oddo compiler.
 */
public interface ICompiler {

    /**
     * Compiles Oddo source into an ES module with the compiler's own options.
     *
     * @param source The Oddo source text.
     * @return The generated JavaScript.
     * @throws CompilationException if any phase fails.
     */
    String compile(String source) throws CompilationException;

    /**
     * Compiles Oddo source into an ES module.
     *
     * @param source The Oddo source text.
     * @param config The code generation options.
     * @return The generated JavaScript.
     * @throws CompilationException if any phase fails.
     */
    String compile(String source, CompilerConfig config) throws CompilationException;

    /**
     * Parses Oddo source into its AST without generating code.
     *
     * @param source The Oddo source text.
     * @return The program.
     * @throws CompilationException if lexing, parsing or AST building fails.
     */
    Program parseProgram(String source) throws CompilationException;

    /**
     * Parses a single Oddo expression into its AST.
     *
     * @param source The expression text.
     * @return The expression.
     * @throws CompilationException if lexing, parsing or AST building fails.
     */
    Expression parseExpression(String source) throws CompilationException;
}
