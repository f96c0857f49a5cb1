package org.oddo.compiler;

import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.api.CompilerConfig;
import org.oddo.compiler.api.ICompiler;
import org.oddo.compiler.backend.emit.CodeGenerator;
import org.oddo.compiler.backend.emit.ModifierRegistry;
import org.oddo.compiler.diagnostics.DiagnosticsEngine;
import org.oddo.compiler.frontend.builder.AstBuilder;
import org.oddo.compiler.frontend.builder.BuildContext;
import org.oddo.compiler.frontend.lexer.Lexer;
import org.oddo.compiler.frontend.lexer.Token;
import org.oddo.compiler.frontend.parser.CstNode;
import org.oddo.compiler.frontend.parser.Parser;
import org.oddo.compiler.frontend.parser.ast.Expression;
import org.oddo.compiler.frontend.parser.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from Oddo source
 * to an ES module: lexing, parsing, AST building and code generation.
 * <p>
 * Every call creates fresh phase objects, so a single instance may be shared between threads.
 */
public class OddoCompiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(OddoCompiler.class);

    /** The source name used in diagnostics when the caller does not provide one. */
    public static final String DEFAULT_SOURCE_NAME = "<input>";

    private final CompilerConfig config;

    /**
     * Constructs a compiler with the options from {@code reference.conf}.
     */
    public OddoCompiler() {
        this(CompilerConfig.defaults());
    }

    /**
     * Constructs a compiler with the given default options.
     * @param config The options used by {@link #compile(String)}.
     */
    public OddoCompiler(CompilerConfig config) {
        this.config = config;
    }

    @Override
    public String compile(String source) throws CompilationException {
        return compile(source, config);
    }

    @Override
    public String compile(String source, CompilerConfig config) throws CompilationException {
        return compile(source, DEFAULT_SOURCE_NAME, config);
    }

    /**
     * Compiles Oddo source into an ES module.
     *
     * @param source The Oddo source text.
     * @param sourceName The name reported in diagnostics, usually the file name.
     * @param config The code generation options.
     * @return The generated JavaScript.
     * @throws CompilationException if any phase fails.
     */
    public String compile(String source, String sourceName, CompilerConfig config) throws CompilationException {
        Program program = parseProgram(source, sourceName);

        // Phase 4: Code generation (modifier expansion, lowering, printing)
        CodeGenerator generator = new CodeGenerator(config, ModifierRegistry.initializeWithDefaults());
        String output = generator.generate(program);
        LOG.debug("{}: generated {} characters of JavaScript (runtime import: {})",
                sourceName, output.length(), generator.isRuntimeUsed());
        return output;
    }

    @Override
    public Program parseProgram(String source) throws CompilationException {
        return parseProgram(source, DEFAULT_SOURCE_NAME);
    }

    /**
     * Parses Oddo source into its AST without generating code.
     *
     * @param source The Oddo source text.
     * @param sourceName The name reported in diagnostics, usually the file name.
     * @return The program.
     * @throws CompilationException if lexing, parsing or AST building fails.
     */
    public Program parseProgram(String source, String sourceName) throws CompilationException {
        // Phase 1: Lexical analysis
        List<Token> tokens = new Lexer(source).scanTokens();
        LOG.debug("{}: lexed {} tokens", sourceName, tokens.size());

        // Phase 2: Parsing (builds the CST, aggregating syntax errors)
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        CstNode cst = new Parser(tokens, diagnostics, sourceName).parseProgram();

        // Phase 3: AST building
        Program program = new AstBuilder(new BuildContext(source, sourceName)).buildProgram(cst);
        LOG.debug("{}: built AST with {} top-level statements", sourceName, program.body().size());
        return program;
    }

    @Override
    public Expression parseExpression(String source) throws CompilationException {
        List<Token> tokens = new Lexer(source).scanTokens();
        CstNode cst = Parser.forExpression(tokens, new DiagnosticsEngine(), DEFAULT_SOURCE_NAME).parseExpression();
        return new AstBuilder(new BuildContext(source, DEFAULT_SOURCE_NAME)).buildExpression(cst);
    }
}
