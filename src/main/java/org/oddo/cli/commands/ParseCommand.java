package org.oddo.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.oddo.cli.CommandLineInterface;
import org.oddo.compiler.OddoCompiler;
import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.frontend.parser.ast.AstNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "parse", mixinStandardHelpOptions = true,
        description = "Parses an Oddo file and prints its AST as JSON.")
public class ParseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The Oddo source file.")
    private File file;

    @Option(names = "--expression", description = "Parse the file as a single expression instead of a program.")
    private boolean expression;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws JsonProcessingException {
        PrintWriter err = spec.commandLine().getErr();
        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        OddoCompiler compiler = new OddoCompiler();
        AstNode ast;
        try {
            ast = expression ? compiler.parseExpression(source) : compiler.parseProgram(source, file.getName());
        } catch (CompilationException e) {
            err.println(file.getName() + ": " + e.getMessage());
            return CommandLineInterface.EXIT_COMPILATION_ERROR;
        }

        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        PrintWriter out = spec.commandLine().getOut();
        out.println(mapper.writeValueAsString(ast));
        out.flush();
        return 0;
    }
}
