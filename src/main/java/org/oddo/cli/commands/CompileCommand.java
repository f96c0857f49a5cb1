package org.oddo.cli.commands;

import com.typesafe.config.ConfigException;
import org.oddo.cli.CommandLineInterface;
import org.oddo.cli.config.ConfigLoader;
import org.oddo.compiler.OddoCompiler;
import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.api.CompilerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Compiles an Oddo file to a JavaScript module.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(index = "0", description = "The Oddo source file.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "The JavaScript file to write (default: standard output).")
    private File output;

    @Option(names = "--runtime-library", description = "The module the reactive runtime is imported from.")
    private String runtimeLibrary;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        CompilerConfig config;
        try {
            config = CompilerConfig.fromConfig(parent != null ? parent.getConfig() : ConfigLoader.load(null));
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }
        if (runtimeLibrary != null) {
            config = config.withRuntimeLibrary(runtimeLibrary);
        }

        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        String javascript;
        try {
            javascript = new OddoCompiler(config).compile(source, file.getName(), config);
        } catch (CompilationException e) {
            err.println(file.getName() + ": " + e.getMessage());
            return CommandLineInterface.EXIT_COMPILATION_ERROR;
        }

        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(javascript);
            out.flush();
            return 0;
        }
        try {
            Files.writeString(output.toPath(), javascript, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot write " + output + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }
        LOG.info("Compiled {} to {}", file, output);
        return 0;
    }
}
