package org.oddo.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@code compile} and {@code parse} commands of the {@link CommandLineInterface}.
 * Sources are written to a temporary directory; output and errors are captured in memory.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private Path source(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Verifies that the compile command prints the generated module to standard output.
     * This is an integration test for the command line interface.
     */
    @Test
    @Tag("integration")
    void testCompileToStandardOutput() throws IOException {
        // Arrange
        Path file = source("app.oddo", "@state x = 1\n");

        // Act
        int exitCode = commandLine.execute("compile", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("import $Oddo from \"@oddo/ui\";\nconst x = $Oddo.state(1);\n");
    }

    /**
     * Verifies that the compile command writes to the given output file and applies the runtime library option.
     * This is an integration test for the command line interface.
     */
    @Test
    @Tag("integration")
    void testCompileToFileWithRuntimeLibrary() throws IOException {
        // Arrange
        Path file = source("app.oddo", "@state x = 1\n");
        Path target = tempDir.resolve("app.js");

        // Act
        int exitCode = commandLine.execute("compile", file.toString(), "-o", target.toString(), "--runtime-library", "./rt.js");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(Files.readString(target)).startsWith("import $Oddo from \"./rt.js\";");
    }

    /**
     * Verifies that a configuration file given with --config is applied.
     * This is an integration test for the command line interface.
     */
    @Test
    @Tag("integration")
    void testCompileWithConfigurationFile() throws IOException {
        // Arrange
        Path file = source("app.oddo", "@state x = 1\n");
        Path config = source("custom.conf", "oddo.compiler.runtime-identifier = \"UI\"\n");

        // Act
        int exitCode = commandLine.execute("--config", config.toString(), "compile", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("import UI from \"@oddo/ui\";\nconst x = UI.state(1);\n");
    }

    /**
     * Verifies that invalid Oddo input is reported with the file name and exit code 1.
     * This is an integration test for the command line interface.
     */
    @Test
    @Tag("integration")
    void testCompilationErrorExitCode() throws IOException {
        // Arrange
        Path file = source("broken.oddo", "x = 1 2\n");

        // Act
        int exitCode = commandLine.execute("compile", file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_COMPILATION_ERROR);
        assertThat(err.toString()).contains("broken.oddo").contains("Expected end of statement");
    }

    /**
     * Verifies that a missing source file or configuration file results in exit code 2.
     * This is an integration test for the command line interface.
     */
    @Test
    @Tag("integration")
    void testMissingFilesExitCode() throws IOException {
        // Arrange
        Path file = source("app.oddo", "x = 1\n");
        Path missing = tempDir.resolve("missing.oddo");

        // Act
        int missingSource = commandLine.execute("compile", missing.toString());
        int missingConfig = new CommandLine(new CommandLineInterface())
                .setErr(new PrintWriter(new StringWriter()))
                .execute("--config", tempDir.resolve("missing.conf").toString(), "compile", file.toString());

        // Assert
        assertThat(missingSource).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(missingConfig).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
    }

    /**
     * Verifies that the parse command prints the AST as JSON.
     * This is an integration test for the command line interface.
     */
    @Test
    @Tag("integration")
    void testParsePrintsJson() throws IOException {
        // Arrange
        Path file = source("app.oddo", "x = 1\n");

        // Act
        int exitCode = commandLine.execute("parse", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("\"type\" : \"program\"")
                .contains("\"type\" : \"variableDeclaration\"")
                .contains("\"name\" : \"x\"");
    }
}
