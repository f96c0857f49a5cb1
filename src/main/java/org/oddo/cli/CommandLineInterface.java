package org.oddo.cli;

import com.typesafe.config.Config;
import org.oddo.cli.commands.CompileCommand;
import org.oddo.cli.commands.ParseCommand;
import org.oddo.cli.config.ConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "oddo",
    mixinStandardHelpOptions = true,
    version = "Oddo 0.1.0",
    description = "Oddo - compiles Oddo sources to JavaScript modules",
    subcommands = {
        CompileCommand.class,
        ParseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for invalid Oddo input. */
    public static final int EXIT_COMPILATION_ERROR = 1;
    /** Exit code for unreadable input, unwritable output or a broken configuration. */
    public static final int EXIT_IO_ERROR = 2;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " if present)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("oddo");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * @return The merged configuration, loaded on first use.
     * @throws IllegalArgumentException if the configured file does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
        }
        return config;
    }
}
