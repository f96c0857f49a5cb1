package org.oddo.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Options of the code generator.
 *
 * @param runtimeLibrary The module the reactive runtime is imported from.
 * @param runtimeIdentifier The name the runtime is bound to in the generated code.
 */
public record CompilerConfig(String runtimeLibrary, String runtimeIdentifier) {

    /** The path of the compiler options inside the application configuration. */
    public static final String CONFIG_PATH = "oddo.compiler";

    public CompilerConfig {
        if (runtimeLibrary == null || runtimeLibrary.isBlank()) {
            throw new IllegalArgumentException("runtimeLibrary must not be blank");
        }
        if (runtimeIdentifier == null || runtimeIdentifier.isBlank()) {
            throw new IllegalArgumentException("runtimeIdentifier must not be blank");
        }
    }

    /**
     * @return The options defined in the bundled {@code reference.conf}.
     */
    public static CompilerConfig defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads the options from a configuration tree.
     * @param config The application configuration; must contain the {@code oddo.compiler} section.
     * @return The options.
     */
    public static CompilerConfig fromConfig(Config config) {
        Config section = config.getConfig(CONFIG_PATH);
        return new CompilerConfig(section.getString("runtime-library"), section.getString("runtime-identifier"));
    }

    /**
     * @param library The module the runtime is imported from.
     * @return A copy of these options with a different runtime library.
     */
    public CompilerConfig withRuntimeLibrary(String library) {
        return new CompilerConfig(library, runtimeIdentifier);
    }
}
