package org.oddo.cli.config;

import com.typesafe.config.Config;
import org.oddo.compiler.api.CompilerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ConfigLoader} and the mapping to {@link CompilerConfig}.
 * These are unit tests and do not require external resources.
 */
public class ConfigLoaderTest {

    /**
     * Verifies that the defaults from reference.conf apply when no file is given.
     * This is a unit test for the configuration loader.
     */
    @Test
    @Tag("unit")
    void testDefaults() {
        // Act
        CompilerConfig config = CompilerConfig.fromConfig(ConfigLoader.load(null));

        // Assert
        assertThat(config.runtimeLibrary()).isEqualTo("@oddo/ui");
        assertThat(config.runtimeIdentifier()).isEqualTo("$Oddo");
        assertThat(CompilerConfig.defaults()).isEqualTo(config);
    }

    /**
     * Verifies that values from a configuration file override the defaults, key by key.
     * This is a unit test for the configuration loader.
     */
    @Test
    @Tag("unit")
    void testFileOverridesDefaults(@TempDir Path tempDir) throws IOException {
        // Arrange
        Path file = tempDir.resolve("oddo.conf");
        Files.writeString(file, "oddo.compiler { runtime-library = \"my-runtime\" }\n");

        // Act
        Config merged = ConfigLoader.load(file.toFile());
        CompilerConfig config = CompilerConfig.fromConfig(merged);

        // Assert
        assertThat(config.runtimeLibrary()).isEqualTo("my-runtime");
        assertThat(config.runtimeIdentifier()).isEqualTo("$Oddo");
    }

    /**
     * Verifies that an explicitly given file must exist.
     * This is a unit test for the configuration loader.
     */
    @Test
    @Tag("unit")
    void testMissingFileIsRejected(@TempDir Path tempDir) {
        File missing = tempDir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }

    /**
     * Verifies that blank settings are rejected when the compiler configuration is created.
     * This is a unit test for the compiler configuration.
     */
    @Test
    @Tag("unit")
    void testBlankRuntimeLibraryIsRejected() {
        assertThatThrownBy(() -> CompilerConfig.defaults().withRuntimeLibrary(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
