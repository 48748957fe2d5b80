package org.drawtime.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the precedence rules of {@link ConfigLoader}.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String LINE_WIDTH = "drawtime.render.line-width";

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        // system properties are cached per JVM
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(LINE_WIDTH);
        ConfigFactory.invalidateCaches();
    }

    private File write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    void load_withoutAnyFile_shouldUseReferenceDefaults() throws Exception {
        Config config = ConfigLoader.load(null, dir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile());

        assertThat(config.getDouble(LINE_WIDTH)).isEqualTo(2.0);
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    void load_withWorkingDirectoryFile_shouldOverrideDefaults() throws Exception {
        File local = write(ConfigLoader.CONFIG_FILE_NAME, "drawtime.render.line-width = 3.5");

        Config config = ConfigLoader.load(null, local);

        assertThat(config.getDouble(LINE_WIDTH)).isEqualTo(3.5);
        assertThat(config.getDouble("drawtime.render.dash-length")).isEqualTo(4.0);
    }

    @Test
    void load_withExplicitFile_shouldTakePrecedenceOverWorkingDirectoryFile() throws Exception {
        File local = write(ConfigLoader.CONFIG_FILE_NAME, "drawtime.render.line-width = 3.5");
        File explicit = write("custom.conf", "drawtime.render.line-width = 5");

        Config config = ConfigLoader.load(explicit, local);

        assertThat(config.getDouble(LINE_WIDTH)).isEqualTo(5.0);
    }

    @Test
    void load_withSystemProperty_shouldOverrideFile() throws Exception {
        File explicit = write("custom.conf", "drawtime.render.line-width = 5");
        System.setProperty(LINE_WIDTH, "7");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(explicit, dir.resolve("absent.conf").toFile());

        assertThat(config.getDouble(LINE_WIDTH)).isEqualTo(7.0);
    }

    @Test
    void load_withMissingExplicitFile_shouldThrow() {
        File missing = dir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing, dir.resolve("absent.conf").toFile()))
                .isInstanceOf(FileNotFoundException.class)
                .hasMessageContaining("missing.conf");
    }
}
