package org.monkeylang.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests layering of configuration sources by {@link ConfigLoader}.
 */
public class ConfigLoaderTest {

    private static final String TRACE_KEY = "monkey.parser.trace";

    @BeforeEach
    void setUp() {
        System.clearProperty(TRACE_KEY);
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(TRACE_KEY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @Tag("unit")
    void loadsReferenceDefaults() {
        Config config = ConfigLoader.loadDefaults();

        assertThat(config.getBoolean(TRACE_KEY)).isFalse();
    }

    @Test
    @Tag("unit")
    void systemPropertyOverridesDefaults() {
        System.setProperty(TRACE_KEY, "true");
        ConfigFactory.invalidateCaches();

        assertThat(ConfigLoader.loadDefaults().getBoolean(TRACE_KEY)).isTrue();
    }

    @Test
    @Tag("unit")
    void fileOverridesDefaults() throws URISyntaxException {
        File file = new File(getClass().getClassLoader().getResource("test-interpreter.conf").toURI());

        Config config = ConfigLoader.loadFromFile(file);

        assertThat(config.getBoolean(TRACE_KEY)).isTrue();
    }

    @Test
    @Tag("unit")
    void systemPropertyOverridesFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("monkey.conf");
        Files.writeString(file, "monkey.parser.trace = true\n");
        System.setProperty(TRACE_KEY, "false");
        ConfigFactory.invalidateCaches();

        assertThat(ConfigLoader.loadFromFile(file.toFile()).getBoolean(TRACE_KEY)).isFalse();
    }

    @Test
    @Tag("unit")
    void fileMayRefineOnlySomeKeys(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("other.conf");
        Files.writeString(file, "unrelated { key = 1 }\n");

        Config config = ConfigLoader.loadFromFile(file.toFile());

        assertThat(config.getBoolean(TRACE_KEY)).isFalse();
        assertThat(config.getInt("unrelated.key")).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void missingFileIsRejected(@TempDir Path dir) {
        File missing = dir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.loadFromFile(missing))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope.conf");
    }
}
