package com.flaglang.config;

import com.flaglang.exception.ConfigurationException;
import com.flaglang.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load configuration from classpath")
    void shouldLoadFromClasspath() {
        FlagsConfig config = ConfigLoader.load("classpath:flaglang-test.yaml");

        assertEquals("storefront", config.name());
        assertEquals(List.of("classpath:flags/storefront.flags", "classpath:flags/overrides.flags"),
                config.sources());
        assertTrue(config.evaluator().cache());
        assertFalse(config.evaluator().throwOnError());
        assertEquals(Value.BooleanValue.FALSE, config.evaluator().defaultValue());
    }

    @Test
    @DisplayName("Should read root-level keys and a single source string")
    void shouldLoadRootLevelConfig() {
        FlagsConfig config = ConfigLoader.load("classpath:flaglang-strict.yaml");

        assertEquals("strict", config.name());
        assertEquals(List.of("classpath:flags/storefront.flags"), config.sources());
        assertFalse(config.evaluator().cache());
        assertTrue(config.evaluator().throwOnError());
        assertEquals(new Value.TextValue("off"), config.evaluator().defaultValue());
    }

    @Test
    @DisplayName("Should load configuration and sources from the filesystem")
    void shouldLoadFromFilesystem() throws IOException {
        Path flags = tempDir.resolve("local.flags");
        Files.writeString(flags, "FF-local -> true\n");
        Path yaml = tempDir.resolve("flaglang.yaml");
        Files.writeString(yaml, "flags:\n  sources:\n    - " + flags + "\n");

        FlagsConfig config = ConfigLoader.load(yaml.toString());

        assertEquals("default", config.name());
        assertEquals("FF-local -> true\n", ConfigLoader.loadSource(config.sources().get(0)));
    }

    @Test
    @DisplayName("Should reject empty, missing and incomplete configuration")
    void shouldRejectBadConfiguration() {
        ConfigurationException empty = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:flaglang-empty.yaml"));
        assertEquals("Configuration file is empty", empty.getMessage());

        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:flaglang-no-sources.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.loadSource(tempDir.resolve("nope.flags").toString()));
    }

    @ParameterizedTest
    @CsvSource({
            "classpath:flaglang-blank-section.yaml, flags must be a mapping",
            "classpath:flaglang-scalar-evaluator.yaml, flags.evaluator must be a mapping",
            "classpath:flaglang-list-root.yaml, Configuration root must be a mapping"
    })
    @DisplayName("Should reject sections that are not mappings")
    void shouldRejectNonMappingSections(String path, String message) {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ConfigLoader.load(path));

        assertTrue(e.getMessage().startsWith(message), e.getMessage());
    }
}
