package com.flaglang.config;

import com.flaglang.evaluator.EvaluatorOptions;
import com.flaglang.exception.ConfigurationException;
import com.flaglang.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads flag configuration from YAML files and flag sources from text files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     * @throws ConfigurationException if the file is missing, empty or malformed
     */
    public static FlagsConfig load(String path) {
        log.info("Loading flag configuration from: {}", path);

        try (InputStream inputStream = getResource(path).getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in: " + path, e);
        }
    }

    /**
     * Read one flag source file as UTF-8 text.
     *
     * @throws ConfigurationException if the file cannot be read
     */
    public static String loadSource(String path) {
        try (InputStream inputStream = getResource(path).getInputStream()) {
            String source = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("Read {} characters of flag source from {}", source.length(), path);
            return source;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read flag source from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    private static FlagsConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(inputStream);

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMapping(document, "Configuration root");

        // The flags section can be at root or under 'flags' key
        Map<String, Object> flagsConfig = root.containsKey("flags")
                ? asMapping(root.get("flags"), "flags")
                : root;

        String name = getString(flagsConfig, "name", "default");
        List<String> sources = parseSources(flagsConfig.get("sources"));
        Object evaluatorSection = flagsConfig.get("evaluator");
        EvaluatorOptions evaluator = parseEvaluator(
                evaluatorSection != null ? asMapping(evaluatorSection, "flags.evaluator") : null);

        log.info("Loaded flag configuration: {} with {} sources, cache={}, throw-on-error={}, default-value={}",
                name, sources.size(), evaluator.cache(), evaluator.throwOnError(), evaluator.defaultValue());

        return new FlagsConfig(name, sources, evaluator);
    }

    private static List<String> parseSources(Object sourcesValue) {
        if (sourcesValue == null) {
            throw new ConfigurationException("No flag sources configured. Define them under flags.sources.");
        }
        if (!(sourcesValue instanceof List<?> list)) {
            return List.of(sourcesValue.toString());
        }
        if (list.isEmpty()) {
            throw new ConfigurationException("No flag sources configured. Define them under flags.sources.");
        }

        List<String> sources = new ArrayList<>(list.size());
        for (Object source : list) {
            if (source == null || source.toString().isBlank()) {
                throw new ConfigurationException("Blank entry in flags.sources");
            }
            sources.add(source.toString());
        }
        return sources;
    }

    private static EvaluatorOptions parseEvaluator(Map<String, Object> map) {
        EvaluatorOptions defaults = EvaluatorOptions.defaults();
        if (map == null) {
            return defaults;
        }

        boolean cache = getBoolean(map, "cache", defaults.cache());
        boolean throwOnError = getBoolean(map, "throw-on-error", defaults.throwOnError());
        Object defaultValue = map.get("default-value");

        try {
            Value value = defaultValue != null ? Value.of(defaultValue) : defaults.defaultValue();
            return new EvaluatorOptions(cache, throwOnError, value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported evaluator.default-value: " + defaultValue, e);
        }
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMapping(Object value, String section) {
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException(section + " must be a mapping, got "
                    + (value == null ? "nothing" : value.getClass().getSimpleName()));
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
