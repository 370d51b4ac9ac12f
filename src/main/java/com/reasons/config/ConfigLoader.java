package com.reasons.config;

import com.reasons.exception.ConfigurationException;
import com.reasons.lexer.LexerOptions;
import com.reasons.trace.ExecutionTrace;
import com.reasons.tree.TreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Loads Reasons configuration from YAML files.
 * <pre>
 * reasons:
 *   name: pricing
 *   rules: classpath:rules/pricing.rules
 *   lexer:
 *     golf-mode: false
 *     skip-comments: true
 *     case-sensitive: true
 *   evaluation:
 *     tracing: false
 *     explanations: true
 *     max-trace-entries: 10000
 *   optimizer:
 *     enabled: true
 *     default-weight: 1.0
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ReasonsConfig load(String path) {
        log.info("Loading Reasons configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Read a rules source file.
     * Supports classpath: prefix for classpath resources.
     */
    public static String loadSource(String path) {
        log.debug("Reading rules from: {}", path);
        try (InputStream inputStream = getResource(path).getInputStream()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read rules from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Path must not be empty");
        }
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static ReasonsConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        Map<String, Object> reasons = (Map<String, Object>) root.get("reasons");
        if (reasons == null) {
            throw new ConfigurationException("Missing 'reasons' root element");
        }

        Map<String, Object> lexer = section(reasons, "lexer");
        Map<String, Object> evaluation = section(reasons, "evaluation");
        Map<String, Object> optimizer = section(reasons, "optimizer");

        LexerOptions defaults = LexerOptions.defaults();
        LexerOptions lexerOptions = new LexerOptions(
                getBoolean(lexer, "golf-mode", defaults.golfMode()),
                getBoolean(lexer, "skip-comments", defaults.skipComments()),
                getBoolean(lexer, "case-sensitive", defaults.caseSensitive()));

        int maxTraceEntries = getInt(evaluation, "max-trace-entries", ExecutionTrace.DEFAULT_MAX_ENTRIES);
        if (maxTraceEntries <= 0) {
            throw new ConfigurationException("max-trace-entries must be positive, got " + maxTraceEntries);
        }

        ReasonsConfig config = new ReasonsConfig(
                getString(reasons, "name", "reasons"),
                getString(reasons, "rules", null),
                lexerOptions,
                getBoolean(optimizer, "enabled", true),
                getDouble(optimizer, "default-weight", TreeBuilder.DEFAULT_WEIGHT),
                getBoolean(evaluation, "tracing", false),
                getBoolean(evaluation, "explanations", true),
                maxTraceEntries);
        log.debug("Loaded configuration: {}", config);
        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object value = parent.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
