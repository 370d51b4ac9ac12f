package com.reasons.config;

import com.reasons.exception.ConfigurationException;
import com.reasons.lexer.LexerOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static ReasonsConfig parse(String yaml) {
        return ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        ReasonsConfig config = ConfigLoader.load("classpath:reasons-test.yaml");

        assertEquals("orders", config.name());
        assertEquals("classpath:rules/orders.rules", config.rulesPath());
        assertFalse(config.lexer().golfMode());
        assertTrue(config.tracing());
        assertTrue(config.explanations());
        assertEquals(500, config.maxTraceEntries());
        assertTrue(config.optimize());
        assertEquals(0.5, config.defaultWeight());
    }

    @Test
    @DisplayName("Should apply defaults for missing sections")
    void shouldApplyDefaults() {
        ReasonsConfig config = parse("reasons:\n  name: minimal\n");

        assertEquals("minimal", config.name());
        assertNull(config.rulesPath());
        assertEquals(LexerOptions.defaults(), config.lexer());
        assertEquals(ReasonsConfig.defaults().maxTraceEntries(), config.maxTraceEntries());
        assertFalse(config.tracing());
    }

    @Test
    @DisplayName("Should read lexer options")
    void shouldReadLexerOptions() {
        ReasonsConfig config = parse("reasons:\n  lexer:\n    golf-mode: true\n    case-sensitive: 'false'\n");

        assertEquals(new LexerOptions(true, true, false), config.lexer());
    }

    @Test
    @DisplayName("Should reject malformed configuration")
    void shouldRejectMalformed() {
        assertThrows(ConfigurationException.class, () -> parse(""));
        assertThrows(ConfigurationException.class, () -> parse("other:\n  name: x\n"));
        assertThrows(ConfigurationException.class, () -> parse("reasons:\n  lexer: yes\n"));
        assertThrows(ConfigurationException.class,
                () -> parse("reasons:\n  evaluation:\n    max-trace-entries: lots\n"));
        assertThrows(ConfigurationException.class,
                () -> parse("reasons:\n  evaluation:\n    max-trace-entries: 0\n"));
    }

    @Test
    @DisplayName("Should wrap missing files in a configuration exception")
    void shouldReportMissingFile() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:does-not-exist.yaml"));

        assertNotNull(error.getCause());
        assertThrows(ConfigurationException.class, () -> ConfigLoader.loadSource(" "));
    }

    @Test
    @DisplayName("Should read rule sources")
    void shouldLoadSource() {
        String source = ConfigLoader.loadSource("classpath:rules/orders.rules");

        assertTrue(source.contains("rule shipping"));
    }
}
