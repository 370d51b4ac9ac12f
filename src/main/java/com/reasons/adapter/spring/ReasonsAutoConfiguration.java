package com.reasons.adapter.spring;

import com.reasons.config.ConfigLoader;
import com.reasons.config.ReasonsConfig;
import com.reasons.engine.RuleEngine;
import com.reasons.engine.RuleEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Reasons.
 */
@Configuration
@ConditionalOnProperty(prefix = "reasons", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ReasonsProperties.class)
public class ReasonsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReasonsAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ReasonsConfig reasonsConfig(ReasonsProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleEngine ruleEngine(ReasonsConfig config) {
        log.info("Creating RuleEngine: {}", config.name());
        return RuleEngineFactory.create(config);
    }
}
