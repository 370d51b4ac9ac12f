package com.reasons.engine;

import com.reasons.config.ConfigLoader;
import com.reasons.config.ReasonsConfig;

/**
 * Factory for creating RuleEngine instances from configuration.
 */
public final class RuleEngineFactory {

    private RuleEngineFactory() {
    }

    public static RuleEngine create(ReasonsConfig config) {
        return new DefaultRuleEngine(config);
    }

    public static RuleEngine create(String configPath) {
        return create(ConfigLoader.load(configPath));
    }
}
