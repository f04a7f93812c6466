package com.flaglang.adapter.spring;

import com.flaglang.config.ConfigLoader;
import com.flaglang.config.FlagClient;
import com.flaglang.config.FlagsConfig;
import com.flaglang.evaluator.DefaultFlagEvaluator;
import com.flaglang.evaluator.FlagEvaluator;
import com.flaglang.evaluator.ValidationResult;
import com.flaglang.exception.ConfigurationException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for feature flags.
 */
@Configuration
@ConditionalOnProperty(prefix = "flaglang", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FlagsProperties.class)
public class FlagsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FlagsAutoConfiguration.class);

    private FlagEvaluator flagEvaluator;

    @Bean
    @ConditionalOnMissingBean
    public FlagsConfig flagsConfig(FlagsProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public FlagEvaluator flagEvaluator(FlagsConfig config) {
        log.info("Creating FlagEvaluator for: {}", config.name());
        this.flagEvaluator = new DefaultFlagEvaluator(config.evaluator());
        return this.flagEvaluator;
    }

    @Bean
    @ConditionalOnMissingBean
    public FlagClient flagClient(FlagsConfig config, FlagEvaluator evaluator, FlagsProperties properties) {
        FlagClient client = FlagClient.from(config, evaluator);
        if (properties.isValidateOnStartup()) {
            ValidationResult result = client.validate();
            if (!result.valid()) {
                throw new ConfigurationException("Invalid flag sources in '" + config.name() + "': "
                        + String.join("; ", result.errors()));
            }
        }
        return client;
    }

    @PreDestroy
    public void shutdown() {
        if (flagEvaluator != null) {
            log.info("Clearing FlagEvaluator program cache");
            flagEvaluator.clearCache();
        }
    }
}
