package com.flaglang.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for feature flags.
 * <pre>
 * flaglang:
 *   enabled: true
 *   config-path: classpath:flaglang.yaml
 *   validate-on-startup: true
 * </pre>
 * Evaluator options (cache, throw-on-error, default-value) live in the YAML file
 * named by {@code config-path}, next to the flag sources.
 */
@ConfigurationProperties(prefix = "flaglang")
public class FlagsProperties {

    /**
     * Whether flag evaluation beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the flag configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:flaglang.yaml";

    /**
     * Scan and parse every flag source when the client bean is created, failing
     * startup on the first lex or parse error instead of at the first evaluation.
     */
    private boolean validateOnStartup = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public boolean isValidateOnStartup() {
        return validateOnStartup;
    }

    public void setValidateOnStartup(boolean validateOnStartup) {
        this.validateOnStartup = validateOnStartup;
    }
}
