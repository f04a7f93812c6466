package com.flaglang.adapter.spring;

import com.flaglang.config.FlagClient;
import com.flaglang.config.FlagsConfig;
import com.flaglang.evaluator.DefaultFlagEvaluator;
import com.flaglang.evaluator.EvaluatorOptions;
import com.flaglang.evaluator.FlagEvaluator;
import com.flaglang.interpreter.EvaluationContext;
import com.flaglang.spring.EnableFlags;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FlagsAutoConfiguration.
 */
class FlagsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FlagsAutoConfiguration.class))
            .withPropertyValues("flaglang.config-path=classpath:flaglang-test.yaml");

    @Test
    @DisplayName("Should create flag beans from the configured file")
    void shouldCreateBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(FlagsConfig.class));
            assertInstanceOf(DefaultFlagEvaluator.class, context.getBean(FlagEvaluator.class));

            FlagClient client = context.getBean(FlagClient.class);
            assertEquals("storefront", client.getName());
            assertTrue(client.isEnabled("FF-new-checkout", EvaluationContext.empty()));
        });
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("flaglang.enabled=false").run(context -> {
            assertTrue(context.getBeansOfType(FlagClient.class).isEmpty());
            assertTrue(context.getBeansOfType(FlagEvaluator.class).isEmpty());
        });
    }

    @Test
    @DisplayName("Should keep user-defined beans")
    void shouldKeepUserBeans() {
        contextRunner.withUserConfiguration(CustomConfig.class).run(context -> {
            FlagsConfig config = context.getBean(FlagsConfig.class);
            assertEquals("custom", config.name());
            assertEquals("custom", context.getBean(FlagClient.class).getName());
        });
    }

    @Test
    @DisplayName("Should fail startup when the configuration is missing")
    void shouldFailOnMissingConfiguration() {
        contextRunner.withPropertyValues("flaglang.config-path=classpath:missing.yaml")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should import flag beans through @EnableFlags")
    void shouldImportWithAnnotation() {
        new ApplicationContextRunner()
                .withPropertyValues("flaglang.config-path=classpath:flaglang-strict.yaml")
                .withUserConfiguration(FlagsApplication.class)
                .run(context -> {
                    FlagClient client = context.getBean(FlagClient.class);
                    assertEquals("strict", client.getName());
                    assertTrue(client.isEnabled("FF-new-checkout", EvaluationContext.empty()));

                    DefaultFlagEvaluator evaluator = (DefaultFlagEvaluator) context.getBean(FlagEvaluator.class);
                    assertFalse(evaluator.getOptions().cache());
                    assertTrue(evaluator.getOptions().throwOnError());
                });
    }

    @Test
    @DisplayName("Should fail startup when a flag source does not parse")
    void shouldFailOnInvalidSource() {
        contextRunner.withPropertyValues("flaglang.config-path=classpath:flaglang-broken-source.yaml")
                .run(context -> {
                    Throwable failure = context.getStartupFailure();
                    assertNotNull(failure);
                    assertTrue(rootMessage(failure).startsWith("Invalid flag sources in 'broken-source'"),
                            rootMessage(failure));
                });
    }

    @Test
    @DisplayName("Should start with an invalid source when startup validation is off")
    void shouldSkipValidationWhenDisabled() {
        contextRunner.withPropertyValues(
                        "flaglang.config-path=classpath:flaglang-broken-source.yaml",
                        "flaglang.validate-on-startup=false")
                .run(context -> {
                    FlagClient client = context.getBean(FlagClient.class);
                    assertFalse(client.validate().valid());
                    assertFalse(client.isEnabled("FF-half", EvaluationContext.empty()));
                });
    }

    private static String rootMessage(Throwable failure) {
        Throwable cause = failure;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    @Configuration
    @EnableFlags
    static class FlagsApplication {
    }

    @Configuration
    static class CustomConfig {

        @Bean
        FlagsConfig flagsConfig() {
            return new FlagsConfig("custom", List.of("classpath:flags/overrides.flags"), EvaluatorOptions.defaults());
        }
    }
}
