package com.flaglang.spring;

import com.flaglang.adapter.spring.FlagsAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers the {@link com.flaglang.config.FlagClient} and
 * {@link com.flaglang.evaluator.FlagEvaluator} beans in applications that do not
 * rely on auto-configuration.
 * <p>
 * Usage:
 * <pre>
 * &#64;Configuration
 * &#64;EnableFlags
 * public class CheckoutConfiguration {
 * }
 *
 * &#64;Service
 * public class CheckoutService {
 *     private final FlagClient flags;
 *
 *     public boolean useNewCheckout(String countryCode) {
 *         return flags.isEnabled("FF-new-checkout",
 *                 EvaluationContext.builder().variable("countryCode", countryCode).build());
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(FlagsAutoConfiguration.class)
public @interface EnableFlags {
}
