package com.smurthy.ai.agri.config;

import com.smurthy.ai.agri.model.Category;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for specialist dispatch.
 *
 * @param specialistTimeout  default per-specialist budget
 * @param categoryTimeouts   budget overrides keyed by category
 * @param poolSize           threads in the specialist executor
 */
@ConfigurationProperties(prefix = "advisor.dispatch")
public record DispatchConfig(
        @DefaultValue("5s") Duration specialistTimeout,
        Map<Category, Duration> categoryTimeouts,
        @DefaultValue("32") int poolSize
) {
    public DispatchConfig {
        if (specialistTimeout == null || specialistTimeout.isNegative() || specialistTimeout.isZero()) {
            throw new IllegalArgumentException("advisor.dispatch.specialist-timeout must be positive");
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("advisor.dispatch.pool-size must be at least 1");
        }
        categoryTimeouts = categoryTimeouts == null || categoryTimeouts.isEmpty()
                ? Map.of()
                : new EnumMap<>(categoryTimeouts);
    }

    public static DispatchConfig withTimeout(Duration specialistTimeout) {
        return new DispatchConfig(specialistTimeout, Map.of(), 32);
    }

    public Duration timeoutFor(Category category) {
        return categoryTimeouts.getOrDefault(category, specialistTimeout);
    }
}
