package com.smurthy.ai.agri.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.Map;

/**
 * Retry policy for upstream HTTP calls made by specialists.
 *
 * Back-off is kept short because every retry eats into the specialist's dispatch budget.
 */
@Configuration
public class RetryConfig {

    @Value("${advisor.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${advisor.retry.initial-interval-ms:200}")
    private long initialIntervalMs;

    @Bean
    public RetryTemplate upstreamRetryTemplate() {
        RetryTemplate retryTemplate = new RetryTemplate();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(initialIntervalMs);
        backOffPolicy.setMultiplier(2);
        backOffPolicy.setMaxInterval(1000);
        retryTemplate.setBackOffPolicy(backOffPolicy);

        // client errors (4xx) are not worth repeating
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxAttempts, Map.of(
                ResourceAccessException.class, true,
                HttpServerErrorException.class, true));
        retryTemplate.setRetryPolicy(retryPolicy);

        return retryTemplate;
    }
}
