package se.chronotrust_be.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import se.chronotrust_be.exception.CollaboratorUnavailableException;

import java.time.Clock;

@Configuration
public class LifecycleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Bounded retry for transient chain and payment failures. Only
     * {@link CollaboratorUnavailableException} is retried; rejections surface immediately.
     */
    @Bean
    public RetryTemplate collaboratorRetryTemplate(
            @Value("${chronotrust.retry.max-attempts:4}") int maxAttempts,
            @Value("${chronotrust.retry.initial-interval-ms:500}") long initialInterval,
            @Value("${chronotrust.retry.multiplier:2.0}") double multiplier,
            @Value("${chronotrust.retry.max-interval-ms:8000}") long maxInterval) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialInterval, multiplier, maxInterval)
                .retryOn(CollaboratorUnavailableException.class)
                .build();
    }
}
