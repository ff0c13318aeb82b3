package com.callplatform.guardsvc.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Circuit breakers for the guard's I/O boundaries (counter store, geo provider, CAPTCHA vendor)
 * and the shared time source.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${app.resilience.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${app.resilience.wait-in-open-state-seconds:30}") long waitInOpenStateSeconds) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitInOpenStateSeconds))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
