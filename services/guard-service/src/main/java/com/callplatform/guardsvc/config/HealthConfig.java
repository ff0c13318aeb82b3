package com.callplatform.guardsvc.config;

import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class HealthConfig {

    private final CounterStore counterStore;

    /**
     * Reports the counter store. A down store degrades the guard to fail-open, so the service
     * stays UP and the detail says so.
     */
    @Bean
    public HealthIndicator counterStoreHealthIndicator() {
        return () -> {
            boolean available;
            try {
                available = counterStore.isAvailable();
            } catch (RuntimeException e) {
                return Health.up()
                        .withDetail("counterStore", counterStore.getClass().getSimpleName())
                        .withDetail("mode", "fail-open")
                        .withDetail("error", e.getMessage())
                        .build();
            }
            return Health.up()
                    .withDetail("counterStore", counterStore.getClass().getSimpleName())
                    .withDetail("mode", available ? "enforcing" : "fail-open")
                    .build();
        };
    }

    @Bean
    public HealthIndicator livenessIndicator() {
        return () -> Health.up()
                .withDetail("service", "guard-service")
                .withDetail("status", "alive")
                .build();
    }
}
