package com.callplatform.guardsvc.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for guard decisions and degraded-mode events.
 */
@Component
public class GuardMetrics {

    private static final String SERVICE = "guard-service";

    private final MeterRegistry registry;

    public GuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void decision(String outcome) {
        counter("guard.decisions.total", "Guard decisions by outcome", "outcome", outcome).increment();
    }

    public void failOpen(String component) {
        counter("guard.fail_open.total", "Requests let through because a dependency failed",
                "component", component).increment();
    }

    public void bypassDetected(String type) {
        counter("guard.bypass.detected.total", "Detected bypass attempts", "type", type).increment();
    }

    public void captchaVerification(String result) {
        counter("guard.captcha.verification.total", "CAPTCHA verification outcomes", "result", result).increment();
    }

    public void suspiciousActivity(String type) {
        counter("guard.behavior.findings.total", "Behavioral findings", "type", type).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tag("service", SERVICE)
                .tag(tagKey, tagValue)
                .register(registry);
    }
}
