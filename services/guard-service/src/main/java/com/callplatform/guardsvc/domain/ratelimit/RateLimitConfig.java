package com.callplatform.guardsvc.domain.ratelimit;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;

import java.time.Duration;

/**
 * One resolved limit tier. The name scopes the counter, so tiers never share quota.
 */
public record RateLimitConfig(String name, long windowMs, int maxRequests) {

    public RateLimitConfig {
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("name", "Tier name is required");
        }
        if (windowMs <= 0) {
            throw new InvalidRequestException("windowMs", "Window must be positive: " + windowMs);
        }
        if (maxRequests <= 0) {
            throw new InvalidRequestException("maxRequests", "Max requests must be positive: " + maxRequests);
        }
    }

    public static RateLimitConfig of(String name, Duration window, int maxRequests) {
        return new RateLimitConfig(name, window.toMillis(), maxRequests);
    }

    /**
     * Shrinks the allowance by a bypass penalty: {@code max(1, floor(maxRequests / multiplier))}.
     * Multipliers at or below 1 leave the tier unchanged.
     */
    public RateLimitConfig withPenalty(double multiplier) {
        if (Double.isNaN(multiplier) || multiplier <= 1.0) {
            return this;
        }
        int reduced = (int) Math.max(1, Math.floor(maxRequests / multiplier));
        return new RateLimitConfig(name, windowMs, reduced);
    }

    public Duration window() {
        return Duration.ofMillis(windowMs);
    }
}
