package com.callplatform.guardsvc.domain.ratelimit;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one sliding-window admission check. {@code retryAfter} is in seconds and only
 * present on denial; {@code degraded} marks a fail-open answer given without the store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateLimitResult(
        boolean allowed,
        int limit,
        int remaining,
        long resetTime,
        Long retryAfter,
        int totalRequests,
        boolean degraded
) {
    public static RateLimitResult allowed(int limit, int remaining, long resetTime, int totalRequests) {
        return new RateLimitResult(true, limit, remaining, resetTime, null, totalRequests, false);
    }

    public static RateLimitResult denied(int limit, long resetTime, long retryAfterSeconds, int totalRequests) {
        return new RateLimitResult(false, limit, 0, resetTime, retryAfterSeconds, totalRequests, false);
    }

    /**
     * Answer given when the store cannot be reached: allowed, assuming this is the first request.
     */
    public static RateLimitResult failOpen(RateLimitConfig config, long nowMillis) {
        return new RateLimitResult(true, config.maxRequests(), Math.max(0, config.maxRequests() - 1),
                nowMillis + config.windowMs(), null, 0, true);
    }
}
