package com.callplatform.guardsvc.shared.exception;

import java.time.Duration;

/**
 * Thrown by the service's own endpoints when a caller exceeds their allowance.
 */
public final class RateLimitedException extends GuardServiceException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public long getRetryAfterSeconds() {
        return Math.max(1, retryAfter.toSeconds());
    }

    @Override
    public String getErrorCode() {
        return "RATE_LIMITED";
    }

    @Override
    public int getHttpStatus() {
        return 429;
    }
}
