package com.callplatform.guardsvc.domain.guard;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GuardOutcome {
    SKIPPED(200),
    ALLOWED(200),
    GEO_BLOCKED(403),
    RULE_BLOCKED(403),
    RATE_LIMITED(429),
    CAPTCHA_REQUIRED(429),
    AUTHENTICATION_REQUIRED(429),
    EMERGENCY_MODE(503);

    private final int httpStatus;

    GuardOutcome(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean permits() {
        return this == SKIPPED || this == ALLOWED;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
