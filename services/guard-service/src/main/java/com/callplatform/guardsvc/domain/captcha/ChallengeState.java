package com.callplatform.guardsvc.domain.captcha;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Challenge lifecycle. Only ISSUED accepts verification attempts; the rest are terminal.
 */
public enum ChallengeState {
    ISSUED,
    VERIFIED,
    EXPIRED,
    EXHAUSTED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
