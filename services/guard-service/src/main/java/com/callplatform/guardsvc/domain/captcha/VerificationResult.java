package com.callplatform.guardsvc.domain.captcha;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one verification attempt. {@code state} is null when the challenge id is unknown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResult(boolean success, String error, ChallengeState state, Integer remainingAttempts) {

    public static final String EXPIRED = "Challenge expired";
    public static final String NOT_FOUND = "Challenge not found";
    public static final String EXHAUSTED = "Maximum verification attempts exceeded";
    public static final String WRONG_CLIENT = "Challenge was issued to a different client";
    public static final String UNAVAILABLE = "CAPTCHA verification unavailable";

    public static VerificationResult verified() {
        return new VerificationResult(true, null, ChallengeState.VERIFIED, null);
    }

    public static VerificationResult failed(String error, ChallengeState state, Integer remainingAttempts) {
        return new VerificationResult(false, error, state, remainingAttempts);
    }
}
