package com.callplatform.guardsvc.domain.captcha;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One issued challenge, bound to the issuing IP. Times are epoch millis.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaptchaChallenge(
        String id,
        Difficulty difficulty,
        String ipAddress,
        long createdAt,
        long expiry,
        int attempts,
        int maxAttempts,
        boolean verified
) {
    public ChallengeState state(long now) {
        if (verified) {
            return ChallengeState.VERIFIED;
        }
        if (now > expiry) {
            return ChallengeState.EXPIRED;
        }
        if (attempts >= maxAttempts) {
            return ChallengeState.EXHAUSTED;
        }
        return ChallengeState.ISSUED;
    }

    @JsonIgnore
    public int remainingAttempts() {
        return Math.max(0, maxAttempts - attempts);
    }

    public CaptchaChallenge withFailedAttempt() {
        return new CaptchaChallenge(id, difficulty, ipAddress, createdAt, expiry, attempts + 1, maxAttempts, false);
    }
}
