package com.callplatform.guardsvc.domain.guard;

import com.callplatform.guardsvc.domain.bypass.BypassAnalysis;
import com.callplatform.guardsvc.domain.captcha.CaptchaDecision;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Verdict of the guard pipeline for one request. {@code retryAfter} is in seconds.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GuardDecision(
        GuardOutcome outcome,
        String identifier,
        String reason,
        String ruleId,
        Long retryAfter,
        RateLimitResult rateLimit,
        CaptchaDecision captcha,
        BypassAnalysis bypass,
        boolean degraded
) {
    public static final GuardDecision SKIP = GuardDecision.builder().outcome(GuardOutcome.SKIPPED).build();

    public boolean permitted() {
        return outcome.permits();
    }

    public static GuardDecision failOpen(String identifier) {
        return GuardDecision.builder()
                .outcome(GuardOutcome.ALLOWED)
                .identifier(identifier)
                .degraded(true)
                .build();
    }
}
