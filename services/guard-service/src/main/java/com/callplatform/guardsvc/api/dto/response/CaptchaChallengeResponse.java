package com.callplatform.guardsvc.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaptchaChallengeResponse(
    String challengeId,
    String difficulty,
    String captchaType,
    String siteKey,
    Instant expiresAt,
    int maxAttempts
) {}
