package com.callplatform.guardsvc.api.dto.request;

import jakarta.validation.constraints.Pattern;

public record CaptchaChallengeRequest(
    @Pattern(regexp = "(?i)easy|medium|hard", message = "Difficulty must be easy, medium or hard")
    String difficulty
) {}
