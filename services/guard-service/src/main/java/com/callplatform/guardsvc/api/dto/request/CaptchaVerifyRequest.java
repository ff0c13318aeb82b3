package com.callplatform.guardsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CaptchaVerifyRequest(
    @NotBlank(message = "Challenge id is required")
    @Size(max = 64, message = "Challenge id too long")
    String challengeId,

    @Size(max = 8192, message = "Response token too long")
    String response
) {}
