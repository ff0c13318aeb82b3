package com.callplatform.guardsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record BlockingRuleRequest(
    @NotBlank(message = "Rule type is required")
    String type,

    @NotBlank(message = "Value is required")
    @Size(max = 255, message = "Value too long")
    String value,

    @Size(max = 500, message = "Reason too long")
    String reason,

    boolean temporary
) {}
