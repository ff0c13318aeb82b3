package com.callplatform.guardsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;

public record BlockCheckRequest(
    @NotBlank(message = "Rule type is required")
    String type,

    @NotBlank(message = "Value is required")
    String value
) {}
