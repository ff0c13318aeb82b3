package com.callplatform.guardsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record SuspiciousIpRequest(
    @NotBlank(message = "IP address is required")
    @Size(max = 45, message = "IP address too long")
    String ipAddress,

    @Size(min = 2, max = 2, message = "Country must be an ISO 3166 alpha-2 code")
    String country,

    @Positive(message = "TTL must be positive")
    Long ttlSeconds
) {}
