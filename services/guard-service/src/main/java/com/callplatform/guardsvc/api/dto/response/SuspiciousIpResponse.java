package com.callplatform.guardsvc.api.dto.response;

public record SuspiciousIpResponse(
    String ipAddress,
    String country,
    boolean suspicious
) {}
