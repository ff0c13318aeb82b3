package com.callplatform.guardsvc.domain.behavior;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One observed request. Append-only; retained per identifier for the analysis window.
 *
 * @param timestamp    epoch millis
 * @param responseTime handling time in millis
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BehaviorPattern(
        String ipAddress,
        long timestamp,
        String endpoint,
        String method,
        int responseStatus,
        long responseTime
) {
    @JsonIgnore
    public boolean isClientError() {
        return responseStatus >= 400 && responseStatus < 500;
    }

    @JsonIgnore
    public boolean isAuthFailure() {
        return responseStatus == 401 || responseStatus == 403;
    }
}
