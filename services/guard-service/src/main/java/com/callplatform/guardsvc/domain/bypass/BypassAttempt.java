package com.callplatform.guardsvc.domain.bypass;

import com.callplatform.guardsvc.domain.model.Severity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Audit record of one detection. {@code blocked} flips once the penalized request is actually denied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BypassAttempt(
        String id,
        BypassType type,
        Severity severity,
        int confidence,
        Map<String, Object> evidence,
        boolean blocked,
        long lastDetected
) {
    public BypassAttempt {
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }

    public BypassAttempt asBlocked() {
        return new BypassAttempt(id, type, severity, confidence, evidence, true, lastDetected);
    }
}
