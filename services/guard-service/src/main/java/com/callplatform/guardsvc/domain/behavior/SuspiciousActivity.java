package com.callplatform.guardsvc.domain.behavior;

import com.callplatform.guardsvc.domain.model.Severity;

import java.util.Map;

/**
 * A detector finding over one identifier's event window. Confidence runs 0-100.
 */
public record SuspiciousActivity(
        ActivityType type,
        Severity severity,
        int confidence,
        String description,
        Map<String, Object> evidence,
        long detectedAt
) {
    public SuspiciousActivity {
        confidence = Math.max(0, Math.min(100, confidence));
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }
}
