package com.callplatform.guardsvc.domain.bypass;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Per-request verdict. The multiplier is folded into the rate-limit tier by the caller; 1.0 means no adjustment.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BypassAnalysis(
        boolean bypassAttempted,
        BypassType bypassType,
        double penaltyMultiplier,
        Map<String, Object> evidence,
        String attemptId
) {
    public static final BypassAnalysis NONE = new BypassAnalysis(false, null, 1.0, Map.of(), null);

    public BypassAnalysis {
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }
}
