package com.callplatform.guardsvc.domain.behavior;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Composite trust estimate for one identifier; 100 is clean. Derived from the event window and cached briefly.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BehaviorScore(
        String identifier,
        int overallScore,
        RiskFactors riskFactors,
        List<String> recommendations,
        long computedAt
) {
    public BehaviorScore {
        overallScore = Math.max(0, Math.min(100, overallScore));
        riskFactors = riskFactors == null ? RiskFactors.NONE : riskFactors;
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /** Score for an identifier with no recorded history. */
    public static BehaviorScore clean(String identifier) {
        return new BehaviorScore(identifier, 100, RiskFactors.NONE, List.of(), 0L);
    }
}
