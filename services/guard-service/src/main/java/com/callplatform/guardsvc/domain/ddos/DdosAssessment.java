package com.callplatform.guardsvc.domain.ddos;

import com.callplatform.guardsvc.domain.model.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Set;

/**
 * Platform-wide traffic verdict. {@code severity} is null when no attack is detected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DdosAssessment(
        boolean attackDetected,
        Severity severity,
        Set<MitigationAction> actions,
        long requestsLastMinute,
        long requestsLastFiveMinutes,
        long uniqueIps
) {
    public static final DdosAssessment NONE = new DdosAssessment(false, null, Set.of(), 0, 0, 0);

    public DdosAssessment {
        actions = actions == null ? Set.of() : Set.copyOf(actions);
    }

    public boolean requires(MitigationAction action) {
        return actions.contains(action);
    }
}
