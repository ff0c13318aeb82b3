package com.callplatform.guardsvc.domain.bypass;

import java.util.Map;

/**
 * @param mitigationEffectiveness percentage (0-100) of attempts that ended blocked
 */
public record BypassStats(
        StatsPeriod period,
        long totalAttempts,
        Map<String, Long> attemptsByType,
        long blockedAttempts,
        int mitigationEffectiveness
) {
    public static BypassStats of(StatsPeriod period, Map<String, Long> attemptsByType, long total, long blocked) {
        int effectiveness = total == 0 ? 0 : (int) Math.round(blocked * 100.0 / total);
        return new BypassStats(period, total, Map.copyOf(attemptsByType), blocked, effectiveness);
    }
}
