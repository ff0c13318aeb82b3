package com.callplatform.guardsvc.domain.behavior;

import com.callplatform.guardsvc.config.GuardProperties;

/**
 * Independent 0-100 sub-scores, one per detector. Zero means the detector saw nothing.
 */
public record RiskFactors(
        int burstActivity,
        int regularIntervals,
        int errorRate,
        int endpointScanning,
        int credentialStuffing,
        int sessionAnomalies
) {
    public static final RiskFactors NONE = new RiskFactors(0, 0, 0, 0, 0, 0);

    public RiskFactors {
        burstActivity = clamp(burstActivity);
        regularIntervals = clamp(regularIntervals);
        errorRate = clamp(errorRate);
        endpointScanning = clamp(endpointScanning);
        credentialStuffing = clamp(credentialStuffing);
        sessionAnomalies = clamp(sessionAnomalies);
    }

    public double weightedSum(GuardProperties.Weights weights) {
        return burstActivity * weights.getBurstActivity()
                + regularIntervals * weights.getRegularIntervals()
                + errorRate * weights.getErrorRate()
                + endpointScanning * weights.getEndpointScanning()
                + credentialStuffing * weights.getCredentialStuffing()
                + sessionAnomalies * weights.getSessionAnomalies();
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
