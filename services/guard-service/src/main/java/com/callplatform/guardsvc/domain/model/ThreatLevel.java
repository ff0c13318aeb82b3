package com.callplatform.guardsvc.domain.model;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Totally ordered IP threat level: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum ThreatLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    ThreatLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isAtLeast(ThreatLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Maps a 0-100 risk score onto a level: low &lt; 40, medium &lt; 70, high &lt; 85, critical otherwise.
     */
    public static ThreatLevel fromRiskScore(int riskScore) {
        if (riskScore >= 85) {
            return CRITICAL;
        }
        if (riskScore >= 70) {
            return HIGH;
        }
        if (riskScore >= 40) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonCreator
    public static ThreatLevel fromCode(String code) {
        if (code != null) {
            for (ThreatLevel level : values()) {
                if (level.code.equalsIgnoreCase(code.trim())) {
                    return level;
                }
            }
        }
        throw new InvalidRequestException("threatLevel", "Unknown threat level: " + code);
    }
}
