package com.callplatform.guardsvc.domain.model;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Totally ordered finding severity: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonCreator
    public static Severity fromCode(String code) {
        if (code != null) {
            for (Severity severity : values()) {
                if (severity.code.equalsIgnoreCase(code.trim())) {
                    return severity;
                }
            }
        }
        throw new InvalidRequestException("severity", "Unknown severity: " + code);
    }
}
