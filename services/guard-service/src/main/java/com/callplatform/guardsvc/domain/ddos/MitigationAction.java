package com.callplatform.guardsvc.domain.ddos;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MitigationAction {
    MONITOR_CLOSELY,
    PREPARE_DEFENSES,
    ENHANCED_RATE_LIMITS,
    GEOGRAPHIC_FILTERING,
    ENABLE_CAPTCHA,
    STRICT_RATE_LIMITS,
    BLOCK_SUSPICIOUS_IPS,
    ACTIVATE_EMERGENCY_MODE,
    BLOCK_ALL_ANONYMOUS,
    ENABLE_STRICT_CAPTCHA,
    BLOCK_LOW_UNIQUE_IP_SOURCES;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
