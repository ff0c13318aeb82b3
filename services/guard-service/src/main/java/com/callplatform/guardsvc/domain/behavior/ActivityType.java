package com.callplatform.guardsvc.domain.behavior;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityType {
    BURST_REQUESTS("burst_requests"),
    REGULAR_INTERVALS("regular_intervals"),
    ERROR_FARMING("error_farming"),
    ENDPOINT_SCANNING("endpoint_scanning"),
    CREDENTIAL_STUFFING("credential_stuffing"),
    SESSION_ANOMALY("session_anomaly");

    private final String code;

    ActivityType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
