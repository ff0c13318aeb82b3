package com.callplatform.guardsvc.domain.geo;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GeoRuleType {
    BLOCK("block"),
    ALLOW("allow");

    private final String code;

    GeoRuleType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static GeoRuleType fromCode(String code) {
        if (code != null) {
            for (GeoRuleType type : values()) {
                if (type.code.equalsIgnoreCase(code.trim())) {
                    return type;
                }
            }
        }
        throw new InvalidRequestException("type", "Unknown geo rule type: " + code);
    }
}
