package com.callplatform.guardsvc.domain.bypass;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared in detection priority order.
 */
public enum BypassType {
    HEADER_MANIPULATION("header_manipulation"),
    IP_ROTATION("ip_rotation"),
    USER_AGENT_ROTATION("user_agent_rotation");

    private final String code;

    BypassType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static BypassType fromCode(String code) {
        if (code != null) {
            for (BypassType type : values()) {
                if (type.code.equalsIgnoreCase(code.trim())) {
                    return type;
                }
            }
        }
        throw new InvalidRequestException("type", "Unknown bypass type: " + code);
    }
}
