package com.callplatform.guardsvc.domain.blocking;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockingRuleType {
    PHONE("phone"),
    IP("ip"),
    EMAIL("email"),
    PATTERN("pattern");

    private final String code;

    BlockingRuleType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static BlockingRuleType fromCode(String code) {
        if (code != null) {
            for (BlockingRuleType type : values()) {
                if (type.code.equalsIgnoreCase(code.trim())) {
                    return type;
                }
            }
        }
        throw new InvalidRequestException("type", "Unknown blocking rule type: " + code);
    }
}
