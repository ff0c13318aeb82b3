package com.callplatform.guardsvc.domain.bypass;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

public enum StatsPeriod {
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1)),
    WEEK(Duration.ofDays(7));

    private final Duration length;

    StatsPeriod(Duration length) {
        this.length = length;
    }

    public Duration length() {
        return length;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StatsPeriod fromCode(String code) {
        if (code != null) {
            for (StatsPeriod period : values()) {
                if (period.code().equalsIgnoreCase(code.trim())) {
                    return period;
                }
            }
        }
        throw new InvalidRequestException("period", "Unknown stats period: " + code);
    }
}
