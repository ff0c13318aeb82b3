package com.callplatform.guardsvc.domain.captcha;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String code;

    Difficulty(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Hard below 30, medium below 60, easy otherwise.
     */
    public static Difficulty forBehaviorScore(int overallScore) {
        if (overallScore < 30) {
            return HARD;
        }
        if (overallScore < 60) {
            return MEDIUM;
        }
        return EASY;
    }

    public Difficulty atLeast(Difficulty floor) {
        return compareTo(floor) >= 0 ? this : floor;
    }

    @JsonCreator
    public static Difficulty fromCode(String code) {
        if (code != null) {
            for (Difficulty difficulty : values()) {
                if (difficulty.code.equalsIgnoreCase(code.trim())) {
                    return difficulty;
                }
            }
        }
        throw new InvalidRequestException("difficulty", "Unknown difficulty: " + code);
    }
}
