package com.callplatform.guardsvc.domain.captcha;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaptchaDecision(boolean required, String reason, Difficulty difficulty) {

    public static CaptchaDecision required(String reason, Difficulty difficulty) {
        return new CaptchaDecision(true, reason, difficulty);
    }

    public static CaptchaDecision notRequired(String reason) {
        return new CaptchaDecision(false, reason, null);
    }
}
