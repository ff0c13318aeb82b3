package com.callplatform.guardsvc.domain.geo;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeoBlockDecision(boolean blocked, String action, String reason, String ruleId) {

    private static final GeoBlockDecision ALLOW = new GeoBlockDecision(false, "allow", null, null);

    public static GeoBlockDecision allow() {
        return ALLOW;
    }

    public static GeoBlockDecision allowedBy(String ruleId) {
        return new GeoBlockDecision(false, "allow", null, ruleId);
    }

    public static GeoBlockDecision block(String reason, String ruleId) {
        return new GeoBlockDecision(true, "block", reason, ruleId);
    }
}
