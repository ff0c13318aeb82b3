package com.callplatform.guardsvc.domain.blocking;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A block on a phone number, IP, email or wildcard pattern. {@code expiresAt} is null for permanent rules.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockingRule(
        String id,
        BlockingRuleType type,
        String value,
        String reason,
        long createdAt,
        Long expiresAt,
        boolean autoBlocked
) {
    public boolean isActive(long now) {
        return expiresAt == null || expiresAt > now;
    }
}
