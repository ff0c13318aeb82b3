package com.callplatform.guardsvc.domain.model;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Actor roles, declared in increasing order of trust.
 */
public enum UserRole {
    ANONYMOUS("anonymous"),
    BUYER("buyer"),
    SUPPLIER("supplier"),
    ADMIN("admin");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static UserRole fromCode(String code) {
        if (code != null) {
            for (UserRole role : values()) {
                if (role.code.equalsIgnoreCase(code.trim())) {
                    return role;
                }
            }
        }
        throw new InvalidRequestException("role", "Unknown user role: " + code);
    }

    /**
     * Lenient mapping for token claims: unknown roles carry no extra trust.
     */
    public static UserRole fromClaim(String claim) {
        if (claim == null) {
            return ANONYMOUS;
        }
        String normalized = claim.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("role_")) {
            normalized = normalized.substring(5);
        }
        for (UserRole role : values()) {
            if (role.code.equals(normalized)) {
                return role;
            }
        }
        return ANONYMOUS;
    }
}
