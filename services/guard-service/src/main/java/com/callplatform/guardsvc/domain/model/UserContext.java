package com.callplatform.guardsvc.domain.model;

import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import lombok.Builder;

/**
 * Per-request actor descriptor. Built once per request by the orchestration layer; never persisted.
 */
@Builder(toBuilder = true)
public record UserContext(
        boolean authenticated,
        String userId,
        UserRole role,
        String ipAddress,
        String userAgent,
        String country,
        String city
) {
    public UserContext {
        if (ipAddress == null || ipAddress.isBlank()) {
            throw new InvalidRequestException("ipAddress", "IP address is required");
        }
        if (authenticated && (userId == null || userId.isBlank())) {
            throw new InvalidRequestException("userId", "Authenticated context requires a user id");
        }
        if (role == null) {
            role = authenticated ? UserRole.BUYER : UserRole.ANONYMOUS;
        }
        if (!authenticated) {
            role = UserRole.ANONYMOUS;
        }
    }

    public static UserContext anonymous(String ipAddress) {
        return UserContext.builder().ipAddress(ipAddress).build();
    }

    public static UserContext authenticated(String userId, UserRole role, String ipAddress) {
        return UserContext.builder()
                .authenticated(true)
                .userId(userId)
                .role(role)
                .ipAddress(ipAddress)
                .build();
    }

    public UserContext withUserAgent(String agent) {
        return toBuilder().userAgent(agent).build();
    }

    public UserContext withLocation(String countryName, String cityName) {
        return toBuilder().country(countryName).city(cityName).build();
    }
}
