package com.callplatform.guardsvc.domain.geo;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.ThreatLevel;
import com.callplatform.guardsvc.infrastructure.geo.GeoLookupResult;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a raw provider record into a {@link GeoLocation}: provider risk scaled to 0-100, plus fixed
 * penalties for anonymizers, satellite/hosting/cellular links, high-risk countries and vague locations.
 */
@Component
public class GeoThreatAssessor {

    private static final int ANONYMOUS_PROXY_PENALTY = 30;
    private static final int SATELLITE_PENALTY = 15;
    private static final int HOSTING_PENALTY = 20;
    private static final int CELLULAR_PENALTY = 5;
    private static final int HIGH_RISK_COUNTRY_PENALTY = 25;
    private static final int VAGUE_LOCATION_PENALTY = 10;
    private static final int VAGUE_LOCATION_RADIUS_KM = 1000;

    private final Set<String> highRiskCountries;

    public GeoThreatAssessor(GuardProperties properties) {
        this.highRiskCountries = properties.getGeo().getHighRiskCountries().stream()
                .map(code -> code.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public int riskScore(GeoLookupResult result) {
        double risk = result.providerRisk() != null ? result.providerRisk() * 10 : 0;
        String userType = result.userType() != null ? result.userType().toLowerCase(Locale.ROOT) : "";
        if (result.anonymousProxy() || result.torExitNode()) {
            risk += ANONYMOUS_PROXY_PENALTY;
        }
        if (result.satelliteProvider()) {
            risk += SATELLITE_PENALTY;
        }
        if ("hosting".equals(userType)) {
            risk += HOSTING_PENALTY;
        }
        if ("cellular".equals(userType)) {
            risk += CELLULAR_PENALTY;
        }
        if (result.countryCode() != null
                && highRiskCountries.contains(result.countryCode().toUpperCase(Locale.ROOT))) {
            risk += HIGH_RISK_COUNTRY_PENALTY;
        }
        if (result.accuracyRadiusKm() != null && result.accuracyRadiusKm() > VAGUE_LOCATION_RADIUS_KM) {
            risk += VAGUE_LOCATION_PENALTY;
        }
        return (int) Math.round(Math.max(0, Math.min(100, risk)));
    }

    public GeoLocation assess(GeoLookupResult result) {
        int risk = riskScore(result);
        String userType = result.userType() != null ? result.userType().toLowerCase(Locale.ROOT) : "";
        boolean vpn = result.anonymousVpn() || result.anonymousProxy() || "hosting".equals(userType);
        return new GeoLocation(
                result.ipAddress(),
                result.country() != null ? result.country() : GeoLocation.UNKNOWN_COUNTRY,
                result.countryCode() != null ? result.countryCode().toUpperCase(Locale.ROOT) : GeoLocation.UNKNOWN_CODE,
                result.city(),
                ThreatLevel.fromRiskScore(risk),
                100 - risk,
                result.torExitNode(),
                vpn,
                result.anonymousProxy());
    }
}
