package com.callplatform.guardsvc.domain.geo;

import com.callplatform.guardsvc.domain.model.ThreatLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location and reputation record for one IP. Reputation runs 0-100, higher is cleaner.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeoLocation(
        @JsonProperty("ip") String ipAddress,
        String country,
        String countryCode,
        String city,
        ThreatLevel threatLevel,
        int reputation,
        @JsonProperty("isTor") boolean tor,
        @JsonProperty("isVpn") boolean vpn,
        @JsonProperty("isProxy") boolean proxy
) {
    public static final String LOCAL_COUNTRY = "Local";
    public static final String LOCAL_CODE = "LC";
    public static final String UNKNOWN_COUNTRY = "Unknown";
    public static final String UNKNOWN_CODE = "XX";

    public GeoLocation {
        if (threatLevel == null) {
            threatLevel = ThreatLevel.LOW;
        }
        reputation = Math.max(0, Math.min(100, reputation));
    }

    /** Sentinel for private and loopback ranges. */
    public static GeoLocation local(String ipAddress) {
        return new GeoLocation(ipAddress, LOCAL_COUNTRY, LOCAL_CODE, LOCAL_COUNTRY,
                ThreatLevel.LOW, 100, false, false, false);
    }

    /** Low-threat stand-in used while the provider is unreachable. */
    public static GeoLocation unknown(String ipAddress) {
        return new GeoLocation(ipAddress, UNKNOWN_COUNTRY, UNKNOWN_CODE, null,
                ThreatLevel.LOW, 50, false, false, false);
    }

    /** False for the local and unknown sentinels. */
    @JsonIgnore
    public boolean isResolved() {
        return !LOCAL_CODE.equals(countryCode) && !UNKNOWN_CODE.equals(countryCode);
    }

    @JsonIgnore
    public boolean isAnonymized() {
        return tor || vpn || proxy;
    }
}
