package com.callplatform.guardsvc.infrastructure.geo;

/**
 * Raw provider answer for one IP, before threat assessment.
 *
 * @param providerRisk     provider risk score on a 0-10 scale, null when absent
 * @param userType         provider connection classification (hosting, cellular, residential...)
 * @param accuracyRadiusKm location accuracy, null when absent
 */
public record GeoLookupResult(
        String ipAddress,
        String country,
        String countryCode,
        String city,
        Double providerRisk,
        boolean anonymousProxy,
        boolean torExitNode,
        boolean anonymousVpn,
        boolean satelliteProvider,
        String userType,
        Integer accuracyRadiusKm
) {
}
