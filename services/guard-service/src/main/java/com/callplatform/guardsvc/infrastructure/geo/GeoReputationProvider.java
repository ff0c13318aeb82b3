package com.callplatform.guardsvc.infrastructure.geo;

public interface GeoReputationProvider {

    /**
     * @throws GeoLookupException when the provider is unreachable or answers garbage
     */
    GeoLookupResult lookup(String ipAddress);
}
