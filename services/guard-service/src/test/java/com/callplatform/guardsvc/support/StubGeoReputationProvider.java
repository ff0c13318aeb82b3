package com.callplatform.guardsvc.support;

import com.callplatform.guardsvc.infrastructure.geo.GeoLookupException;
import com.callplatform.guardsvc.infrastructure.geo.GeoLookupResult;
import com.callplatform.guardsvc.infrastructure.geo.GeoReputationProvider;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers from a fixed table; unknown IPs resolve to a clean US residential address.
 */
public class StubGeoReputationProvider implements GeoReputationProvider {

    private final Map<String, GeoLookupResult> answers = new ConcurrentHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private volatile boolean failing;

    public StubGeoReputationProvider answer(GeoLookupResult result) {
        answers.put(result.ipAddress(), result);
        return this;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int lookups() {
        return lookups.get();
    }

    @Override
    public GeoLookupResult lookup(String ipAddress) {
        lookups.incrementAndGet();
        if (failing) {
            throw new GeoLookupException("provider unreachable");
        }
        return answers.getOrDefault(ipAddress, clean(ipAddress));
    }

    public static GeoLookupResult clean(String ip) {
        return new GeoLookupResult(ip, "United States", "US", "Austin", 0.1,
                false, false, false, false, "residential", 20);
    }

    public static GeoLookupResult located(String ip, String country, String countryCode, double providerRisk) {
        return new GeoLookupResult(ip, country, countryCode, null, providerRisk,
                false, false, false, false, "residential", 50);
    }

    public static GeoLookupResult torExit(String ip, String country, String countryCode) {
        return new GeoLookupResult(ip, country, countryCode, null, 5.0,
                true, true, false, false, "hosting", 500);
    }
}
