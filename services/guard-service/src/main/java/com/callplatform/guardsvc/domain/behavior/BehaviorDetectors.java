package com.callplatform.guardsvc.domain.behavior;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stateless threshold detectors over one identifier's event window. Each emits at most one finding;
 * findings are independent, so several may fire for the same window.
 */
public class BehaviorDetectors {

    private final GuardProperties.Behavior settings;

    public BehaviorDetectors(GuardProperties.Behavior settings) {
        this.settings = settings;
    }

    /**
     * @param events        the window, any order
     * @param sessionScoped true for authenticated identifiers, which enables the session-anomaly detector
     */
    public List<SuspiciousActivity> detect(List<BehaviorPattern> events, boolean sessionScoped, long now) {
        List<BehaviorPattern> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingLong(BehaviorPattern::timestamp));

        List<SuspiciousActivity> findings = new ArrayList<>();
        burst(ordered, now).ifPresent(findings::add);
        regularIntervals(ordered, now).ifPresent(findings::add);
        errorFarming(ordered, now).ifPresent(findings::add);
        endpointScanning(ordered, now).ifPresent(findings::add);
        credentialStuffing(ordered, now).ifPresent(findings::add);
        if (sessionScoped) {
            sessionAnomaly(ordered, now).ifPresent(findings::add);
        }
        return findings;
    }

    /**
     * Each finding's confidence becomes its factor's sub-score.
     */
    public static RiskFactors riskFactors(List<SuspiciousActivity> findings) {
        Map<ActivityType, Integer> byType = new EnumMap<>(ActivityType.class);
        for (SuspiciousActivity finding : findings) {
            byType.merge(finding.type(), finding.confidence(), Math::max);
        }
        return new RiskFactors(
                byType.getOrDefault(ActivityType.BURST_REQUESTS, 0),
                byType.getOrDefault(ActivityType.REGULAR_INTERVALS, 0),
                byType.getOrDefault(ActivityType.ERROR_FARMING, 0),
                byType.getOrDefault(ActivityType.ENDPOINT_SCANNING, 0),
                byType.getOrDefault(ActivityType.CREDENTIAL_STUFFING, 0),
                byType.getOrDefault(ActivityType.SESSION_ANOMALY, 0));
    }

    Optional<SuspiciousActivity> burst(List<BehaviorPattern> ordered, long now) {
        int threshold = settings.getBurstThreshold();
        long window = settings.getBurstWindow().toMillis();
        if (ordered.size() < threshold) {
            return Optional.empty();
        }
        // two-pointer sweep for the densest sub-window
        int peak = 0;
        int start = 0;
        for (int end = 0; end < ordered.size(); end++) {
            while (ordered.get(end).timestamp() - ordered.get(start).timestamp() > window) {
                start++;
            }
            peak = Math.max(peak, end - start + 1);
        }
        if (peak < threshold) {
            return Optional.empty();
        }
        int confidence = (int) Math.min(100, 50 + Math.round(50.0 * (peak - threshold) / threshold));
        return Optional.of(new SuspiciousActivity(
                ActivityType.BURST_REQUESTS,
                Severity.MEDIUM,
                confidence,
                peak + " requests within " + settings.getBurstWindow().toSeconds() + "s",
                Map.of("peakRequests", peak, "windowMs", window, "threshold", threshold),
                now));
    }

    Optional<SuspiciousActivity> regularIntervals(List<BehaviorPattern> ordered, long now) {
        if (ordered.size() < settings.getRegularMinSamples()) {
            return Optional.empty();
        }
        int n = ordered.size() - 1;
        double[] intervals = new double[n];
        double sum = 0;
        for (int i = 0; i < n; i++) {
            intervals[i] = ordered.get(i + 1).timestamp() - ordered.get(i).timestamp();
            sum += intervals[i];
        }
        double mean = sum / n;
        if (mean <= 0) {
            return Optional.empty();
        }
        double squares = 0;
        for (double interval : intervals) {
            squares += (interval - mean) * (interval - mean);
        }
        double stdDev = n > 1 ? Math.sqrt(squares / (n - 1)) : 0;
        double variation = stdDev / mean;
        if (variation >= settings.getRegularCvThreshold()) {
            return Optional.empty();
        }
        int confidence = (int) Math.round(100 * (1 - variation / settings.getRegularCvThreshold() / 2));
        return Optional.of(new SuspiciousActivity(
                ActivityType.REGULAR_INTERVALS,
                Severity.HIGH,
                confidence,
                "Requests arrive every " + Math.round(mean) + "ms with almost no jitter",
                Map.of("meanIntervalMs", Math.round(mean),
                        "stdDevMs", Math.round(stdDev),
                        "samples", ordered.size()),
                now));
    }

    Optional<SuspiciousActivity> errorFarming(List<BehaviorPattern> ordered, long now) {
        if (ordered.size() < settings.getErrorMinSamples()) {
            return Optional.empty();
        }
        long errors = ordered.stream().filter(BehaviorPattern::isClientError).count();
        double rate = (double) errors / ordered.size();
        if (rate <= settings.getErrorRateThreshold()) {
            return Optional.empty();
        }
        return Optional.of(new SuspiciousActivity(
                ActivityType.ERROR_FARMING,
                Severity.HIGH,
                (int) Math.round(rate * 100),
                errors + " of " + ordered.size() + " requests ended in client errors",
                Map.of("errorCount", errors, "total", ordered.size()),
                now));
    }

    Optional<SuspiciousActivity> endpointScanning(List<BehaviorPattern> ordered, long now) {
        int threshold = settings.getScanDistinctEndpoints();
        Set<String> endpoints = new HashSet<>();
        for (BehaviorPattern event : ordered) {
            if (event.endpoint() != null) {
                endpoints.add(stripQuery(event.endpoint()));
            }
        }
        if (endpoints.size() < threshold) {
            return Optional.empty();
        }
        Severity severity = endpoints.size() >= threshold * 2 ? Severity.HIGH : Severity.MEDIUM;
        return Optional.of(new SuspiciousActivity(
                ActivityType.ENDPOINT_SCANNING,
                severity,
                (int) Math.min(100, Math.round(100.0 * endpoints.size() / (threshold * 2))),
                endpoints.size() + " distinct endpoints requested",
                Map.of("distinctEndpoints", endpoints.size(), "threshold", threshold),
                now));
    }

    Optional<SuspiciousActivity> credentialStuffing(List<BehaviorPattern> ordered, long now) {
        int threshold = settings.getCredentialFailureThreshold();
        long failures = ordered.stream()
                .filter(BehaviorPattern::isAuthFailure)
                .filter(event -> isAuthEndpoint(event.endpoint()))
                .count();
        if (failures < threshold) {
            return Optional.empty();
        }
        Severity severity = failures >= threshold * 2L ? Severity.CRITICAL : Severity.HIGH;
        return Optional.of(new SuspiciousActivity(
                ActivityType.CREDENTIAL_STUFFING,
                severity,
                (int) Math.min(100, Math.round(100.0 * failures / (threshold * 2))),
                failures + " failed authentication attempts",
                Map.of("authFailures", failures, "threshold", threshold),
                now));
    }

    Optional<SuspiciousActivity> sessionAnomaly(List<BehaviorPattern> ordered, long now) {
        int threshold = settings.getSessionIpThreshold();
        Set<String> ips = new HashSet<>();
        for (BehaviorPattern event : ordered) {
            if (event.ipAddress() != null) {
                ips.add(event.ipAddress());
            }
        }
        if (ips.size() <= threshold) {
            return Optional.empty();
        }
        Severity severity = ips.size() > threshold * 2 ? Severity.HIGH : Severity.MEDIUM;
        return Optional.of(new SuspiciousActivity(
                ActivityType.SESSION_ANOMALY,
                severity,
                (int) Math.min(100, Math.round(100.0 * ips.size() / (2 * (threshold + 1)))),
                "Session used from " + ips.size() + " addresses",
                Map.of("distinctIps", ips.size(), "threshold", threshold),
                now));
    }

    private boolean isAuthEndpoint(String endpoint) {
        if (endpoint == null) {
            return false;
        }
        String path = stripQuery(endpoint).toLowerCase(Locale.ROOT);
        return settings.getAuthEndpoints().stream()
                .map(candidate -> candidate.toLowerCase(Locale.ROOT))
                .anyMatch(path::endsWith);
    }

    private static String stripQuery(String endpoint) {
        int query = endpoint.indexOf('?');
        return query >= 0 ? endpoint.substring(0, query) : endpoint;
    }
}
