package com.callplatform.guardsvc.domain.behavior;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BehaviorDetectorsTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final long NOW = T0 + 3_600_000L;

    private final BehaviorDetectors detectors = new BehaviorDetectors(new GuardProperties().getBehavior());

    private static BehaviorPattern event(long offsetMs, String endpoint, int status) {
        return event(offsetMs, endpoint, status, "198.51.100.1");
    }

    private static BehaviorPattern event(long offsetMs, String endpoint, int status, String ip) {
        return new BehaviorPattern(ip, T0 + offsetMs, endpoint, "GET", status, 20);
    }

    /** Offsets with enough jitter that the interval detector stays quiet. */
    private static long jittered(int i) {
        return i * 1000L + (i % 3) * 400L;
    }

    private static List<ActivityType> types(List<SuspiciousActivity> findings) {
        return findings.stream().map(SuspiciousActivity::type).toList();
    }

    @Test
    void emptyWindowHasNoFindings() {
        assertThat(detectors.detect(List.of(), true, NOW)).isEmpty();
    }

    @Test
    void thirtyRequestsInsideTheBurstWindowIsABurst() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            events.add(event(i * 500L + (i % 2) * 200L, "/api/v1/items", 200));
        }

        List<SuspiciousActivity> findings = detectors.detect(events, false, NOW);

        assertThat(types(findings)).contains(ActivityType.BURST_REQUESTS);
        SuspiciousActivity burst = findings.stream()
                .filter(finding -> finding.type() == ActivityType.BURST_REQUESTS).findFirst().orElseThrow();
        assertThat(burst.confidence()).isEqualTo(50);
        assertThat(burst.evidence()).containsEntry("peakRequests", 30);
    }

    @Test
    void spreadOutTrafficIsNotABurst() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            events.add(event(jittered(i) * 2, "/api/v1/items", 200));
        }

        assertThat(types(detectors.detect(events, false, NOW))).doesNotContain(ActivityType.BURST_REQUESTS);
    }

    @Test
    void metronomicIntervalsLookAutomated() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            events.add(event(i * 2000L, "/api/v1/items", 200));
        }

        List<SuspiciousActivity> findings = detectors.detect(events, false, NOW);

        assertThat(types(findings)).containsExactly(ActivityType.REGULAR_INTERVALS);
        assertThat(findings.get(0).confidence()).isEqualTo(100);
        assertThat(findings.get(0).severity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void jitteredIntervalsAreHuman() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            events.add(event(jittered(i), "/api/v1/items", 200));
        }

        assertThat(detectors.detect(events, false, NOW)).isEmpty();
    }

    @Test
    void mostlyClientErrorsIsErrorFarming() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            events.add(event(jittered(i), "/api/v1/items/" + (i % 5), i < 18 ? 404 : 200));
        }

        List<SuspiciousActivity> findings = detectors.detect(events, false, NOW);

        assertThat(types(findings)).containsExactly(ActivityType.ERROR_FARMING);
        assertThat(findings.get(0).confidence()).isEqualTo(90);
    }

    @Test
    void errorRateAtThresholdIsTolerated() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            events.add(event(jittered(i), "/api/v1/items", i < 14 ? 404 : 200));
        }

        assertThat(types(detectors.detect(events, false, NOW))).doesNotContain(ActivityType.ERROR_FARMING);
    }

    @Test
    void manyDistinctEndpointsIsScanning() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            events.add(event(jittered(i), "/api/v1/resource-" + i + "?page=" + i, 200));
        }
        events.add(event(jittered(20), "/api/v1/resource-0?page=99", 200));

        List<SuspiciousActivity> findings = detectors.detect(events, false, NOW);

        assertThat(types(findings)).containsExactly(ActivityType.ENDPOINT_SCANNING);
        assertThat(findings.get(0).severity()).isEqualTo(Severity.MEDIUM);
        assertThat(findings.get(0).evidence()).containsEntry("distinctEndpoints", 20);
    }

    @Test
    void repeatedLoginFailuresAreCredentialStuffing() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            events.add(event(jittered(i), "/api/v1/auth/login", 401));
        }
        events.add(event(jittered(5), "/api/v1/orders", 403));

        List<SuspiciousActivity> findings = detectors.detect(events, false, NOW);

        assertThat(types(findings)).containsExactly(ActivityType.CREDENTIAL_STUFFING);
        assertThat(findings.get(0).severity()).isEqualTo(Severity.HIGH);
        assertThat(findings.get(0).confidence()).isEqualTo(50);
    }

    @Test
    void doubleTheFailureThresholdIsCritical() {
        List<BehaviorPattern> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            events.add(event(jittered(i), "/auth/token?grant=password", 401));
        }

        SuspiciousActivity finding = detectors.detect(events, false, NOW).stream()
                .filter(f -> f.type() == ActivityType.CREDENTIAL_STUFFING).findFirst().orElseThrow();

        assertThat(finding.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(finding.confidence()).isEqualTo(100);
    }

    @Test
    void sessionAnomalyOnlyAppliesToSessions() {
        List<BehaviorPattern> events = List.of(
                event(0, "/a", 200, "203.0.113.1"),
                event(1500, "/b", 200, "203.0.113.2"),
                event(2100, "/c", 200, "203.0.113.3"),
                event(4800, "/d", 200, "203.0.113.4"));

        assertThat(types(detectors.detect(events, true, NOW))).containsExactly(ActivityType.SESSION_ANOMALY);
        assertThat(detectors.detect(events, false, NOW)).isEmpty();
    }

    @Test
    void riskFactorsKeepTheStrongestConfidencePerType() {
        List<SuspiciousActivity> findings = List.of(
                new SuspiciousActivity(ActivityType.BURST_REQUESTS, Severity.MEDIUM, 40, "a", null, NOW),
                new SuspiciousActivity(ActivityType.BURST_REQUESTS, Severity.MEDIUM, 70, "b", null, NOW),
                new SuspiciousActivity(ActivityType.SESSION_ANOMALY, Severity.MEDIUM, 55, "c", null, NOW));

        RiskFactors factors = BehaviorDetectors.riskFactors(findings);

        assertThat(factors.burstActivity()).isEqualTo(70);
        assertThat(factors.sessionAnomalies()).isEqualTo(55);
        assertThat(factors.credentialStuffing()).isZero();
    }
}
