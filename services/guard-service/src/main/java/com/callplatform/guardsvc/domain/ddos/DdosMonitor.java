package com.callplatform.guardsvc.domain.ddos;

import com.callplatform.guardsvc.config.GuardMetrics;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.Severity;
import com.callplatform.guardsvc.infrastructure.logging.SecurityEventLogger;
import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Watches platform-wide request volume for flood and low-and-slow patterns.
 * Every admitted request is recorded in {@code ddos:global}; source IPs in {@code ddos:sources}.
 */
@Service
@Slf4j
public class DdosMonitor {

    static final String GLOBAL_KEY = "ddos:global";
    static final String SOURCES_KEY = "ddos:sources";

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration RETENTION = Duration.ofMinutes(5);

    private final CounterStore counterStore;
    private final Clock clock;
    private final SecurityEventLogger securityEventLogger;
    private final GuardMetrics metrics;
    private final GuardProperties.Ddos settings;
    private final AtomicLong lastAlertAt = new AtomicLong();

    public DdosMonitor(CounterStore counterStore, Clock clock, SecurityEventLogger securityEventLogger,
                       GuardMetrics metrics, GuardProperties properties) {
        this.counterStore = counterStore;
        this.clock = clock;
        this.securityEventLogger = securityEventLogger;
        this.metrics = metrics;
        this.settings = properties.getDdos();
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    /**
     * Records one request from {@code ipAddress} and assesses current volume.
     * Returns {@link DdosAssessment#NONE} when monitoring is off or the store is unavailable.
     */
    public DdosAssessment recordAndAssess(String ipAddress) {
        if (!settings.isEnabled()) {
            return DdosAssessment.NONE;
        }
        long now = clock.millis();
        try {
            counterStore.removeScoredUpTo(GLOBAL_KEY, now - RETENTION.toMillis());
            counterStore.removeScoredUpTo(SOURCES_KEY, now - RETENTION.toMillis());
            counterStore.addScored(GLOBAL_KEY, now, now + ":" + UUID.randomUUID(), RETENTION);
            if (ipAddress != null) {
                counterStore.addScored(SOURCES_KEY, now, ipAddress, RETENTION);
            }

            long lastMinute = counterStore.countByScore(GLOBAL_KEY, now - MINUTE.toMillis(), now);
            long lastFive = counterStore.countByScore(GLOBAL_KEY, now - RETENTION.toMillis(), now);
            long uniqueIps = counterStore.countByScore(SOURCES_KEY, now - RETENTION.toMillis(), now);

            DdosAssessment assessment = assess(lastMinute, lastFive, uniqueIps);
            if (assessment.attackDetected()) {
                alert(assessment, now);
            }
            return assessment;
        } catch (CounterStoreException e) {
            log.warn("DDoS monitor unavailable: {}", e.getMessage());
            metrics.failOpen("ddos-monitor");
            return DdosAssessment.NONE;
        }
    }

    /**
     * Maps volume counters to a severity and its mitigation actions.
     */
    public DdosAssessment assess(long requestsLastMinute, long requestsLastFiveMinutes, long uniqueIps) {
        Severity severity = null;
        Set<MitigationAction> actions = EnumSet.noneOf(MitigationAction.class);

        if (requestsLastMinute > settings.getCriticalThreshold()) {
            severity = Severity.CRITICAL;
            actions.addAll(EnumSet.of(MitigationAction.ACTIVATE_EMERGENCY_MODE,
                    MitigationAction.BLOCK_ALL_ANONYMOUS, MitigationAction.ENABLE_STRICT_CAPTCHA));
        } else if (requestsLastMinute > settings.getHighThreshold()) {
            severity = Severity.HIGH;
            actions.addAll(EnumSet.of(MitigationAction.ENABLE_CAPTCHA,
                    MitigationAction.STRICT_RATE_LIMITS, MitigationAction.BLOCK_SUSPICIOUS_IPS));
        } else if (requestsLastMinute > settings.getMediumThreshold()) {
            severity = Severity.MEDIUM;
            actions.addAll(EnumSet.of(MitigationAction.ENHANCED_RATE_LIMITS, MitigationAction.GEOGRAPHIC_FILTERING));
        } else if (requestsLastMinute > settings.getLowThreshold()) {
            severity = Severity.LOW;
            actions.addAll(EnumSet.of(MitigationAction.MONITOR_CLOSELY, MitigationAction.PREPARE_DEFENSES));
        }

        if (requestsLastFiveMinutes > settings.getLowAndSlowRequests()
                && uniqueIps < settings.getLowAndSlowMaxUniqueIps()) {
            severity = severity == null ? Severity.MEDIUM : Severity.max(severity, Severity.MEDIUM);
            actions.add(MitigationAction.BLOCK_LOW_UNIQUE_IP_SOURCES);
        }

        if (severity == null) {
            return new DdosAssessment(false, null, Set.of(), requestsLastMinute, requestsLastFiveMinutes, uniqueIps);
        }
        return new DdosAssessment(true, severity, actions, requestsLastMinute, requestsLastFiveMinutes, uniqueIps);
    }

    // one alert per minute while the condition lasts
    private void alert(DdosAssessment assessment, long now) {
        long previous = lastAlertAt.get();
        if (now - previous < MINUTE.toMillis() || !lastAlertAt.compareAndSet(previous, now)) {
            return;
        }
        log.warn("DDoS pattern detected: severity={}, lastMinute={}, lastFiveMinutes={}, uniqueIps={}",
                assessment.severity().code(), assessment.requestsLastMinute(),
                assessment.requestsLastFiveMinutes(), assessment.uniqueIps());
        securityEventLogger.log(SecurityEventLogger.DDOS_DETECTED, null, null,
                "Platform-wide attack pattern detected",
                Map.of("severity", assessment.severity().code(),
                        "requestsLastMinute", String.valueOf(assessment.requestsLastMinute()),
                        "uniqueIps", String.valueOf(assessment.uniqueIps())));
    }
}
