package com.callplatform.guardsvc.domain.bypass;

import com.callplatform.guardsvc.config.GuardMetrics;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.Severity;
import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.domain.ratelimit.IdentifierResolver;
import com.callplatform.guardsvc.infrastructure.logging.SecurityEventLogger;
import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.http.RequestHeaders;
import com.callplatform.guardsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Flags deliberate evasion and returns a rate-limit penalty. Checks run in priority order (header
 * manipulation, IP rotation, user-agent rotation); the first positive one names the attempt. Every
 * request is tracked before the checks so rotation counts stay current.
 */
@Service
@Slf4j
public class BypassDetector {

    static final String TRACK_IP_PREFIX = "bypass:track:ip:";
    static final String TRACK_UA_PREFIX = "bypass:track:ua:";
    static final String PENALTY_PREFIX = "bypass:penalty:";
    static final String ATTEMPT_PREFIX = "bypass:attempt:";
    static final String TYPE_INDEX_PREFIX = "bypass:type:";
    static final String ALL_INDEX = "bypass:all";

    private final CounterStore counterStore;
    private final IdentifierResolver identifierResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecurityUtils securityUtils;
    private final SecurityEventLogger securityEventLogger;
    private final GuardMetrics metrics;
    private final GuardProperties.Bypass settings;
    private final Set<String> honeypotHeaders;

    public BypassDetector(CounterStore counterStore, IdentifierResolver identifierResolver, ObjectMapper objectMapper,
                          Clock clock, SecurityUtils securityUtils, SecurityEventLogger securityEventLogger,
                          GuardMetrics metrics, GuardProperties properties) {
        this.counterStore = counterStore;
        this.identifierResolver = identifierResolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.securityUtils = securityUtils;
        this.securityEventLogger = securityEventLogger;
        this.metrics = metrics;
        this.settings = properties.getBypass();
        this.honeypotHeaders = settings.getHoneypotHeaders().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Store failures skip the rotation checks; header checks need no store and always run.
     */
    public BypassAnalysis analyzeRequest(UserContext context, RequestHeaders headers) {
        if (context == null) {
            throw new InvalidRequestException("context", "User context is required");
        }
        RequestHeaders requestHeaders = headers != null ? headers : RequestHeaders.empty();
        String identifier = identifierResolver.resolve(context);
        long now = clock.millis();

        long distinctIps = 0;
        long distinctAgents = 0;
        boolean tracked = false;
        try {
            distinctIps = trackAndCount(TRACK_IP_PREFIX + identifier, context.ipAddress(), now);
            String agent = context.userAgent() != null ? context.userAgent() : requestHeaders.userAgent().orElse(null);
            if (agent != null) {
                distinctAgents = trackAndCount(TRACK_UA_PREFIX + identifier, securityUtils.fingerprint(agent), now);
            } else {
                distinctAgents = count(TRACK_UA_PREFIX + identifier, now);
            }
            tracked = true;
        } catch (CounterStoreException e) {
            log.debug("Bypass tracking unavailable for {}: {}", securityUtils.maskIdentifier(identifier), e.getMessage());
            metrics.failOpen("bypass-tracking");
        }

        Optional<Detection> detection = headerManipulation(requestHeaders);
        if (detection.isEmpty() && tracked && context.authenticated()) {
            detection = ipRotation(distinctIps);
        }
        if (detection.isEmpty() && tracked) {
            detection = userAgentRotation(distinctAgents);
        }

        if (detection.isEmpty()) {
            double lingering = activePenalty(identifier);
            return lingering > 1.0
                    ? new BypassAnalysis(false, null, lingering, Map.of("lingeringPenalty", lingering), null)
                    : BypassAnalysis.NONE;
        }

        Detection found = detection.get();
        BypassAttempt attempt = new BypassAttempt(UUID.randomUUID().toString(), found.type(), found.severity(),
                found.confidence(), found.evidence(), false, now);
        persist(attempt, identifier, found.penalty());
        metrics.bypassDetected(found.type().code());
        securityEventLogger.log(SecurityEventLogger.BYPASS_DETECTED, context.ipAddress(), identifier,
                "Rate-limit bypass attempt detected",
                Map.of("type", found.type().code(), "severity", found.severity().code(),
                        "confidence", String.valueOf(found.confidence()),
                        "penalty", String.valueOf(found.penalty())));
        return new BypassAnalysis(true, found.type(), found.penalty(), found.evidence(), attempt.id());
    }

    /**
     * Penalty left on the identifier by a recent detection, or 1.0.
     */
    public double activePenalty(String identifier) {
        try {
            return counterStore.get(PENALTY_PREFIX + identifier)
                    .map(BypassDetector::parsePenalty)
                    .orElse(1.0);
        } catch (CounterStoreException e) {
            return 1.0;
        }
    }

    /**
     * Marks an attempt as mitigated once the penalized request was denied.
     */
    public void recordMitigation(String attemptId) {
        if (attemptId == null) {
            return;
        }
        try {
            Optional<BypassAttempt> attempt = loadAttempt(attemptId);
            if (attempt.isPresent() && !attempt.get().blocked()) {
                long age = clock.millis() - attempt.get().lastDetected();
                Duration remaining = settings.getAuditRetention().minusMillis(age);
                if (!remaining.isNegative() && !remaining.isZero()) {
                    saveAttempt(attempt.get().asBlocked(), remaining);
                }
            }
        } catch (CounterStoreException e) {
            log.debug("Could not record mitigation for attempt {}: {}", attemptId, e.getMessage());
        }
    }

    /**
     * Newest first, bounded by the audit retention and the reporting cap. A null type lists every type.
     */
    public List<BypassAttempt> getBypassAttempts(BypassType type) {
        String index = type != null ? TYPE_INDEX_PREFIX + type.code() : ALL_INDEX;
        long since = clock.millis() - settings.getAuditRetention().toMillis();
        try {
            List<String> ids = new ArrayList<>(counterStore.latestByScore(index, since, settings.getMaxReportedAttempts()));
            Collections.reverse(ids);
            List<BypassAttempt> attempts = new ArrayList<>(ids.size());
            for (String id : ids) {
                loadAttempt(id).ifPresent(attempts::add);
            }
            return attempts;
        } catch (CounterStoreException e) {
            log.warn("Bypass audit trail unavailable: {}", e.getMessage());
            return List.of();
        }
    }

    public BypassStats getStats(StatsPeriod period) {
        StatsPeriod effective = period != null ? period : StatsPeriod.DAY;
        long since = clock.millis() - effective.length().toMillis();
        List<BypassAttempt> attempts = getBypassAttempts(null).stream()
                .filter(attempt -> attempt.lastDetected() >= since)
                .toList();

        Map<String, Long> byType = new LinkedHashMap<>();
        for (BypassType type : BypassType.values()) {
            byType.put(type.code(), 0L);
        }
        long blocked = 0;
        for (BypassAttempt attempt : attempts) {
            byType.merge(attempt.type().code(), 1L, Long::sum);
            if (attempt.blocked()) {
                blocked++;
            }
        }
        return BypassStats.of(effective, byType, attempts.size(), blocked);
    }

    Optional<Detection> headerManipulation(RequestHeaders headers) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        double penalty = 1.0;
        int confidence = 0;

        List<String> honeypots = headers.names().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .filter(honeypotHeaders::contains)
                .sorted()
                .toList();
        if (!honeypots.isEmpty()) {
            evidence.put("honeypotHeaders", String.join(",", honeypots));
            penalty = settings.getHoneypotPenalty();
            confidence = 95;
        }

        Set<String> claimed = headers.claimedClientIps();
        if (claimed.size() > 1) {
            evidence.put("conflictingClientIps", String.join(",", claimed));
            headers.forwardedFor().ifPresent(ip -> evidence.put("originalIP", ip));
            penalty = Math.max(penalty, settings.getHeaderInconsistencyPenalty());
            confidence = Math.max(confidence, 80);
        }

        if (evidence.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Detection(BypassType.HEADER_MANIPULATION, Severity.HIGH, confidence, penalty, evidence));
    }

    Optional<Detection> ipRotation(long distinctIps) {
        int threshold = settings.getIpRotationThreshold();
        if (distinctIps <= threshold) {
            return Optional.empty();
        }
        return Optional.of(new Detection(
                BypassType.IP_ROTATION,
                distinctIps > threshold * 2L ? Severity.HIGH : Severity.MEDIUM,
                rotationConfidence(distinctIps, threshold),
                settings.getIpRotationPenalty(),
                Map.of("distinctIps", distinctIps, "threshold", threshold,
                        "windowSeconds", settings.getTrackingWindow().toSeconds())));
    }

    Optional<Detection> userAgentRotation(long distinctAgents) {
        int threshold = settings.getUserAgentRotationThreshold();
        if (distinctAgents <= threshold) {
            return Optional.empty();
        }
        return Optional.of(new Detection(
                BypassType.USER_AGENT_ROTATION,
                distinctAgents > threshold * 2L ? Severity.HIGH : Severity.MEDIUM,
                rotationConfidence(distinctAgents, threshold),
                settings.getUserAgentRotationPenalty(),
                Map.of("distinctUserAgents", distinctAgents, "threshold", threshold,
                        "windowSeconds", settings.getTrackingWindow().toSeconds())));
    }

    private static int rotationConfidence(long observed, int threshold) {
        return (int) Math.min(100, 60 + Math.round(40.0 * (observed - threshold) / threshold));
    }

    private long trackAndCount(String key, String member, long now) {
        counterStore.addScored(key, now, member, settings.getTrackingWindow());
        return count(key, now);
    }

    private long count(String key, long now) {
        long windowStart = now - settings.getTrackingWindow().toMillis();
        counterStore.removeScoredUpTo(key, windowStart - 1);
        return counterStore.countByScore(key, windowStart, now);
    }

    private void persist(BypassAttempt attempt, String identifier, double penalty) {
        Duration retention = settings.getAuditRetention();
        try {
            saveAttempt(attempt, retention);
            counterStore.addScored(TYPE_INDEX_PREFIX + attempt.type().code(), attempt.lastDetected(), attempt.id(), retention);
            counterStore.addScored(ALL_INDEX, attempt.lastDetected(), attempt.id(), retention);
            if (penalty > activePenalty(identifier)) {
                counterStore.set(PENALTY_PREFIX + identifier, String.valueOf(penalty), settings.getTrackingWindow());
            }
        } catch (CounterStoreException e) {
            log.warn("Bypass attempt {} not persisted: {}", attempt.id(), e.getMessage());
        }
    }

    private void saveAttempt(BypassAttempt attempt, Duration ttl) {
        try {
            counterStore.set(ATTEMPT_PREFIX + attempt.id(), objectMapper.writeValueAsString(attempt), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Bypass attempt is not serializable", e);
        }
    }

    private Optional<BypassAttempt> loadAttempt(String id) {
        Optional<String> json = counterStore.get(ATTEMPT_PREFIX + id);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), BypassAttempt.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed bypass attempt {}", id);
            return Optional.empty();
        }
    }

    private static double parsePenalty(String raw) {
        try {
            return Math.max(1.0, Double.parseDouble(raw));
        } catch (NumberFormatException e) {
            return 1.0;
        }
    }

    record Detection(BypassType type, Severity severity, int confidence, double penalty, Map<String, Object> evidence) {
    }
}
