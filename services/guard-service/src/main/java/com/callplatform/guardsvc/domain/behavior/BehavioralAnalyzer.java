package com.callplatform.guardsvc.domain.behavior;

import com.callplatform.guardsvc.config.GuardMetrics;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.Severity;
import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.domain.ratelimit.IdentifierResolver;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitService;
import com.callplatform.guardsvc.infrastructure.logging.SecurityEventLogger;
import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records per-identifier request events and scores them. Events live in a time-ordered set under
 * {@code behavior:{identifier}}; the composite score is cached under {@code behavior:score:{identifier}}.
 */
@Service
@Slf4j
public class BehavioralAnalyzer {

    static final String EVENTS_PREFIX = "behavior:";
    static final String SCORE_PREFIX = "behavior:score:";
    private static final char MEMBER_SEPARATOR = '#';
    private static final Duration RESCORE_INTERVAL = Duration.ofSeconds(30);

    private final CounterStore counterStore;
    private final RateLimitService rateLimitService;
    private final IdentifierResolver identifierResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecurityUtils securityUtils;
    private final SecurityEventLogger securityEventLogger;
    private final GuardMetrics metrics;
    private final GuardProperties.Behavior settings;
    private final BehaviorDetectors detectors;

    public BehavioralAnalyzer(CounterStore counterStore, RateLimitService rateLimitService,
                              IdentifierResolver identifierResolver, ObjectMapper objectMapper, Clock clock,
                              SecurityUtils securityUtils, SecurityEventLogger securityEventLogger,
                              GuardMetrics metrics, GuardProperties properties) {
        this.counterStore = counterStore;
        this.rateLimitService = rateLimitService;
        this.identifierResolver = identifierResolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.securityUtils = securityUtils;
        this.securityEventLogger = securityEventLogger;
        this.metrics = metrics;
        this.settings = properties.getBehavior();
        this.detectors = new BehaviorDetectors(settings);
    }

    /**
     * Appends the event to the caller's window and refreshes the cached score when it is missing or stale.
     * Store failures are logged and dropped.
     */
    public void recordPattern(BehaviorPattern event, UserContext context) {
        if (event == null || context == null) {
            throw new InvalidRequestException("event", "Behavior event and context are required");
        }
        String identifier = identifierResolver.resolve(context);
        try {
            String member = objectMapper.writeValueAsString(event) + MEMBER_SEPARATOR + UUID.randomUUID();
            counterStore.addScored(EVENTS_PREFIX + identifier, event.timestamp(), member, settings.getRetention());
            if (isStale(identifier)) {
                analyzePatterns(identifier, context);
            }
        } catch (CounterStoreException e) {
            log.debug("Dropping behavior event for {}: {}", securityUtils.maskIdentifier(identifier), e.getMessage());
            metrics.failOpen("behavior-recorder");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Behavior event is not serializable", e);
        }
    }

    /**
     * Runs every detector over the identifier's current window, caches the resulting score and
     * registers the caller's IP as suspicious on any high or critical finding.
     */
    public List<SuspiciousActivity> analyzePatterns(String identifier, UserContext context) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidRequestException("identifier", "Behavior identifier is required");
        }
        long now = clock.millis();
        List<BehaviorPattern> window;
        try {
            window = loadWindow(identifier, now);
        } catch (CounterStoreException e) {
            log.warn("Behavior analysis skipped for {}: {}", securityUtils.maskIdentifier(identifier), e.getMessage());
            metrics.failOpen("behavior-analyzer");
            return List.of();
        }

        boolean sessionScoped = context != null ? context.authenticated() : identifier.startsWith("user:");
        List<SuspiciousActivity> findings = detectors.detect(window, sessionScoped, now);
        BehaviorScore score = score(identifier, findings, now);
        cacheScore(identifier, score);

        if (!findings.isEmpty()) {
            report(identifier, context, findings, score);
        }
        return findings;
    }

    public BehaviorScore getBehaviorScore(UserContext context) {
        if (context == null) {
            throw new InvalidRequestException("context", "User context is required");
        }
        return getBehaviorScore(identifierResolver.resolve(context));
    }

    /**
     * The cached score, or a clean 100 when the identifier has none.
     */
    public BehaviorScore getBehaviorScore(String identifier) {
        return readCachedScore(identifier).orElseGet(() -> BehaviorScore.clean(identifier));
    }

    /**
     * Requests recorded for the identifier within {@code window}. Zero when the store is down.
     */
    public long countRecent(String identifier, Duration window) {
        long now = clock.millis();
        try {
            return counterStore.countByScore(EVENTS_PREFIX + identifier, now - window.toMillis(), now);
        } catch (CounterStoreException e) {
            log.debug("Recent request count unavailable for {}: {}", securityUtils.maskIdentifier(identifier), e.getMessage());
            return 0L;
        }
    }

    BehaviorScore score(String identifier, List<SuspiciousActivity> findings, long now) {
        RiskFactors factors = BehaviorDetectors.riskFactors(findings);
        int overall = (int) Math.max(0, Math.round(100 - factors.weightedSum(settings.getWeights())));
        return new BehaviorScore(identifier, overall, factors, recommendations(overall, factors), now);
    }

    static List<String> recommendations(int overall, RiskFactors factors) {
        List<String> recommendations = new ArrayList<>();
        if (overall < 30) {
            recommendations.add("Block or require a hard CAPTCHA challenge");
        } else if (overall < 60) {
            recommendations.add("Require CAPTCHA verification");
        } else if (overall < 80) {
            recommendations.add("Monitor closely");
        }
        if (factors.burstActivity() > 0) {
            recommendations.add("Apply stricter rate limits");
        }
        if (factors.regularIntervals() > 0) {
            recommendations.add("Traffic looks automated; consider a challenge");
        }
        if (factors.errorRate() > 0) {
            recommendations.add("Investigate probing of invalid resources");
        }
        if (factors.endpointScanning() > 0) {
            recommendations.add("Restrict endpoint discovery");
        }
        if (factors.credentialStuffing() > 0) {
            recommendations.add("Lock down authentication endpoints for this client");
        }
        if (factors.sessionAnomalies() > 0) {
            recommendations.add("Re-verify session ownership");
        }
        return recommendations;
    }

    private List<BehaviorPattern> loadWindow(String identifier, long now) {
        String key = EVENTS_PREFIX + identifier;
        long windowStart = now - settings.getRetention().toMillis();
        counterStore.removeScoredUpTo(key, windowStart - 1);
        List<BehaviorPattern> events = new ArrayList<>();
        for (String member : counterStore.latestByScore(key, windowStart, settings.getMaxEvents())) {
            int separator = member.lastIndexOf(MEMBER_SEPARATOR);
            String json = separator > 0 ? member.substring(0, separator) : member;
            try {
                events.add(objectMapper.readValue(json, BehaviorPattern.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed behavior event for {}", securityUtils.maskIdentifier(identifier));
            }
        }
        return events;
    }

    private boolean isStale(String identifier) {
        return readCachedScore(identifier)
                .map(score -> clock.millis() - score.computedAt() >= RESCORE_INTERVAL.toMillis())
                .orElse(true);
    }

    private Optional<BehaviorScore> readCachedScore(String identifier) {
        try {
            Optional<String> json = counterStore.get(SCORE_PREFIX + identifier);
            if (json.isPresent()) {
                return Optional.of(objectMapper.readValue(json.get(), BehaviorScore.class));
            }
        } catch (CounterStoreException e) {
            log.debug("Behavior score unavailable for {}: {}", securityUtils.maskIdentifier(identifier), e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed behavior score for {}", securityUtils.maskIdentifier(identifier));
        }
        return Optional.empty();
    }

    private void cacheScore(String identifier, BehaviorScore score) {
        try {
            counterStore.set(SCORE_PREFIX + identifier, objectMapper.writeValueAsString(score), settings.getScoreTtl());
        } catch (CounterStoreException | JsonProcessingException e) {
            log.debug("Behavior score not cached for {}: {}", securityUtils.maskIdentifier(identifier), e.getMessage());
        }
    }

    private void report(String identifier, UserContext context, List<SuspiciousActivity> findings, BehaviorScore score) {
        Severity worst = findings.stream().map(SuspiciousActivity::severity).reduce(Severity.LOW, Severity::max);
        String types = findings.stream().map(finding -> finding.type().code()).reduce((a, b) -> a + "," + b).orElse("");
        findings.forEach(finding -> metrics.suspiciousActivity(finding.type().code()));

        String ip = context != null ? context.ipAddress() : null;
        securityEventLogger.log(SecurityEventLogger.SUSPICIOUS_BEHAVIOR, ip, identifier,
                "Suspicious request pattern detected",
                Map.of("findings", types, "severity", worst.code(), "score", String.valueOf(score.overallScore())));

        if (ip != null && worst.isAtLeast(Severity.HIGH)) {
            rateLimitService.addSuspiciousIP(ip, context.country(), settings.getSuspiciousIpTtl());
        }
    }
}
