package com.callplatform.guardsvc.domain.ratelimit;

import com.callplatform.guardsvc.config.GuardMetrics;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import com.callplatform.guardsvc.infrastructure.store.SlidingWindowOutcome;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Distributed sliding-window rate limiting over the shared counter store.
 * Counters live under {@code ratelimit:{tier}:{identifier}}. A store outage fails open.
 */
@Service
@Slf4j
public class RateLimitService {

    static final String KEY_PREFIX = "ratelimit:";
    static final String SUSPICIOUS_PREFIX = "suspicious_ip:";
    static final String GLOBAL_SCOPE = "global";

    private final CounterStore counterStore;
    private final RateLimitTiers tiers;
    private final Clock clock;
    private final SecurityUtils securityUtils;
    private final GuardMetrics metrics;
    private final Duration defaultSuspiciousTtl;

    public RateLimitService(CounterStore counterStore, RateLimitTiers tiers, Clock clock,
                            SecurityUtils securityUtils, GuardMetrics metrics, GuardProperties properties) {
        this.counterStore = counterStore;
        this.tiers = tiers;
        this.clock = clock;
        this.securityUtils = securityUtils;
        this.metrics = metrics;
        this.defaultSuspiciousTtl = properties.getRateLimit().getSuspiciousIpTtl();
    }

    /**
     * Admits or denies one request for {@code identifier} under {@code config}.
     *
     * @param context the caller, used for logging only; may be null
     * @throws InvalidRequestException if the identifier or config is missing
     */
    public RateLimitResult checkLimit(String identifier, RateLimitConfig config, UserContext context) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidRequestException("identifier", "Rate limit identifier is required");
        }
        if (config == null) {
            throw new InvalidRequestException("config", "Rate limit config is required");
        }

        long now = clock.millis();
        SlidingWindowOutcome outcome;
        try {
            outcome = counterStore.admitSlidingWindow(
                    counterKey(config, identifier), now, config.windowMs(), config.maxRequests());
        } catch (CounterStoreException e) {
            log.warn("Rate limiter failing open: tier={}, identifier={}, cause={}",
                    config.name(), securityUtils.maskIdentifier(identifier), e.getMessage());
            metrics.failOpen("rate-limiter");
            return RateLimitResult.failOpen(config, now);
        }

        long resetTime = now + config.windowMs();
        int total = (int) outcome.countAfter();
        if (outcome.admitted()) {
            int remaining = (int) Math.max(0, config.maxRequests() - outcome.countAfter());
            return RateLimitResult.allowed(config.maxRequests(), remaining, resetTime, total);
        }

        long retryAfter = retryAfterSeconds(outcome.oldestScore(), config.windowMs(), now);
        log.debug("Rate limit exceeded: tier={}, identifier={}, count={}, role={}",
                config.name(), securityUtils.maskIdentifier(identifier), total,
                context != null ? context.role() : null);
        return RateLimitResult.denied(config.maxRequests(), resetTime, retryAfter, total);
    }

    public RateLimitConfig getUserRateLimit(UserContext context, String endpointPath) {
        if (context == null) {
            throw new InvalidRequestException("context", "User context is required");
        }
        return tiers.resolve(context.role(), endpointPath);
    }

    /**
     * Drops the counter for one identifier under one tier.
     */
    public boolean resetLimit(String identifier, RateLimitConfig config) {
        try {
            return counterStore.delete(counterKey(config, identifier));
        } catch (CounterStoreException e) {
            log.warn("Could not reset rate limit for {}: {}", securityUtils.maskIdentifier(identifier), e.getMessage());
            return false;
        }
    }

    /**
     * True when the IP is registered globally or for the given country. A store failure reads as not suspicious.
     */
    public boolean isIPSuspicious(String ipAddress, String country) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return false;
        }
        try {
            if (counterStore.exists(suspiciousKey(GLOBAL_SCOPE, ipAddress))) {
                return true;
            }
            return country != null && !country.isBlank()
                    && counterStore.exists(suspiciousKey(country, ipAddress));
        } catch (CounterStoreException e) {
            log.warn("Suspicious-IP lookup failed for {}: {}", securityUtils.maskIp(ipAddress), e.getMessage());
            metrics.failOpen("suspicious-registry");
            return false;
        }
    }

    /**
     * Registers the IP globally and, when a country is known, under that country. Entries expire after {@code ttl}.
     */
    public void addSuspiciousIP(String ipAddress, String country, Duration ttl) {
        if (ipAddress == null || ipAddress.isBlank()) {
            throw new InvalidRequestException("ipAddress", "IP address is required");
        }
        Duration effectiveTtl = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : defaultSuspiciousTtl;
        String marker = String.valueOf(clock.millis());
        try {
            counterStore.set(suspiciousKey(GLOBAL_SCOPE, ipAddress), marker, effectiveTtl);
            if (country != null && !country.isBlank()) {
                counterStore.set(suspiciousKey(country, ipAddress), marker, effectiveTtl);
            }
            log.info("Marked IP as suspicious: ip={}, country={}, ttl={}",
                    securityUtils.maskIp(ipAddress), country, effectiveTtl);
        } catch (CounterStoreException e) {
            log.warn("Could not register suspicious IP {}: {}", securityUtils.maskIp(ipAddress), e.getMessage());
        }
    }

    public void addSuspiciousIP(String ipAddress, String country) {
        addSuspiciousIP(ipAddress, country, defaultSuspiciousTtl);
    }

    static String counterKey(RateLimitConfig config, String identifier) {
        return KEY_PREFIX + config.name() + ":" + identifier;
    }

    static String suspiciousKey(String scope, String ipAddress) {
        String normalizedScope = GLOBAL_SCOPE.equals(scope) ? scope : scope.trim().toUpperCase(Locale.ROOT);
        return SUSPICIOUS_PREFIX + normalizedScope + ":" + ipAddress;
    }

    private static long retryAfterSeconds(long oldestScore, long windowMs, long now) {
        long waitMs = oldestScore > 0 ? oldestScore + windowMs - now : windowMs;
        return Math.max(1, (waitMs + 999) / 1000);
    }
}
