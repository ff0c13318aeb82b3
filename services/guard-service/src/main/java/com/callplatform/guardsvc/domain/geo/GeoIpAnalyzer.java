package com.callplatform.guardsvc.domain.geo;

import com.callplatform.guardsvc.config.GuardMetrics;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.ThreatLevel;
import com.callplatform.guardsvc.infrastructure.geo.GeoLookupException;
import com.callplatform.guardsvc.infrastructure.geo.GeoReputationProvider;
import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import com.callplatform.guardsvc.shared.exception.GuardServiceException;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.http.IpAddresses;
import com.callplatform.guardsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves IP reputation (process cache, then shared store, then provider) and applies geo rules.
 * Provider and store failures degrade to a low-threat answer; geo checks never block on an outage.
 */
@Service
@Slf4j
public class GeoIpAnalyzer {

    static final String CACHE_PREFIX = "geoip:";
    static final String RULES_KEY = "geoip:rules";
    private static final String ACTIVE_RULES = "active";

    private final CounterStore counterStore;
    private final GeoReputationProvider provider;
    private final GeoThreatAssessor assessor;
    private final ObjectMapper objectMapper;
    private final SecurityUtils securityUtils;
    private final GuardMetrics metrics;
    private final GuardProperties.Geo properties;
    private final Cache<String, GeoLocation> localCache;
    private final Cache<String, List<GeoBlockRule>> rulesCache;

    public GeoIpAnalyzer(CounterStore counterStore, GeoReputationProvider provider, GeoThreatAssessor assessor,
                         ObjectMapper objectMapper, SecurityUtils securityUtils, GuardMetrics metrics,
                         GuardProperties properties) {
        this.counterStore = counterStore;
        this.provider = provider;
        this.assessor = assessor;
        this.objectMapper = objectMapper;
        this.securityUtils = securityUtils;
        this.metrics = metrics;
        this.properties = properties.getGeo();
        this.localCache = Caffeine.newBuilder()
                .maximumSize(50_000)
                .expireAfterWrite(this.properties.getLocalCacheTtl())
                .build();
        this.rulesCache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(this.properties.getRulesCacheTtl())
                .build();
    }

    /**
     * @throws InvalidRequestException if the address is missing or not an IP literal
     */
    public GeoLocation analyzeIP(String ipAddress) {
        String ip = requireIp(ipAddress);

        GeoLocation cached = localCache.getIfPresent(ip);
        if (cached != null) {
            return cached;
        }

        Optional<GeoLocation> shared = readShared(ip);
        if (shared.isPresent()) {
            localCache.put(ip, shared.get());
            return shared.get();
        }

        if (IpAddresses.isPrivateOrLoopback(ip)) {
            GeoLocation local = GeoLocation.local(ip);
            localCache.put(ip, local);
            return local;
        }

        GeoLocation resolved;
        try {
            resolved = assessor.assess(provider.lookup(ip));
        } catch (GeoLookupException e) {
            log.warn("Geo provider unavailable for {}, treating as low threat: {}",
                    securityUtils.maskIp(ip), e.getMessage());
            metrics.failOpen("geo-provider");
            return GeoLocation.unknown(ip);
        }

        writeShared(ip, resolved);
        localCache.put(ip, resolved);
        return resolved;
    }

    /**
     * Evaluates the active rule set against the IP's location. Any dependency failure allows.
     */
    public GeoBlockDecision shouldBlockIP(String ipAddress) {
        try {
            GeoLocation location = analyzeIP(ipAddress);
            GeoBlockDecision decision = GeoRuleEvaluator.evaluate(getRules(), location);
            if (decision.blocked()) {
                log.info("Geo block: ip={}, country={}, threat={}, rule={}",
                        securityUtils.maskIp(ipAddress), location.countryCode(),
                        location.threatLevel().code(), decision.ruleId());
            }
            return decision;
        } catch (GuardServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Geo check failed open for {}: {}", securityUtils.maskIp(ipAddress), e.getMessage());
            metrics.failOpen("geo-analyzer");
            return GeoBlockDecision.allow();
        }
    }

    public List<GeoBlockRule> getRules() {
        return rulesCache.get(ACTIVE_RULES, key -> loadRules());
    }

    /**
     * Replaces the shared rule set. Store failures propagate to the caller.
     */
    public List<GeoBlockRule> replaceRules(List<GeoBlockRule> rules) {
        List<GeoBlockRule> copy = List.copyOf(rules);
        Set<String> ids = new HashSet<>();
        for (GeoBlockRule rule : copy) {
            if (!ids.add(rule.id())) {
                throw new InvalidRequestException("id", "Duplicate geo rule id: " + rule.id());
            }
        }
        try {
            counterStore.set(RULES_KEY, objectMapper.writeValueAsString(copy), null);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Geo rules are not serializable", e);
        }
        rulesCache.invalidateAll();
        log.info("Geo rules replaced: count={}", copy.size());
        return copy;
    }

    public void evict(String ipAddress) {
        String ip = requireIp(ipAddress);
        localCache.invalidate(ip);
        try {
            counterStore.delete(CACHE_PREFIX + ip);
        } catch (CounterStoreException e) {
            log.warn("Could not evict geo record for {}: {}", securityUtils.maskIp(ip), e.getMessage());
        }
    }

    private List<GeoBlockRule> loadRules() {
        try {
            Optional<String> stored = counterStore.get(RULES_KEY);
            if (stored.isPresent()) {
                return List.copyOf(objectMapper.readValue(stored.get(), new TypeReference<List<GeoBlockRule>>() { }));
            }
        } catch (CounterStoreException e) {
            log.warn("Geo rules unavailable from store, using defaults: {}", e.getMessage());
        } catch (JsonProcessingException | GuardServiceException e) {
            log.warn("Stored geo rules are malformed, using defaults: {}", e.getMessage());
        }
        return defaultRules();
    }

    private List<GeoBlockRule> defaultRules() {
        return properties.getDefaultRules().stream()
                .map(rule -> new GeoBlockRule(
                        rule.getId(),
                        GeoRuleType.fromCode(rule.getType()),
                        new HashSet<>(rule.getCountries()),
                        new GeoBlockRule.Conditions(rule.getMaxThreatLevel()),
                        rule.getPriority(),
                        rule.isEnabled()))
                .toList();
    }

    private Optional<GeoLocation> readShared(String ip) {
        try {
            Optional<String> json = counterStore.get(CACHE_PREFIX + ip);
            if (json.isPresent()) {
                return Optional.of(objectMapper.readValue(json.get(), GeoLocation.class));
            }
        } catch (CounterStoreException e) {
            log.debug("Geo cache read failed for {}: {}", securityUtils.maskIp(ip), e.getMessage());
        } catch (JsonProcessingException | GuardServiceException e) {
            log.warn("Discarding malformed geo cache entry for {}: {}", securityUtils.maskIp(ip), e.getMessage());
        }
        return Optional.empty();
    }

    private void writeShared(String ip, GeoLocation location) {
        Duration ttl = location.threatLevel().isAtLeast(ThreatLevel.HIGH)
                ? properties.getHighThreatCacheTtl()
                : properties.getCacheTtl();
        try {
            counterStore.set(CACHE_PREFIX + ip, objectMapper.writeValueAsString(location), ttl);
        } catch (CounterStoreException | JsonProcessingException e) {
            log.debug("Geo cache write failed for {}: {}", securityUtils.maskIp(ip), e.getMessage());
        }
    }

    private static String requireIp(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            throw new InvalidRequestException("ipAddress", "IP address is required");
        }
        String ip = ipAddress.trim();
        if (!IpAddresses.isValid(ip)) {
            throw new InvalidRequestException("ipAddress", "Not an IP address: " + ip);
        }
        return ip;
    }
}
