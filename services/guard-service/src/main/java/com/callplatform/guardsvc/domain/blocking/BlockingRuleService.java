package com.callplatform.guardsvc.domain.blocking;

import com.callplatform.guardsvc.config.GuardMetrics;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.exception.RuleNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Block list shared with the fraud subsystem. Rules are stored under {@code blocking:rule:{id}}; each
 * exact value keeps the set of rule ids that name it, and an index serves listing and sweeping.
 * Lookups fail open.
 */
@Service
@Slf4j
public class BlockingRuleService {

    static final String RULE_PREFIX = "blocking:rule:";
    static final String VALUE_PREFIX = "blocking:value:";
    static final String INDEX_KEY = "blocking:index";
    static final String PATTERN_INDEX_KEY = "blocking:patterns";
    private static final int MAX_LISTED = 10_000;

    private final CounterStore counterStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final GuardMetrics metrics;
    private final GuardProperties.Blocking settings;

    public BlockingRuleService(CounterStore counterStore, ObjectMapper objectMapper, Clock clock,
                               GuardMetrics metrics, GuardProperties properties) {
        this.counterStore = counterStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        this.settings = properties.getBlocking();
    }

    /**
     * @param temporary expire after the configured temporary duration instead of never
     * @throws CounterStoreException if the rule cannot be stored
     */
    public BlockingRule createRule(BlockingRuleType type, String value, String reason,
                                   boolean temporary, boolean autoBlocked) {
        if (type == null) {
            throw new InvalidRequestException("type", "Blocking rule type is required");
        }
        String normalized = normalize(type, value);
        long now = clock.millis();
        Duration ttl = temporary ? settings.getTemporaryDuration() : null;
        BlockingRule rule = new BlockingRule(
                UUID.randomUUID().toString(),
                type,
                normalized,
                reason != null && !reason.isBlank() ? reason : "Blocked",
                now,
                ttl != null ? now + ttl.toMillis() : null,
                autoBlocked);

        write(rule, ttl);
        counterStore.addToSet(valueKey(type, normalized), rule.id(), null);
        counterStore.addScored(INDEX_KEY, now, rule.id(), null);
        if (type == BlockingRuleType.PATTERN) {
            counterStore.addToSet(PATTERN_INDEX_KEY, rule.id(), null);
        }
        log.info("Blocking rule created: id={}, type={}, temporary={}, auto={}",
                rule.id(), type.code(), temporary, autoBlocked);
        return rule;
    }

    /**
     * Temporary automatic block unless an active rule already covers the value.
     */
    public Optional<BlockingRule> autoBlock(BlockingRuleType type, String value, String reason) {
        if (checkBlocked(type, value).isPresent()) {
            return Optional.empty();
        }
        try {
            return Optional.of(createRule(type, value, reason, true, true));
        } catch (CounterStoreException e) {
            log.warn("Auto-block skipped, store unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Exact match first, then pattern rules. Store failures read as not blocked.
     */
    public Optional<BlockingRule> checkBlocked(BlockingRuleType type, String value) {
        if (type == null || type == BlockingRuleType.PATTERN || value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(type, value);
        long now = clock.millis();
        try {
            Optional<BlockingRule> exact = activeRuleFor(valueKey(type, normalized), now);
            if (exact.isPresent()) {
                return exact;
            }
            for (String id : counterStore.setMembers(PATTERN_INDEX_KEY)) {
                Optional<BlockingRule> pattern = read(id)
                        .filter(rule -> rule.isActive(now))
                        .filter(rule -> BlockingPatterns.matches(type, normalized, rule.value()));
                if (pattern.isPresent()) {
                    return pattern;
                }
            }
            return Optional.empty();
        } catch (CounterStoreException e) {
            log.warn("Blocking check failed open: {}", e.getMessage());
            metrics.failOpen("blocking-rules");
            return Optional.empty();
        }
    }

    /**
     * Active rules, newest first. A null type lists every type.
     */
    public List<BlockingRule> listActive(BlockingRuleType type) {
        long now = clock.millis();
        List<String> ids = new ArrayList<>(counterStore.latestByScore(INDEX_KEY, Long.MIN_VALUE, MAX_LISTED));
        Collections.reverse(ids);
        List<BlockingRule> rules = new ArrayList<>();
        for (String id : ids) {
            read(id)
                    .filter(rule -> rule.isActive(now))
                    .filter(rule -> type == null || rule.type() == type)
                    .ifPresent(rules::add);
        }
        return rules;
    }

    public Optional<BlockingRule> getRule(String id) {
        return read(id);
    }

    /**
     * @throws RuleNotFoundException if no rule has this id
     */
    public void removeRule(String id) {
        BlockingRule rule = read(id).orElseThrow(() -> new RuleNotFoundException(id));
        unindex(rule.id());
        counterStore.removeFromSet(valueKey(rule.type(), rule.value()), rule.id());
        counterStore.delete(RULE_PREFIX + rule.id());
        log.info("Blocking rule removed: id={}, type={}", rule.id(), rule.type().code());
    }

    /**
     * Drops index entries whose rule has expired. Returns how many were swept.
     */
    @Scheduled(fixedDelayString = "${app.guard.blocking.sweep-interval-ms:300000}",
            initialDelayString = "${app.guard.blocking.sweep-interval-ms:300000}")
    public int cleanupExpiredRules() {
        long now = clock.millis();
        int removed = 0;
        try {
            for (String id : counterStore.latestByScore(INDEX_KEY, Long.MIN_VALUE, MAX_LISTED)) {
                Optional<BlockingRule> rule = read(id);
                if (rule.isEmpty() || !rule.get().isActive(now)) {
                    unindex(id);
                    rule.ifPresent(expired -> {
                        counterStore.delete(RULE_PREFIX + expired.id());
                        counterStore.removeFromSet(valueKey(expired.type(), expired.value()), expired.id());
                    });
                    removed++;
                }
            }
        } catch (CounterStoreException e) {
            log.warn("Blocking rule sweep aborted: {}", e.getMessage());
        }
        if (removed > 0) {
            log.info("Swept {} expired blocking rules", removed);
        }
        return removed;
    }

    /**
     * Newest active rule among the ids recorded for one value. Ids whose rule is gone are pruned.
     */
    private Optional<BlockingRule> activeRuleFor(String valueKey, long now) {
        BlockingRule newest = null;
        for (String id : counterStore.setMembers(valueKey)) {
            Optional<BlockingRule> rule = read(id);
            if (rule.isEmpty()) {
                counterStore.removeFromSet(valueKey, id);
                continue;
            }
            if (rule.get().isActive(now) && (newest == null || rule.get().createdAt() > newest.createdAt())) {
                newest = rule.get();
            }
        }
        return Optional.ofNullable(newest);
    }

    private static String valueKey(BlockingRuleType type, String normalizedValue) {
        return VALUE_PREFIX + type.code() + ":" + normalizedValue;
    }

    private void unindex(String id) {
        counterStore.removeScored(INDEX_KEY, id);
        counterStore.removeFromSet(PATTERN_INDEX_KEY, id);
    }

    private void write(BlockingRule rule, Duration ttl) {
        try {
            counterStore.set(RULE_PREFIX + rule.id(), objectMapper.writeValueAsString(rule), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Blocking rule is not serializable", e);
        }
    }

    private Optional<BlockingRule> read(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Optional<String> json = counterStore.get(RULE_PREFIX + id);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), BlockingRule.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed blocking rule {}", id);
            return Optional.empty();
        }
    }

    private static String normalize(BlockingRuleType type, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("value", "Blocking rule value is required");
        }
        String trimmed = value.trim();
        return type == BlockingRuleType.EMAIL || type == BlockingRuleType.PATTERN
                ? trimmed.toLowerCase(Locale.ROOT)
                : trimmed;
    }
}
