package com.callplatform.guardsvc.infrastructure.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Single-process counter store on Caffeine with per-entry expiry driven by the injected clock.
 * Same contract as the Redis store; used for local development and tests.
 */
@Component
@ConditionalOnProperty(name = "app.counter-store.mode", havingValue = "memory")
public class InMemoryCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCounterStore.class);
    private static final long KEEP_CURRENT = -1L;
    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private final Cache<String, Slot> entries;

    public InMemoryCounterStore(Clock clock) {
        this.entries = Caffeine.newBuilder()
                .maximumSize(250_000)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfter(new SlotExpiry())
                .build();
        log.info("InMemoryCounterStore initialized; counts are local to this process");
    }

    @Override
    public SlidingWindowOutcome admitSlidingWindow(String key, long nowMillis, long windowMillis, int maxRequests) {
        long[] outcome = new long[3];
        entries.asMap().compute(key, (k, slot) -> {
            ScoredSet set = slot == null ? new ScoredSet() : slot.as(ScoredSet.class, "admitSlidingWindow");
            synchronized (set) {
                set.removeUpTo(nowMillis - windowMillis);
                int before = set.size();
                long ttl = KEEP_CURRENT;
                if (before < maxRequests) {
                    set.add(nowMillis, nowMillis + "-" + UUID.randomUUID());
                    ttl = TimeUnit.MILLISECONDS.toNanos(windowMillis);
                }
                outcome[0] = before;
                outcome[1] = set.size();
                outcome[2] = set.oldestScore(nowMillis);
                if (slot == null && ttl == KEEP_CURRENT) {
                    ttl = TimeUnit.MILLISECONDS.toNanos(windowMillis);
                }
                return new Slot(set, ttl);
            }
        });
        return new SlidingWindowOutcome(outcome[0], outcome[1], outcome[2]);
    }

    @Override
    public void addScored(String key, long score, String member, Duration retention) {
        entries.asMap().compute(key, (k, slot) -> {
            ScoredSet set = slot == null ? new ScoredSet() : slot.as(ScoredSet.class, "addScored");
            synchronized (set) {
                set.add(score, member);
            }
            return new Slot(set, retention != null ? retention.toNanos() : (slot == null ? NO_EXPIRY : KEEP_CURRENT));
        });
    }

    @Override
    public List<String> latestByScore(String key, long minScore, int limit) {
        ScoredSet set = read(key, ScoredSet.class, "latestByScore");
        if (set == null) {
            return List.of();
        }
        synchronized (set) {
            return set.latest(minScore, limit);
        }
    }

    @Override
    public long countByScore(String key, long minScore, long maxScore) {
        ScoredSet set = read(key, ScoredSet.class, "countByScore");
        if (set == null) {
            return 0L;
        }
        synchronized (set) {
            return set.count(minScore, maxScore);
        }
    }

    @Override
    public long removeScoredUpTo(String key, long maxScore) {
        ScoredSet set = read(key, ScoredSet.class, "removeScoredUpTo");
        if (set == null) {
            return 0L;
        }
        synchronized (set) {
            return set.removeUpTo(maxScore);
        }
    }

    @Override
    public void removeScored(String key, String member) {
        ScoredSet set = read(key, ScoredSet.class, "removeScored");
        if (set != null) {
            synchronized (set) {
                set.remove(member);
            }
        }
    }

    @Override
    public void addToSet(String key, String member, Duration ttl) {
        entries.asMap().compute(key, (k, slot) -> {
            Set<String> members = slot == null ? ConcurrentHashMap.newKeySet() : slot.asSet("addToSet");
            members.add(member);
            return new Slot(members, ttl != null ? ttl.toNanos() : (slot == null ? NO_EXPIRY : KEEP_CURRENT));
        });
    }

    @Override
    public void removeFromSet(String key, String member) {
        Slot slot = entries.getIfPresent(key);
        if (slot != null) {
            slot.asSet("removeFromSet").remove(member);
        }
    }

    @Override
    public boolean isSetMember(String key, String member) {
        Slot slot = entries.getIfPresent(key);
        return slot != null && slot.asSet("isSetMember").contains(member);
    }

    @Override
    public long setCardinality(String key) {
        Slot slot = entries.getIfPresent(key);
        return slot == null ? 0L : slot.asSet("setCardinality").size();
    }

    @Override
    public Set<String> setMembers(String key) {
        Slot slot = entries.getIfPresent(key);
        return slot == null ? Set.of() : Set.copyOf(slot.asSet("setMembers"));
    }

    @Override
    public Optional<String> get(String key) {
        Slot slot = entries.getIfPresent(key);
        return slot == null ? Optional.empty() : Optional.of(slot.as(String.class, "get"));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.asMap().compute(key, (k, existing) -> new Slot(value, ttl != null ? ttl.toNanos() : NO_EXPIRY));
    }

    @Override
    public boolean delete(String key) {
        return entries.asMap().remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return entries.getIfPresent(key) != null;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private <T> T read(String key, Class<T> type, String operation) {
        Slot slot = entries.getIfPresent(key);
        return slot == null ? null : slot.as(type, operation);
    }

    private record Slot(Object data, long ttlNanos) {

        <T> T as(Class<T> type, String operation) {
            if (!type.isInstance(data)) {
                throw new CounterStoreException(operation, "WRONGTYPE key holds " + data.getClass().getSimpleName());
            }
            return type.cast(data);
        }

        @SuppressWarnings("unchecked")
        Set<String> asSet(String operation) {
            if (!(data instanceof Set<?>)) {
                throw new CounterStoreException(operation, "WRONGTYPE key holds " + data.getClass().getSimpleName());
            }
            return (Set<String>) data;
        }
    }

    private static final class SlotExpiry implements Expiry<String, Slot> {

        @Override
        public long expireAfterCreate(String key, Slot slot, long currentTime) {
            return slot.ttlNanos() == KEEP_CURRENT ? NO_EXPIRY : slot.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Slot slot, long currentTime, long currentDuration) {
            return slot.ttlNanos() == KEEP_CURRENT ? currentDuration : slot.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Slot slot, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    /**
     * Sorted set ordered by score, then insertion. Callers synchronize on the instance.
     */
    static final class ScoredSet {

        private final NavigableMap<Long, Set<String>> byScore = new TreeMap<>();
        private final Map<String, Long> scores = new HashMap<>();

        void add(long score, String member) {
            remove(member);
            byScore.computeIfAbsent(score, s -> new LinkedHashSet<>()).add(member);
            scores.put(member, score);
        }

        void remove(String member) {
            Long previous = scores.remove(member);
            if (previous != null) {
                Set<String> bucket = byScore.get(previous);
                bucket.remove(member);
                if (bucket.isEmpty()) {
                    byScore.remove(previous);
                }
            }
        }

        long removeUpTo(long maxScore) {
            long removed = 0;
            Iterator<Map.Entry<Long, Set<String>>> it = byScore.headMap(maxScore, true).entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Long, Set<String>> entry = it.next();
                for (String member : entry.getValue()) {
                    scores.remove(member);
                    removed++;
                }
                it.remove();
            }
            return removed;
        }

        long count(long minScore, long maxScore) {
            if (minScore > maxScore) {
                return 0;
            }
            return byScore.subMap(minScore, true, maxScore, true).values().stream()
                    .mapToLong(Set::size)
                    .sum();
        }

        List<String> latest(long minScore, int limit) {
            Deque<String> newest = new ArrayDeque<>();
            for (Set<String> bucket : byScore.tailMap(minScore, true).descendingMap().values()) {
                List<String> members = new ArrayList<>(bucket);
                for (int i = members.size() - 1; i >= 0 && newest.size() < limit; i--) {
                    newest.addFirst(members.get(i));
                }
                if (newest.size() >= limit) {
                    break;
                }
            }
            return new ArrayList<>(newest);
        }

        long oldestScore(long fallback) {
            return byScore.isEmpty() ? fallback : byScore.firstKey();
        }

        int size() {
            return scores.size();
        }
    }
}
