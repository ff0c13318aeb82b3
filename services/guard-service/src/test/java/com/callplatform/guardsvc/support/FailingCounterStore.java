package com.callplatform.guardsvc.support;

import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import com.callplatform.guardsvc.infrastructure.store.SlidingWindowOutcome;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counter store whose every operation fails, as an unreachable Redis would.
 */
public class FailingCounterStore implements CounterStore {

    private final AtomicInteger calls = new AtomicInteger();

    public int calls() {
        return calls.get();
    }

    private CounterStoreException fail(String operation) {
        calls.incrementAndGet();
        return new CounterStoreException(operation, "connection refused");
    }

    @Override
    public SlidingWindowOutcome admitSlidingWindow(String key, long nowMillis, long windowMillis, int maxRequests) {
        throw fail("admitSlidingWindow");
    }

    @Override
    public void addScored(String key, long score, String member, Duration retention) {
        throw fail("addScored");
    }

    @Override
    public List<String> latestByScore(String key, long minScore, int limit) {
        throw fail("latestByScore");
    }

    @Override
    public long countByScore(String key, long minScore, long maxScore) {
        throw fail("countByScore");
    }

    @Override
    public long removeScoredUpTo(String key, long maxScore) {
        throw fail("removeScoredUpTo");
    }

    @Override
    public void removeScored(String key, String member) {
        throw fail("removeScored");
    }

    @Override
    public void addToSet(String key, String member, Duration ttl) {
        throw fail("addToSet");
    }

    @Override
    public void removeFromSet(String key, String member) {
        throw fail("removeFromSet");
    }

    @Override
    public boolean isSetMember(String key, String member) {
        throw fail("isSetMember");
    }

    @Override
    public long setCardinality(String key) {
        throw fail("setCardinality");
    }

    @Override
    public Set<String> setMembers(String key) {
        throw fail("setMembers");
    }

    @Override
    public Optional<String> get(String key) {
        throw fail("get");
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        throw fail("set");
    }

    @Override
    public boolean delete(String key) {
        throw fail("delete");
    }

    @Override
    public boolean exists(String key) {
        throw fail("exists");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
