package com.callplatform.guardsvc.infrastructure.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shared store for counters, time-ordered event sets, membership sets and TTL records.
 * Every operation is narrow and idempotent; implementations throw {@link CounterStoreException}
 * on any dependency failure.
 */
public interface CounterStore {

    /**
     * Purges entries scored at or before {@code now - window}, counts the rest and, when the count
     * is below {@code maxRequests}, inserts a new entry scored {@code now} and extends the key's
     * expiry to the window. Executes as one atomic batch.
     */
    SlidingWindowOutcome admitSlidingWindow(String key, long nowMillis, long windowMillis, int maxRequests);

    /**
     * Adds (or re-scores) a member of a sorted set. A non-null retention resets the key's expiry.
     */
    void addScored(String key, long score, String member, Duration retention);

    /**
     * Up to {@code limit} newest members scored at or after {@code minScore}, oldest first.
     */
    List<String> latestByScore(String key, long minScore, int limit);

    long countByScore(String key, long minScore, long maxScore);

    long removeScoredUpTo(String key, long maxScore);

    void removeScored(String key, String member);

    void addToSet(String key, String member, Duration ttl);

    void removeFromSet(String key, String member);

    boolean isSetMember(String key, String member);

    long setCardinality(String key);

    Set<String> setMembers(String key);

    Optional<String> get(String key);

    /**
     * Stores a value; a null ttl stores it without expiry.
     */
    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    boolean isAvailable();
}
