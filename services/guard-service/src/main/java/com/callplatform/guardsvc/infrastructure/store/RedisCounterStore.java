package com.callplatform.guardsvc.infrastructure.store;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.scripting.support.ResourceScriptSource;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis-backed counter store. The sliding-window batch runs as a Lua script so concurrent
 * requests for one identifier are serialized inside Redis.
 */
@Component
@ConditionalOnProperty(name = "app.counter-store.mode", havingValue = "redis", matchIfMissing = true)
public class RedisCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);
    private static final String KEY_PREFIX = "guard:";

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;
    private final DefaultRedisScript<List<Long>> slidingWindowScript;

    @SuppressWarnings("unchecked")
    public RedisCounterStore(StringRedisTemplate redisTemplate, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.redisTemplate = redisTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("counterStore");
        this.slidingWindowScript = new DefaultRedisScript<>();
        this.slidingWindowScript.setScriptSource(
                new ResourceScriptSource(new ClassPathResource("scripts/sliding_window.lua")));
        this.slidingWindowScript.setResultType((Class<List<Long>>) (Class<?>) List.class);
    }

    @Override
    public SlidingWindowOutcome admitSlidingWindow(String key, long nowMillis, long windowMillis, int maxRequests) {
        String member = nowMillis + "-" + UUID.randomUUID();
        List<Long> raw = execute("admitSlidingWindow", () -> redisTemplate.execute(
                slidingWindowScript,
                Collections.singletonList(KEY_PREFIX + key),
                String.valueOf(nowMillis),
                String.valueOf(windowMillis),
                String.valueOf(maxRequests),
                member));
        if (raw == null || raw.size() < 3) {
            throw new CounterStoreException("admitSlidingWindow", "unexpected script reply " + raw);
        }
        return new SlidingWindowOutcome(toLong(raw.get(0)), toLong(raw.get(1)), toLong(raw.get(2)));
    }

    @Override
    public void addScored(String key, long score, String member, Duration retention) {
        byte[] rawKey = serialize(KEY_PREFIX + key);
        byte[] rawMember = serialize(member);
        execute("addScored", () -> redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            connection.zSetCommands().zAdd(rawKey, score, rawMember);
            if (retention != null) {
                connection.keyCommands().pExpire(rawKey, retention.toMillis());
            }
            return null;
        }));
    }

    @Override
    public List<String> latestByScore(String key, long minScore, int limit) {
        Set<String> newestFirst = execute("latestByScore", () -> redisTemplate.opsForZSet()
                .reverseRangeByScore(KEY_PREFIX + key, minScore, Double.POSITIVE_INFINITY, 0, limit));
        if (newestFirst == null || newestFirst.isEmpty()) {
            return List.of();
        }
        List<String> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        return ordered;
    }

    @Override
    public long countByScore(String key, long minScore, long maxScore) {
        Long count = execute("countByScore",
                () -> redisTemplate.opsForZSet().count(KEY_PREFIX + key, minScore, maxScore));
        return count != null ? count : 0L;
    }

    @Override
    public long removeScoredUpTo(String key, long maxScore) {
        Long removed = execute("removeScoredUpTo", () -> redisTemplate.opsForZSet()
                .removeRangeByScore(KEY_PREFIX + key, Double.NEGATIVE_INFINITY, maxScore));
        return removed != null ? removed : 0L;
    }

    @Override
    public void removeScored(String key, String member) {
        execute("removeScored", () -> redisTemplate.opsForZSet().remove(KEY_PREFIX + key, member));
    }

    @Override
    public void addToSet(String key, String member, Duration ttl) {
        byte[] rawKey = serialize(KEY_PREFIX + key);
        byte[] rawMember = serialize(member);
        execute("addToSet", () -> redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            connection.setCommands().sAdd(rawKey, rawMember);
            if (ttl != null) {
                connection.keyCommands().pExpire(rawKey, ttl.toMillis());
            }
            return null;
        }));
    }

    @Override
    public void removeFromSet(String key, String member) {
        execute("removeFromSet", () -> redisTemplate.opsForSet().remove(KEY_PREFIX + key, member));
    }

    @Override
    public boolean isSetMember(String key, String member) {
        return Boolean.TRUE.equals(execute("isSetMember",
                () -> redisTemplate.opsForSet().isMember(KEY_PREFIX + key, member)));
    }

    @Override
    public long setCardinality(String key) {
        Long size = execute("setCardinality", () -> redisTemplate.opsForSet().size(KEY_PREFIX + key));
        return size != null ? size : 0L;
    }

    @Override
    public Set<String> setMembers(String key) {
        Set<String> members = execute("setMembers", () -> redisTemplate.opsForSet().members(KEY_PREFIX + key));
        return members != null ? members : Set.of();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(execute("get", () -> redisTemplate.opsForValue().get(KEY_PREFIX + key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        execute("set", () -> {
            if (ttl != null) {
                redisTemplate.opsForValue().set(KEY_PREFIX + key, value, ttl);
            } else {
                redisTemplate.opsForValue().set(KEY_PREFIX + key, value);
            }
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(execute("delete", () -> redisTemplate.delete(KEY_PREFIX + key)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute("exists", () -> redisTemplate.hasKey(KEY_PREFIX + key)));
    }

    @Override
    public boolean isAvailable() {
        if (circuitBreaker.getState() == CircuitBreaker.State.OPEN) {
            return false;
        }
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            log.debug("Counter store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CounterStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Counter store {} failed: {}", operation, e.getMessage());
            throw new CounterStoreException(operation, e);
        }
    }

    private static byte[] serialize(String value) {
        return RedisSerializer.string().serialize(value);
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
