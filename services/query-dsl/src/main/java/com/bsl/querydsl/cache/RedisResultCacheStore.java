package com.bsl.querydsl.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Stores results as a JSON envelope {@code {created_at, fresh_until, expires_at, payload}}.
 * The Redis key expires with the entry's total lifetime.
 */
public class RedisResultCacheStore extends AbstractResultCacheStore {
    private static final Logger log = LoggerFactory.getLogger(RedisResultCacheStore.class);
    private static final Duration REFRESH_LOCK_TTL = Duration.ofSeconds(30);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    public RedisResultCacheStore(StringRedisTemplate redis, ObjectMapper objectMapper, Clock clock, Executor refreshExecutor) {
        super(clock, refreshExecutor);
        this.redis = redis;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CacheEntry<JsonNode>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            String payload = redis.opsForValue().get(key);
            if (payload == null || payload.isBlank()) {
                return Optional.empty();
            }
            JsonNode envelope = objectMapper.readTree(payload);
            CacheEntry<JsonNode> entry = new CacheEntry<>(
                envelope.path("payload"),
                envelope.path("created_at").asLong(),
                envelope.path("fresh_until").asLong(),
                envelope.path("expires_at").asLong()
            );
            if (entry.isExpired(clock.millis())) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (Exception ex) {
            log.debug("query cache read failed key={}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, JsonNode value, CacheTtl ttl) {
        if (key == null || value == null || ttl == null) {
            return;
        }
        CacheEntry<JsonNode> entry = CacheEntry.create(value, clock.millis(), ttl);
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("created_at", entry.getCreatedAt());
        envelope.put("fresh_until", entry.getFreshUntil());
        envelope.put("expires_at", entry.getExpiresAt());
        envelope.set("payload", value);
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(envelope), ttl.getLifetime());
        } catch (Exception ex) {
            log.debug("query cache write failed key={}: {}", key, ex.getMessage());
        }
    }

    @Override
    public void forget(String key) {
        if (key != null) {
            redis.delete(key);
        }
    }

    @Override
    protected boolean acquireRefresh(String key) {
        try {
            Boolean acquired = redis.opsForValue().setIfAbsent(lockKey(key), "1", REFRESH_LOCK_TTL);
            return Boolean.TRUE.equals(acquired);
        } catch (Exception ex) {
            log.debug("query cache refresh lock failed key={}: {}", key, ex.getMessage());
            return false;
        }
    }

    @Override
    protected void releaseRefresh(String key) {
        try {
            redis.delete(lockKey(key));
        } catch (Exception ex) {
            log.debug("query cache refresh unlock failed key={}: {}", key, ex.getMessage());
        }
    }

    private static String lockKey(String key) {
        return key + ":refresh";
    }
}
