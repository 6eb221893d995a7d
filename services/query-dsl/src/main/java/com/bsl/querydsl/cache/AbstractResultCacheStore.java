package com.bsl.querydsl.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractResultCacheStore implements ResultCacheStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractResultCacheStore.class);

    protected final Clock clock;
    private final Executor refreshExecutor;

    protected AbstractResultCacheStore(Clock clock, Executor refreshExecutor) {
        this.clock = clock;
        this.refreshExecutor = refreshExecutor;
    }

    @Override
    public JsonNode remember(String key, CacheTtl ttl, Supplier<JsonNode> callback) {
        Optional<CacheEntry<JsonNode>> cached = get(key);
        if (cached.isPresent() && cached.get().isFresh(clock.millis())) {
            return cached.get().getValue();
        }
        return computeAndStore(key, ttl, callback);
    }

    @Override
    public JsonNode flexible(String key, CacheTtl ttl, Supplier<JsonNode> callback) {
        if (!ttl.isFlexible()) {
            return remember(key, ttl, callback);
        }
        Optional<CacheEntry<JsonNode>> cached = get(key);
        if (cached.isEmpty()) {
            return computeAndStore(key, ttl, callback);
        }
        CacheEntry<JsonNode> entry = cached.get();
        if (!entry.isFresh(clock.millis())) {
            refreshInBackground(key, ttl, callback);
        }
        return entry.getValue();
    }

    /**
     * Claims the right to refresh {@code key}. Only one refresh per key runs at a time.
     */
    protected abstract boolean acquireRefresh(String key);

    protected abstract void releaseRefresh(String key);

    private JsonNode computeAndStore(String key, CacheTtl ttl, Supplier<JsonNode> callback) {
        JsonNode value = callback.get();
        if (value != null) {
            put(key, value, ttl);
        }
        return value;
    }

    private void refreshInBackground(String key, CacheTtl ttl, Supplier<JsonNode> callback) {
        if (!acquireRefresh(key)) {
            return;
        }
        try {
            refreshExecutor.execute(() -> {
                try {
                    computeAndStore(key, ttl, callback);
                } catch (RuntimeException ex) {
                    log.warn("cache refresh failed key={}: {}", key, ex.getMessage());
                } finally {
                    releaseRefresh(key);
                }
            });
        } catch (RejectedExecutionException ex) {
            releaseRefresh(key);
            log.warn("cache refresh rejected key={}", key);
        }
    }
}
