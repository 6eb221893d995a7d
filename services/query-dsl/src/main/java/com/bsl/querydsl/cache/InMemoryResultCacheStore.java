package com.bsl.querydsl.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

public class InMemoryResultCacheStore extends AbstractResultCacheStore {
    private final ConcurrentHashMap<String, CacheEntry<JsonNode>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> order = new ConcurrentLinkedQueue<>();
    private final Set<String> refreshing = ConcurrentHashMap.newKeySet();
    private final int maxEntries;

    public InMemoryResultCacheStore(int maxEntries, Clock clock, Executor refreshExecutor) {
        super(clock, refreshExecutor);
        this.maxEntries = Math.max(1, maxEntries);
    }

    @Override
    public Optional<CacheEntry<JsonNode>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<JsonNode> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            if (entries.remove(key, entry)) {
                order.remove(key);
            }
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(String key, JsonNode value, CacheTtl ttl) {
        if (key == null || value == null || ttl == null) {
            return;
        }
        // re-puts keep their original insertion slot
        if (entries.put(key, CacheEntry.create(value, clock.millis(), ttl)) == null) {
            order.add(key);
        }
        evictIfNeeded();
    }

    @Override
    public void forget(String key) {
        if (key != null && entries.remove(key) != null) {
            order.remove(key);
        }
    }

    public int size() {
        return entries.size();
    }

    int trackedKeyCount() {
        return order.size();
    }

    @Override
    protected boolean acquireRefresh(String key) {
        return refreshing.add(key);
    }

    @Override
    protected void releaseRefresh(String key) {
        refreshing.remove(key);
    }

    private void evictIfNeeded() {
        while (entries.size() > maxEntries) {
            String key = order.poll();
            if (key == null) {
                break;
            }
            entries.remove(key);
        }
    }
}
