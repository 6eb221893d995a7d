package com.bsl.querydsl.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import java.util.function.Supplier;

public interface ResultCacheStore {

    /**
     * Returns the stored entry while it has not expired, fresh or stale.
     */
    Optional<CacheEntry<JsonNode>> get(String key);

    void put(String key, JsonNode value, CacheTtl ttl);

    void forget(String key);

    /**
     * Returns the cached value or computes, stores and returns it.
     */
    JsonNode remember(String key, CacheTtl ttl, Supplier<JsonNode> callback);

    /**
     * Like {@link #remember} but a stale value is returned immediately while a refresh
     * runs in the background.
     */
    JsonNode flexible(String key, CacheTtl ttl, Supplier<JsonNode> callback);
}
