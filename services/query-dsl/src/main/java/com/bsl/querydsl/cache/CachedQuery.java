package com.bsl.querydsl.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decorates a query's {@code execute} with the result cache. Disabled caching runs the
 * query directly; enabled caching optionally forgets the entry first, then reads through
 * the configured store.
 *
 * <p>The request is snapshotted once per call. The cache key and any background refresh
 * both use that snapshot, so mutating the builder afterwards cannot store one request's
 * result under another request's key.
 */
public class CachedQuery implements ExecutableQuery {
    private final CacheableQuery query;
    private final QueryCacheManager cacheManager;

    public CachedQuery(CacheableQuery query, QueryCacheManager cacheManager) {
        this.query = query;
        this.cacheManager = cacheManager;
    }

    @Override
    public JsonNode execute() {
        CacheDescriptor descriptor = query.getCacheDescriptor();
        QueryCacheDefaults defaults = cacheManager.getDefaults();
        QuerySnapshot snapshot = query.snapshot();
        if (!descriptor.isEnabled(defaults)) {
            return snapshot.execute();
        }
        ResultCacheStore store = cacheManager.store(descriptor.resolveStore(defaults));
        String key = cacheManager.cacheKey(descriptor, snapshot);
        if (descriptor.isClear()) {
            store.forget(key);
        }
        CacheTtl ttl = descriptor.resolveTtl(defaults);
        if (ttl.isFlexible()) {
            return store.flexible(key, ttl, snapshot::execute);
        }
        return store.remember(key, ttl, snapshot::execute);
    }

    public String getCacheKey() {
        return cacheManager.cacheKey(query);
    }
}
