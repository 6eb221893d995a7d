package com.bsl.querydsl.cache;

import com.bsl.querydsl.config.QueryDslProperties;

public class QueryCacheDefaults {
    public static final String MEMORY_STORE = "memory";
    public static final String REDIS_STORE = "redis";

    private final boolean enabled;
    private final CacheTtl ttl;
    private final String prefix;
    private final String store;

    public QueryCacheDefaults(boolean enabled, CacheTtl ttl, String prefix, String store) {
        this.enabled = enabled;
        this.ttl = ttl;
        this.prefix = prefix == null ? "" : prefix;
        this.store = store == null || store.isBlank() ? MEMORY_STORE : store;
    }

    public static QueryCacheDefaults none() {
        return new QueryCacheDefaults(false, CacheTtl.flexibleSeconds(300, 600), "", MEMORY_STORE);
    }

    public static QueryCacheDefaults from(QueryDslProperties.Cache cache) {
        CacheTtl ttl = cache.getStaleTtlSeconds() > cache.getFreshTtlSeconds()
            ? CacheTtl.flexibleSeconds(cache.getFreshTtlSeconds(), cache.getStaleTtlSeconds())
            : CacheTtl.ofSeconds(cache.getFreshTtlSeconds());
        return new QueryCacheDefaults(cache.isEnabled(), ttl, cache.getPrefix(), cache.getStore());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public CacheTtl getTtl() {
        return ttl;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getStore() {
        return store;
    }
}
