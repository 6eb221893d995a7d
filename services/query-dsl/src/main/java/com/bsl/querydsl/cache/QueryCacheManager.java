package com.bsl.querydsl.cache;

import com.bsl.querydsl.common.QueryConfigurationException;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Holds the named result stores and the cache defaults that builders inherit.
 */
public class QueryCacheManager {
    private final QueryCacheDefaults defaults;
    private final Map<String, ResultCacheStore> stores;

    public QueryCacheManager(QueryCacheDefaults defaults, Map<String, ResultCacheStore> stores) {
        this.defaults = defaults == null ? QueryCacheDefaults.none() : defaults;
        this.stores = new TreeMap<>(stores);
    }

    public QueryCacheDefaults getDefaults() {
        return defaults;
    }

    public ResultCacheStore store(String name) {
        String resolved = name == null || name.isBlank() ? defaults.getStore() : name;
        ResultCacheStore store = stores.get(resolved);
        if (store == null) {
            throw new QueryConfigurationException("Query cache store [" + resolved + "] not configured.");
        }
        return store;
    }

    public Set<String> getStoreNames() {
        return stores.keySet();
    }

    public String cacheKey(CacheableQuery query) {
        String prefix = query.getCacheDescriptor().resolvePrefix(defaults);
        return CacheKeyUtil.buildKey(prefix, query.getIndexNames(), query.build());
    }

    public String cacheKey(CacheDescriptor descriptor, QuerySnapshot snapshot) {
        return CacheKeyUtil.buildKey(descriptor.resolvePrefix(defaults), snapshot.getIndexNames(), snapshot.getBody());
    }
}
