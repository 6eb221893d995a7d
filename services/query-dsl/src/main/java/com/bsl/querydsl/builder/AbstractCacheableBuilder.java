package com.bsl.querydsl.builder;

import com.bsl.querydsl.cache.CacheDescriptor;
import com.bsl.querydsl.cache.CacheKeyUtil;
import com.bsl.querydsl.cache.CacheTtl;
import com.bsl.querydsl.cache.CacheableQuery;
import com.bsl.querydsl.cache.CachedQuery;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Cache settings shared by the single and multi search builders. {@link #execute()} goes
 * through {@link CachedQuery} when caching is enabled for this builder.
 */
public abstract class AbstractCacheableBuilder<B extends AbstractCacheableBuilder<B>> implements CacheableQuery {
    protected final QueryContext context;
    protected CacheDescriptor cacheDescriptor = new CacheDescriptor();

    protected AbstractCacheableBuilder(QueryContext context) {
        this.context = context == null ? QueryContext.empty() : context;
    }

    protected abstract B self();

    public B cache() {
        return setCacheEnabled(true);
    }

    public B clearCache() {
        return setCacheClear(true);
    }

    public B setCacheEnabled(boolean enabled) {
        cacheDescriptor.setEnabled(enabled);
        return self();
    }

    public B setCacheClear(boolean clear) {
        cacheDescriptor.setClear(clear);
        return self();
    }

    public B setCacheTtl(CacheTtl ttl) {
        cacheDescriptor.setTtl(ttl);
        return self();
    }

    public B setCachePrefix(String prefix) {
        cacheDescriptor.setPrefix(prefix);
        return self();
    }

    public B setCacheStore(String store) {
        cacheDescriptor.setStore(store);
        return self();
    }

    public boolean isCacheEnabled() {
        return cacheDescriptor.isEnabled(context.getCacheDefaults());
    }

    public boolean getCacheClear() {
        return cacheDescriptor.isClear();
    }

    public CacheTtl getCacheTtl() {
        return cacheDescriptor.resolveTtl(context.getCacheDefaults());
    }

    public String getCachePrefix() {
        return cacheDescriptor.resolvePrefix(context.getCacheDefaults());
    }

    public String getCacheStore() {
        return cacheDescriptor.resolveStore(context.getCacheDefaults());
    }

    public String getCacheKey() {
        return CacheKeyUtil.buildKey(getCachePrefix(), getIndexNames(), build());
    }

    @Override
    public CacheDescriptor getCacheDescriptor() {
        return cacheDescriptor;
    }

    public QueryContext getContext() {
        return context;
    }

    @Override
    public JsonNode execute() {
        if (!isCacheEnabled()) {
            return executeUncached();
        }
        return new CachedQuery(this, context.requireCacheManager()).execute();
    }
}
