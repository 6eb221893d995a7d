package com.bsl.querydsl.cache;

/**
 * Per-builder cache settings. Unset fields inherit from {@link QueryCacheDefaults}.
 */
public class CacheDescriptor {
    private Boolean enabled;
    private boolean clear;
    private CacheTtl ttl;
    private String prefix;
    private String store;

    public CacheDescriptor copy() {
        CacheDescriptor copy = new CacheDescriptor();
        copy.enabled = enabled;
        copy.clear = clear;
        copy.ttl = ttl;
        copy.prefix = prefix;
        copy.store = store;
        return copy;
    }

    public boolean isEnabled(QueryCacheDefaults defaults) {
        return enabled == null ? defaults.isEnabled() : enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isClear() {
        return clear;
    }

    public void setClear(boolean clear) {
        this.clear = clear;
    }

    public CacheTtl resolveTtl(QueryCacheDefaults defaults) {
        return ttl == null ? defaults.getTtl() : ttl;
    }

    public void setTtl(CacheTtl ttl) {
        this.ttl = ttl;
    }

    public String resolvePrefix(QueryCacheDefaults defaults) {
        return prefix == null ? defaults.getPrefix() : prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public String resolveStore(QueryCacheDefaults defaults) {
        return store == null ? defaults.getStore() : store;
    }

    public void setStore(String store) {
        this.store = store;
    }
}
