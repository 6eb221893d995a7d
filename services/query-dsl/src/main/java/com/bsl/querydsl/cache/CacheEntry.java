package com.bsl.querydsl.cache;

public class CacheEntry<V> {
    private final V value;
    private final long createdAt;
    private final long freshUntil;
    private final long expiresAt;

    public CacheEntry(V value, long createdAt, long freshUntil, long expiresAt) {
        this.value = value;
        this.createdAt = createdAt;
        this.freshUntil = freshUntil;
        this.expiresAt = expiresAt;
    }

    public static <V> CacheEntry<V> create(V value, long now, CacheTtl ttl) {
        return new CacheEntry<>(value, now, now + ttl.getFresh().toMillis(), now + ttl.getLifetime().toMillis());
    }

    public V getValue() {
        return value;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getFreshUntil() {
        return freshUntil;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean isFresh(long now) {
        return now <= freshUntil;
    }

    public boolean isExpired(long now) {
        return now > expiresAt;
    }
}
