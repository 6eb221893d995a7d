package com.bsl.querydsl.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Lifetime of a cached search result. A single duration keeps the value fresh until it
 * expires. A fresh/stale pair keeps it fresh for {@code fresh}, then serves it as stale
 * (refreshing in the background) until {@code stale} has elapsed since it was stored.
 */
public final class CacheTtl {
    private final Duration fresh;
    private final Duration stale;

    private CacheTtl(Duration fresh, Duration stale) {
        this.fresh = fresh;
        this.stale = stale;
    }

    public static CacheTtl of(Duration ttl) {
        requirePositive(ttl, "ttl");
        return new CacheTtl(ttl, null);
    }

    public static CacheTtl ofSeconds(long seconds) {
        return of(Duration.ofSeconds(seconds));
    }

    public static CacheTtl flexible(Duration fresh, Duration stale) {
        requirePositive(fresh, "fresh");
        requirePositive(stale, "stale");
        if (stale.compareTo(fresh) <= 0) {
            throw new IllegalArgumentException("stale ttl must be longer than fresh ttl");
        }
        return new CacheTtl(fresh, stale);
    }

    public static CacheTtl flexibleSeconds(long freshSeconds, long staleSeconds) {
        return flexible(Duration.ofSeconds(freshSeconds), Duration.ofSeconds(staleSeconds));
    }

    public Duration getFresh() {
        return fresh;
    }

    public Duration getStale() {
        return stale;
    }

    public boolean isFlexible() {
        return stale != null;
    }

    public Duration getLifetime() {
        return stale == null ? fresh : stale;
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheTtl)) {
            return false;
        }
        CacheTtl other = (CacheTtl) o;
        return fresh.equals(other.fresh) && Objects.equals(stale, other.stale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fresh, stale);
    }

    @Override
    public String toString() {
        return stale == null ? "CacheTtl[" + fresh + "]" : "CacheTtl[" + fresh + ", " + stale + "]";
    }
}
