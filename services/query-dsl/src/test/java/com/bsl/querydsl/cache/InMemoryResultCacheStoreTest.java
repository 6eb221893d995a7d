package com.bsl.querydsl.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InMemoryResultCacheStoreTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void rememberComputesOnceWhileFresh() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, Runnable::run);
        AtomicInteger calls = new AtomicInteger();

        JsonNode first = store.remember("k", CacheTtl.ofSeconds(60), () -> IntNode.valueOf(calls.incrementAndGet()));
        clock.advance(Duration.ofSeconds(30));
        JsonNode second = store.remember("k", CacheTtl.ofSeconds(60), () -> IntNode.valueOf(calls.incrementAndGet()));

        assertThat(first.asInt()).isEqualTo(1);
        assertThat(second.asInt()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void rememberRecomputesAfterExpiry() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, Runnable::run);
        AtomicInteger calls = new AtomicInteger();

        store.remember("k", CacheTtl.ofSeconds(60), () -> IntNode.valueOf(calls.incrementAndGet()));
        clock.advance(Duration.ofSeconds(61));
        JsonNode value = store.remember("k", CacheTtl.ofSeconds(60), () -> IntNode.valueOf(calls.incrementAndGet()));

        assertThat(value.asInt()).isEqualTo(2);
    }

    @Test
    void flexibleServesStaleValueAndRefreshesInBackground() {
        List<Runnable> pending = new ArrayList<>();
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, pending::add);
        CacheTtl ttl = CacheTtl.flexibleSeconds(300, 600);
        AtomicInteger calls = new AtomicInteger();

        store.flexible("k", ttl, () -> IntNode.valueOf(calls.incrementAndGet()));
        clock.advance(Duration.ofSeconds(400));

        JsonNode stale = store.flexible("k", ttl, () -> IntNode.valueOf(calls.incrementAndGet()));
        JsonNode staleAgain = store.flexible("k", ttl, () -> IntNode.valueOf(calls.incrementAndGet()));

        assertThat(stale.asInt()).isEqualTo(1);
        assertThat(staleAgain.asInt()).isEqualTo(1);
        assertThat(pending).hasSize(1);

        pending.get(0).run();

        assertThat(calls.get()).isEqualTo(2);
        assertThat(store.flexible("k", ttl, () -> IntNode.valueOf(99)).asInt()).isEqualTo(2);
    }

    @Test
    void flexibleRecomputesSynchronouslyAfterStaleWindow() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, Runnable::run);
        CacheTtl ttl = CacheTtl.flexibleSeconds(300, 600);

        store.flexible("k", ttl, () -> IntNode.valueOf(1));
        clock.advance(Duration.ofSeconds(601));

        assertThat(store.flexible("k", ttl, () -> IntNode.valueOf(2)).asInt()).isEqualTo(2);
    }

    @Test
    void failedRefreshKeepsStaleEntry() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, Runnable::run);
        CacheTtl ttl = CacheTtl.flexibleSeconds(300, 600);
        store.flexible("k", ttl, () -> IntNode.valueOf(1));
        clock.advance(Duration.ofSeconds(400));

        JsonNode value = store.flexible("k", ttl, () -> {
            throw new IllegalStateException("backend down");
        });

        assertThat(value.asInt()).isEqualTo(1);
        assertThat(store.get("k")).isPresent();
    }

    @Test
    void rejectedRefreshReleasesLock() {
        AtomicInteger attempts = new AtomicInteger();
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, task -> {
            attempts.incrementAndGet();
            throw new RejectedExecutionException("full");
        });
        CacheTtl ttl = CacheTtl.flexibleSeconds(300, 600);
        store.flexible("k", ttl, () -> IntNode.valueOf(1));
        clock.advance(Duration.ofSeconds(400));

        store.flexible("k", ttl, () -> IntNode.valueOf(2));
        store.flexible("k", ttl, () -> IntNode.valueOf(2));

        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void nullResultIsNotStored() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, Runnable::run);

        assertThat(store.remember("k", CacheTtl.ofSeconds(60), () -> null)).isNull();
        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void forgetRemovesEntry() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, Runnable::run);
        store.put("k", IntNode.valueOf(1), CacheTtl.ofSeconds(60));

        store.forget("k");

        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void oldestEntriesAreEvictedPastCapacity() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(2, clock, Runnable::run);

        store.put("a", IntNode.valueOf(1), CacheTtl.ofSeconds(60));
        store.put("b", IntNode.valueOf(2), CacheTtl.ofSeconds(60));
        store.put("c", IntNode.valueOf(3), CacheTtl.ofSeconds(60));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get("a")).isEmpty();
        assertThat(store.get("c")).isPresent();
    }

    @Test
    void repeatedPutsOfOneKeyKeepEvictionOrderBounded() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(2, clock, Runnable::run);

        for (int i = 0; i < 1000; i++) {
            store.put("a", IntNode.valueOf(i), CacheTtl.ofSeconds(60));
        }
        store.put("b", IntNode.valueOf(2), CacheTtl.ofSeconds(60));

        assertThat(store.trackedKeyCount()).isEqualTo(2);
        assertThat(store.get("a").map(CacheEntry::getValue)).contains(IntNode.valueOf(999));

        store.put("c", IntNode.valueOf(3), CacheTtl.ofSeconds(60));

        assertThat(store.get("a")).isEmpty();
        assertThat(store.get("b")).isPresent();
        assertThat(store.get("c")).isPresent();
        assertThat(store.trackedKeyCount()).isEqualTo(2);
    }

    @Test
    void forgottenAndExpiredKeysLeaveEvictionOrder() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10, clock, Runnable::run);
        store.put("gone", IntNode.valueOf(1), CacheTtl.ofSeconds(60));
        store.put("old", IntNode.valueOf(2), CacheTtl.ofSeconds(10));

        store.forget("gone");
        clock.advance(Duration.ofSeconds(11));

        assertThat(store.get("old")).isEmpty();
        assertThat(store.size()).isZero();
        assertThat(store.trackedKeyCount()).isZero();
    }
}
