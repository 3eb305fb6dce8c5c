package io.inksync.core.cache;

import io.inksync.core.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LruTtlCacheTest {

    private final MutableClock clock = new MutableClock(0);

    @Test
    void least_recently_used_entry_is_evicted_first() {
        var cache = new LruTtlCache<String, Integer>(2, Duration.ofSeconds(10), clock);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.get("a");
        cache.set("c", 3);

        assertEquals(Optional.empty(), cache.get("b"));
        assertEquals(Optional.of(1), cache.get("a"));
        assertEquals(List.of("c", "a"), List.copyOf(cache.snapshot().keySet()));
        assertEquals(1, cache.stats().evictions());
    }

    @Test
    void expired_entries_are_not_returned_and_can_be_swept() {
        var cache = new LruTtlCache<String, Integer>(10, Duration.ofMillis(100), clock);
        cache.set("a", 1);
        cache.set("b", 2);
        clock.advance(50);
        cache.set("c", 3);
        clock.advance(60);

        assertEquals(Optional.empty(), cache.get("a"));
        assertEquals(1, cache.sweepExpired());
        assertEquals(1, cache.size());
        assertEquals(Optional.of(3), cache.get("c"));
        assertEquals(2, cache.stats().expirations());
    }

    @Test
    void stats_count_hits_and_misses() {
        var cache = new LruTtlCache<String, Integer>(4, Duration.ofSeconds(1), clock);
        cache.set("a", 1);
        cache.get("a");
        cache.get("a");
        cache.get("zzz");

        CacheStats stats = cache.stats();
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);

        cache.invalidate("a");
        assertEquals(0, cache.size());
    }

    @Test
    void rejects_non_positive_capacity_or_ttl() {
        assertThrows(IllegalArgumentException.class, () -> new LruTtlCache<String, String>(0, Duration.ofSeconds(1), clock));
        assertThrows(IllegalArgumentException.class, () -> new LruTtlCache<String, String>(1, Duration.ZERO, clock));
    }
}
