// file: core/src/main/java/io/inksync/core/cache/LruTtlCache.java
package io.inksync.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * LRU cache with a per-entry TTL.
 * <p>
 * Implementation notes:
 *  - Backed by an access-ordered LinkedHashMap; the eldest entry is evicted
 *    once capacity is exceeded.
 *  - Expired entries are dropped lazily on get() and in bulk by sweepExpired(),
 *    which the owner schedules; there are no background threads in here.
 *  - All methods are synchronized; this is meant for modest capacities
 *    (cursor positions, issued predictions), not as a general-purpose cache.
 */
public final class LruTtlCache<K, V> implements BoundedCache<K, V> {

    private record Entry<V>(V value, long expireAtMillis) {}

    private final int capacity;
    private final long ttlMillis;
    private final Clock clock;

    // guarded by this
    private final LinkedHashMap<K, Entry<V>> entries;
    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public LruTtlCache(int capacity, Duration ttl, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.capacity = capacity;
        this.ttlMillis = ttl.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    @Override
    public synchronized Optional<V> get(K key) {
        Entry<V> e = entries.get(key);
        if (e == null) {
            misses++;
            return Optional.empty();
        }
        if (e.expireAtMillis() < clock.millis()) {
            entries.remove(key);
            expirations++;
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(e.value());
    }

    @Override
    public synchronized void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, new Entry<>(value, clock.millis() + ttlMillis));
        while (entries.size() > capacity) {
            Iterator<K> eldest = entries.keySet().iterator();
            eldest.next();
            eldest.remove();
            evictions++;
        }
    }

    @Override
    public synchronized void invalidate(K key) {
        entries.remove(key);
    }

    @Override
    public synchronized void invalidateAll() {
        entries.clear();
    }

    @Override
    public synchronized int sweepExpired() {
        long now = clock.millis();
        int removed = 0;
        for (var it = entries.values().iterator(); it.hasNext(); ) {
            if (it.next().expireAtMillis() < now) {
                it.remove();
                removed++;
            }
        }
        expirations += removed;
        return removed;
    }

    @Override
    public synchronized Map<K, V> snapshot() {
        long now = clock.millis();
        var out = new LinkedHashMap<K, V>();
        // Iterating the entry set does not count as access, so LRU order is preserved.
        for (var e : entries.entrySet()) {
            if (e.getValue().expireAtMillis() >= now) {
                out.put(e.getKey(), e.getValue().value());
            }
        }
        return out;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized CacheStats stats() {
        return new CacheStats(hits, misses, evictions, expirations, entries.size(), capacity);
    }
}
