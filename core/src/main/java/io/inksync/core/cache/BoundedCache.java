// file: core/src/main/java/io/inksync/core/cache/BoundedCache.java
package io.inksync.core.cache;

import java.util.Map;
import java.util.Optional;

/**
 * Size- and age-bounded key/value store.
 * <p>
 * Contract:
 *  - get() never returns an entry older than the TTL, expired or not swept yet.
 *  - set() may evict the least recently used entry to stay within capacity.
 *  - sweepExpired() is the only bulk cleanup; callers schedule it explicitly.
 */
public interface BoundedCache<K, V> {

    Optional<V> get(K key);

    void set(K key, V value);

    void invalidate(K key);

    void invalidateAll();

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    int sweepExpired();

    /** Live (non-expired) entries, least recently used first. */
    Map<K, V> snapshot();

    int size();

    CacheStats stats();
}
