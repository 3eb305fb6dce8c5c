// file: core/src/main/java/io/inksync/core/cache/CacheStats.java
package io.inksync.core.cache;

public record CacheStats(
        long hits,
        long misses,
        long evictions,
        long expirations,
        int size,
        int capacity
) {
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
