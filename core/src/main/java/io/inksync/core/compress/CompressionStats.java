// file: core/src/main/java/io/inksync/core/compress/CompressionStats.java
package io.inksync.core.compress;

/**
 * @param compressionRatio compressed / original, 1.0 for an empty input
 */
public record CompressionStats(
        int originalCount,
        int compressedCount,
        int savedOperations,
        double compressionRatio
) {
    public static CompressionStats of(int originalCount, int compressedCount) {
        if (compressedCount > originalCount) {
            throw new IllegalArgumentException("compressed count cannot exceed original count");
        }
        double ratio = originalCount == 0 ? 1.0 : (double) compressedCount / originalCount;
        return new CompressionStats(originalCount, compressedCount, originalCount - compressedCount, ratio);
    }
}
