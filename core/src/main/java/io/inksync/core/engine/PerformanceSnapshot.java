// file: core/src/main/java/io/inksync/core/engine/PerformanceSnapshot.java
package io.inksync.core.engine;

/**
 * Point-in-time performance view of one whiteboard's pipeline.
 * <p>
 * queueSize and operationThroughput are what external backpressure policy
 * is expected to key on; recommendedOpsPerSecond is the adaptive throttle's hint.
 */
public record PerformanceSnapshot(
        long operationCount,
        double lastLatencyMillis,
        double averageLatencyMillis,
        double p95LatencyMillis,
        double maxLatencyMillis,
        double conflictRate,
        double resolutionSuccessRate,
        double operationThroughput,
        int queueSize,
        int activeConflicts,
        int activeUsers,
        double recommendedOpsPerSecond,
        long memoryUsedMb,
        long timestampMillis
) {}
