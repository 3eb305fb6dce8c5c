// file: core/src/main/java/io/inksync/core/engine/PerformanceMetrics.java
package io.inksync.core.engine;

/**
 * Rolling performance counters of one transform context.
 * <p>
 * Latency and rates are thread-safe so the admin surface may read them while
 * the whiteboard's worker writes; the counters below are only written by that worker.
 */
final class PerformanceMetrics {

    private static final int WINDOW = 256;
    private static final long MB = 1024L * 1024L;

    private final LatencyWindow latency = new LatencyWindow(0.2, WINDOW);
    private final RollingRate conflictRate = new RollingRate(WINDOW);
    private final RollingRate resolutionRate = new RollingRate(WINDOW);

    private volatile long operationCount;
    private volatile long firstOperationAtMillis = -1;
    private volatile long lastOperationAtMillis = -1;

    void recordOperation(double latencyMillis, boolean conflicted, long nowMillis) {
        latency.add(latencyMillis);
        conflictRate.record(conflicted);
        operationCount++;
        if (firstOperationAtMillis < 0) {
            firstOperationAtMillis = nowMillis;
        }
        lastOperationAtMillis = nowMillis;
    }

    void recordResolution(boolean success) {
        resolutionRate.record(success);
    }

    double latencyEwmaMillis() {
        return latency.snapshot().ewmaMillis();
    }

    PerformanceSnapshot snapshot(int queueSize, int activeConflicts, int activeUsers,
                                 double recommendedRate, long nowMillis) {
        var lat = latency.snapshot();
        long count = operationCount;
        double throughput = 0.0;
        if (count > 0) {
            long elapsed = Math.max(1_000L, lastOperationAtMillis - firstOperationAtMillis);
            throughput = count * 1_000.0 / elapsed;
        }
        Runtime rt = Runtime.getRuntime();
        long usedMb = (rt.totalMemory() - rt.freeMemory()) / MB;
        return new PerformanceSnapshot(
                count,
                lat.lastMillis(),
                lat.ewmaMillis(),
                lat.p95Millis(),
                lat.maxMillis(),
                conflictRate.fraction(0.0),
                resolutionRate.fraction(1.0),
                throughput,
                queueSize,
                activeConflicts,
                activeUsers,
                recommendedRate,
                usedMb,
                nowMillis
        );
    }
}
