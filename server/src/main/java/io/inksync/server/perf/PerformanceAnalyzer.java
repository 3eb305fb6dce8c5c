// file: server/src/main/java/io/inksync/server/perf/PerformanceAnalyzer.java
package io.inksync.server.perf;

import io.inksync.core.EngineSettings;
import io.inksync.core.conflict.Severity;
import io.inksync.core.engine.PerformanceSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Compares a whiteboard's performance snapshot against the configured limits.
 * <p>
 * Current behavior:
 *  - latency: average above {@link #LATENCY_WARN_MS} is MEDIUM, above maxLatencyMs is HIGH.
 *  - memory: heap above half of maxMemoryMb is MEDIUM, above maxMemoryMb is HIGH.
 *  - queue: pending operations above half of maxQueueSize is MEDIUM, at maxQueueSize is HIGH.
 *  - conflict rate: above 0.1 is MEDIUM, above 0.3 is HIGH.
 * Each bottleneck contributes one recommendation; duplicates are dropped.
 */
public final class PerformanceAnalyzer {

    static final double LATENCY_WARN_MS = 200.0;
    static final double CONFLICT_RATE_WARN = 0.1;
    static final double CONFLICT_RATE_HIGH = 0.3;

    private PerformanceAnalyzer() {
    }

    public static PerformanceReport analyze(PerformanceSnapshot s, EngineSettings.Performance limits) {
        var found = new ArrayList<Bottleneck>();

        double latency = s.averageLatencyMillis();
        if (latency > limits.maxLatencyMs()) {
            found.add(new Bottleneck(Bottleneck.Kind.LATENCY, Severity.HIGH, latency, limits.maxLatencyMs(),
                    String.format("average latency %.1f ms exceeds %d ms", latency, limits.maxLatencyMs())));
        } else if (latency > LATENCY_WARN_MS) {
            found.add(new Bottleneck(Bottleneck.Kind.LATENCY, Severity.MEDIUM, latency, LATENCY_WARN_MS,
                    String.format("average latency %.1f ms above %.0f ms", latency, LATENCY_WARN_MS)));
        }

        double memory = s.memoryUsedMb();
        if (memory > limits.maxMemoryMb()) {
            found.add(new Bottleneck(Bottleneck.Kind.MEMORY, Severity.HIGH, memory, limits.maxMemoryMb(),
                    "heap use " + s.memoryUsedMb() + " MB exceeds " + limits.maxMemoryMb() + " MB"));
        } else if (memory > limits.maxMemoryMb() / 2.0) {
            found.add(new Bottleneck(Bottleneck.Kind.MEMORY, Severity.MEDIUM, memory, limits.maxMemoryMb() / 2.0,
                    "heap use " + s.memoryUsedMb() + " MB above half of " + limits.maxMemoryMb() + " MB"));
        }

        int queue = s.queueSize();
        if (queue >= limits.maxQueueSize()) {
            found.add(new Bottleneck(Bottleneck.Kind.QUEUE, Severity.HIGH, queue, limits.maxQueueSize(),
                    "pending queue full (" + queue + "/" + limits.maxQueueSize() + ")"));
        } else if (queue > limits.maxQueueSize() / 2.0) {
            found.add(new Bottleneck(Bottleneck.Kind.QUEUE, Severity.MEDIUM, queue, limits.maxQueueSize() / 2.0,
                    "pending queue above half capacity (" + queue + "/" + limits.maxQueueSize() + ")"));
        }

        double rate = s.conflictRate();
        if (rate > CONFLICT_RATE_HIGH) {
            found.add(new Bottleneck(Bottleneck.Kind.CONFLICT_RATE, Severity.HIGH, rate, CONFLICT_RATE_HIGH,
                    String.format("conflict rate %.2f above %.2f", rate, CONFLICT_RATE_HIGH)));
        } else if (rate > CONFLICT_RATE_WARN) {
            found.add(new Bottleneck(Bottleneck.Kind.CONFLICT_RATE, Severity.MEDIUM, rate, CONFLICT_RATE_WARN,
                    String.format("conflict rate %.2f above %.2f", rate, CONFLICT_RATE_WARN)));
        }

        var recommendations = new LinkedHashSet<String>();
        for (Bottleneck b : found) {
            recommendations.add(recommendationFor(b.kind()));
        }
        return new PerformanceReport(s, found, List.copyOf(recommendations));
    }

    private static String recommendationFor(Bottleneck.Kind kind) {
        return switch (kind) {
            case LATENCY -> "throttle clients to the recommended rate and compress the pending queue more often";
            case MEMORY -> "lower prediction.cacheCapacity and detection.maxConflictHistory";
            case QUEUE -> "acknowledge operations sooner or lower compression.triggerQueueSize";
            case CONFLICT_RATE -> "enable conflict prediction feedback so clients avoid contested regions";
        };
    }
}
