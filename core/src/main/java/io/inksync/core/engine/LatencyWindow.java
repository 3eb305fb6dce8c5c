// file: core/src/main/java/io/inksync/core/engine/LatencyWindow.java
package io.inksync.core.engine;

import java.util.Arrays;

/**
 * Transform latency tracker.
 *
 * Keeps:
 *  - EWMA of latency in milliseconds,
 *  - circular buffer of recent samples for a p95 estimate,
 *  - the maximum ever observed.
 */
final class LatencyWindow {

    record Stats(double ewmaMillis, double p95Millis, double maxMillis, double lastMillis, int sampleCount) {}

    private final double alpha;
    private final double[] samples;
    private final int capacity;

    // guarded by this
    private int size;
    private int index;
    private double ewma;
    private boolean hasEwma;
    private double max;
    private double last;

    LatencyWindow(double alpha, int capacity) {
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0,1], got " + alpha);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.alpha = alpha;
        this.samples = new double[capacity];
        this.capacity = capacity;
    }

    synchronized void add(double millis) {
        if (millis < 0.0) return;

        if (!hasEwma) {
            ewma = millis;
            hasEwma = true;
        } else {
            ewma = (1.0 - alpha) * ewma + alpha * millis;
        }
        max = Math.max(max, millis);
        last = millis;

        samples[index] = millis;
        index = (index + 1) % capacity;
        if (size < capacity) {
            size++;
        }
    }

    synchronized Stats snapshot() {
        if (size == 0) {
            return new Stats(0.0, 0.0, 0.0, 0.0, 0);
        }
        double[] copy = Arrays.copyOf(samples, size);
        Arrays.sort(copy);
        return new Stats(ewma, percentile(copy, 0.95), max, last, size);
    }

    private static double percentile(double[] sorted, double q) {
        double idx = q * (sorted.length - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted[lo];
        double w = idx - lo;
        return sorted[lo] * (1.0 - w) + sorted[hi] * w;
    }
}
