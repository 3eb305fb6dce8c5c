// file: core/src/main/java/io/inksync/core/engine/AdaptiveThrottle.java
package io.inksync.core.engine;

/**
 * Recommended inbound operation rate for one whiteboard.
 * <p>
 * The core does not enforce it; the transport layer reads it from the
 * performance snapshot and applies its own backpressure. Each adjustment
 * multiplies the rate: x0.8 while latency is above target, x1.1 otherwise,
 * clamped to [MIN_RATE, MAX_RATE].
 */
public final class AdaptiveThrottle {

    public static final double MIN_RATE = 10.0;
    public static final double MAX_RATE = 10_000.0;

    private final long targetLatencyMillis;
    private boolean enabled = true;
    private double opsPerSecond = 1_000.0;

    AdaptiveThrottle(long targetLatencyMillis) {
        this.targetLatencyMillis = targetLatencyMillis;
    }

    void adjust(double latencyEwmaMillis) {
        if (!enabled) {
            return;
        }
        if (latencyEwmaMillis > targetLatencyMillis) {
            opsPerSecond = Math.max(MIN_RATE, opsPerSecond * 0.8);
        } else {
            opsPerSecond = Math.min(MAX_RATE, opsPerSecond * 1.1);
        }
    }

    public boolean enabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double recommendedOpsPerSecond() {
        return opsPerSecond;
    }

    public long targetLatencyMillis() {
        return targetLatencyMillis;
    }
}
