// file: core/src/main/java/io/inksync/core/ClockMetrics.java
package io.inksync.core;

/**
 * Health summary of one whiteboard's merged clock.
 *
 * @param totalEvents           sum of all user counters
 * @param activeUsers           number of users with a non-zero counter
 * @param clockSkew             max counter minus min counter
 * @param synchronizationHealth 1 - skew/max, in [0,1]; 1.0 for an empty clock
 */
public record ClockMetrics(
        long totalEvents,
        int activeUsers,
        int clockSkew,
        double synchronizationHealth
) {
    static ClockMetrics of(VectorClock clock) {
        var values = clock.entries().values();
        if (values.isEmpty()) {
            return new ClockMetrics(0, 0, 0, 1.0);
        }
        int max = values.stream().mapToInt(Integer::intValue).max().orElse(0);
        int min = values.stream().mapToInt(Integer::intValue).min().orElse(0);
        int skew = max - min;
        double health = max == 0 ? 1.0 : 1.0 - (double) skew / max;
        return new ClockMetrics(clock.totalEvents(), values.size(), skew, health);
    }
}
