// file: server/src/main/java/io/inksync/server/resolution/TimeRange.java
package io.inksync.server.resolution;

/**
 * Half-open interval [fromMillis, toMillis) of epoch milliseconds.
 */
public record TimeRange(long fromMillis, long toMillis) {

    public TimeRange {
        if (toMillis < fromMillis) {
            throw new IllegalArgumentException("toMillis must be >= fromMillis");
        }
    }

    public static TimeRange all() {
        return new TimeRange(Long.MIN_VALUE, Long.MAX_VALUE);
    }

    public boolean contains(long millis) {
        return millis >= fromMillis && millis < toMillis;
    }
}
