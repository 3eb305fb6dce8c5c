// file: core/src/main/java/io/inksync/core/engine/RollingRate.java
package io.inksync.core.engine;

/**
 * Fraction of "hits" among the last N recorded events.
 *
 * Implementation:
 *  - fixed-size circular buffer of booleans,
 *  - running count of hits inside the buffer.
 */
final class RollingRate {

    private final boolean[] window;
    private final int capacity;

    // guarded by this
    private int size;
    private int index;
    private int hitCount;

    RollingRate(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.window = new boolean[capacity];
        this.capacity = capacity;
    }

    synchronized void record(boolean hit) {
        if (size == capacity && window[index]) {
            hitCount--;
        }
        window[index] = hit;
        if (hit) {
            hitCount++;
        }
        index = (index + 1) % capacity;
        if (size < capacity) {
            size++;
        }
    }

    /**
     * @param whenEmpty value reported before anything was recorded
     */
    synchronized double fraction(double whenEmpty) {
        if (size == 0) {
            return whenEmpty;
        }
        return (double) hitCount / (double) size;
    }

    synchronized int size() {
        return size;
    }
}
