// file: core/src/main/java/io/inksync/core/VectorClockTracker.java
package io.inksync.core;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-whiteboard causality tracker.
 * <p>
 * Responsibilities:
 *  - Keep the last known merged clock of every open whiteboard.
 *  - increment(): advance one user's own counter on top of that clock.
 *  - observe(): fold a received operation's clock into it.
 * <p>
 * merge/compare are pure. The only stored state is the per-whiteboard clock,
 * updated atomically through {@link ConcurrentHashMap#compute}. Clocks never
 * decrease: every update is a merge.
 */
public final class VectorClockTracker {

    private final ConcurrentHashMap<String, VectorClock> clocks = new ConcurrentHashMap<>();

    /**
     * Advance {@code userId}'s counter on the whiteboard and return the new clock.
     * A user's first operation initializes their component to 1.
     */
    public VectorClock increment(String whiteboardId, String userId) {
        Objects.requireNonNull(whiteboardId, "whiteboardId");
        Objects.requireNonNull(userId, "userId");
        return clocks.compute(whiteboardId, (id, current) ->
                (current == null ? VectorClock.empty() : current).bump(userId));
    }

    /**
     * Merge a received clock into the whiteboard's running clock.
     *
     * @return the merged clock now stored for the whiteboard
     */
    public VectorClock observe(String whiteboardId, VectorClock received) {
        Objects.requireNonNull(whiteboardId, "whiteboardId");
        Objects.requireNonNull(received, "received");
        return clocks.merge(whiteboardId, received, VectorClock::merge);
    }

    /** Last known clock of the whiteboard, empty if nothing was observed yet. */
    public VectorClock current(String whiteboardId) {
        return clocks.getOrDefault(whiteboardId, VectorClock.empty());
    }

    /** Drop state for a whiteboard whose session ended. */
    public void forget(String whiteboardId) {
        clocks.remove(whiteboardId);
    }

    public ClockMetrics metrics(String whiteboardId) {
        return ClockMetrics.of(current(whiteboardId));
    }

    public static VectorClock merge(VectorClock a, VectorClock b) {
        return a.merge(b);
    }

    public static CausalOrder compare(VectorClock a, VectorClock b) {
        return a.compare(b);
    }
}
