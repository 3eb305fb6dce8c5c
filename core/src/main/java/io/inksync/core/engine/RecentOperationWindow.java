// file: core/src/main/java/io/inksync/core/engine/RecentOperationWindow.java
package io.inksync.core.engine;

import io.inksync.core.Operation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding window of recently accepted operations, bounded by age and count.
 * <p>
 * The conflict detector only ever scans this window, which keeps detection
 * O(window) per operation instead of O(history). Age is measured by server
 * arrival time; client emission timestamps are advisory and not trusted here.
 */
final class RecentOperationWindow {

    private record Arrival(Operation op, long arrivedAtMillis) {}

    private final long windowMillis;
    private final int maxOperations;
    private final ArrayDeque<Arrival> arrivals = new ArrayDeque<>();

    RecentOperationWindow(long windowMillis, int maxOperations) {
        this.windowMillis = windowMillis;
        this.maxOperations = maxOperations;
    }

    void add(Operation op, long nowMillis) {
        arrivals.addLast(new Arrival(op, nowMillis));
        evict(nowMillis);
    }

    List<Operation> operations(long nowMillis) {
        evict(nowMillis);
        var out = new ArrayList<Operation>(arrivals.size());
        for (Arrival a : arrivals) {
            out.add(a.op());
        }
        return out;
    }

    int size() {
        return arrivals.size();
    }

    private void evict(long nowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!arrivals.isEmpty()
                && (arrivals.peekFirst().arrivedAtMillis() < cutoff || arrivals.size() > maxOperations)) {
            arrivals.pollFirst();
        }
    }
}
