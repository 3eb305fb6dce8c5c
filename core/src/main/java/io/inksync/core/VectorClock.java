// file: core/src/main/java/io/inksync/core/VectorClock.java
package io.inksync.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable vector clock: a mapping from userId -> counter, one per whiteboard.
 * <p>
 * This is the causal metadata every operation carries. It is used to:
 *  - decide whether one operation happened-before another, and
 *  - detect concurrent edits that may conflict.
 * <p>
 * Design:
 *  - Immutable: internal map is copied and wrapped as unmodifiable.
 *  - Value object: equals/hashCode based purely on contents, missing entries are 0.
 *  - Thread safe by construction (no internal mutation).
 */
public final class VectorClock {

    private static final VectorClock EMPTY = new VectorClock(Map.of());

    // Internal representation is an unmodifiable copy without zero entries.
    private final Map<String, Integer> vv;

    /**
     * Create a new vector clock from the provided entries.
     * Negative counters are rejected; zero counters are dropped.
     */
    public VectorClock(Map<String, Integer> vv) {
        var copy = new HashMap<String, Integer>();
        for (var e : vv.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new IllegalArgumentException("vector clock entries must not be null");
            }
            if (e.getValue() < 0) {
                throw new IllegalArgumentException("counter for " + e.getKey() + " must be >= 0");
            }
            if (e.getValue() > 0) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        this.vv = Collections.unmodifiableMap(copy);
    }

    /** Empty clock. */
    public static VectorClock empty() { return EMPTY; }

    /** Convenience for tests and fixtures: {@code VectorClock.of("u1", 1, "u2", 3)}. */
    public static VectorClock of(Object... userAndCounter) {
        if (userAndCounter.length % 2 != 0) {
            throw new IllegalArgumentException("expected user/counter pairs");
        }
        var m = new HashMap<String, Integer>();
        for (int i = 0; i < userAndCounter.length; i += 2) {
            m.put((String) userAndCounter[i], (Integer) userAndCounter[i + 1]);
        }
        return new VectorClock(m);
    }

    /** Current entries (read-only view). */
    public Map<String, Integer> entries() { return vv; }

    /** Counter for {@code userId}, 0 when absent. */
    public int get(String userId) {
        return vv.getOrDefault(userId, 0);
    }

    /**
     * Return a new VectorClock where {@code userId}'s counter is incremented by 1.
     * If the user is not present yet, it is treated as 0 and becomes 1.
     */
    public VectorClock bump(String userId) {
        var m = new HashMap<>(vv);
        m.merge(userId, 1, Integer::sum);
        return new VectorClock(m);
    }

    /** Element-wise maximum of the two clocks. */
    public VectorClock merge(VectorClock other) {
        if (other.vv.isEmpty()) return this;
        if (vv.isEmpty()) return other;
        var m = new HashMap<>(vv);
        other.vv.forEach((id, cnt) -> m.merge(id, cnt, Math::max));
        return new VectorClock(m);
    }

    /**
     * Compare this clock (A) to another clock (B) under the standard vector-clock order.
     * <p>
     * Missing entries are treated as 0:
     *  - A <= B elementwise and A != B: A happened BEFORE B.
     *  - A >= B elementwise and A != B: A happened AFTER B.
     *  - both A > B somewhere and B > A somewhere: CONCURRENT.
     */
    public CausalOrder compare(VectorClock other) {
        boolean aGreater = false;
        boolean bGreater = false;

        var ids = new HashSet<String>(vv.keySet());
        ids.addAll(other.vv.keySet());

        for (var id : ids) {
            int a = vv.getOrDefault(id, 0);
            int b = other.vv.getOrDefault(id, 0);
            if (a > b) aGreater = true;
            if (a < b) bGreater = true;
            if (aGreater && bGreater) return CausalOrder.CONCURRENT;
        }

        if (!aGreater && !bGreater) return CausalOrder.EQUAL;
        if (aGreater) return CausalOrder.AFTER;
        return CausalOrder.BEFORE;
    }

    /** Sum of all counters: the number of events this clock has observed. */
    public long totalEvents() {
        long sum = 0;
        for (int c : vv.values()) sum += c;
        return sum;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorClock vc)) return false;
        return vv.equals(vc.vv);
    }

    @Override public int hashCode() { return vv.hashCode(); }

    @Override public String toString() { return new TreeMap<>(vv).toString(); }
}
