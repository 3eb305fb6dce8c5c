// file: core/src/main/java/io/inksync/core/CausalOrder.java
package io.inksync.core;

/**
 * Partial order between two vector clocks.
 * <p>
 * Interpretation for A.compare(B):
 *  - EQUAL:      A and B have identical counters.
 *  - BEFORE:     A happened-before B (every component of A is <= B, one strictly less).
 *  - AFTER:      symmetric to BEFORE.
 *  - CONCURRENT: neither dominates the other; the operations were produced
 *                without knowledge of each other.
 */
public enum CausalOrder {
    EQUAL, BEFORE, AFTER, CONCURRENT;

    /**
     * Return the "perspective" if we swap the left/right arguments.
     */
    public CausalOrder swap() {
        return switch (this) {
            case BEFORE -> AFTER;
            case AFTER -> BEFORE;
            default -> this;
        };
    }

    /** True when the two sides are causally ordered one way or the other. */
    public boolean isOrdered() {
        return this == BEFORE || this == AFTER;
    }
}
