// file: core/src/main/java/io/inksync/core/conflict/ResolutionStrategy.java
package io.inksync.core.conflict;

/**
 * Named procedures for resolving a conflict.
 * <p>
 * MANUAL is never executed automatically; it routes the conflict to a human.
 * AUTOMATIC lets the service pick whichever automatic strategy applies.
 */
public enum ResolutionStrategy {
    AUTOMATIC, MANUAL, MERGE, LAST_WRITER_WINS, PRIORITY_USER, SPATIAL_OFFSET;

    public boolean isAutomatic() {
        return this != MANUAL;
    }
}
