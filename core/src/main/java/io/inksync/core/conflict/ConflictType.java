// file: core/src/main/java/io/inksync/core/conflict/ConflictType.java
package io.inksync.core.conflict;

/**
 * Classification of a collision between operations from different users.
 *  - SPATIAL:  different elements whose bounds overlap beyond the threshold.
 *  - TEMPORAL: same element, near-simultaneous, no field collision.
 *  - SEMANTIC: same element, same field, different values.
 *  - COMPOUND: several sub-conflicts at once, e.g. delete vs. update.
 */
public enum ConflictType {
    SPATIAL, TEMPORAL, SEMANTIC, COMPOUND
}
