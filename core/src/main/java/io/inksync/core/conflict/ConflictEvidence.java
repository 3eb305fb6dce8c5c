// file: core/src/main/java/io/inksync/core/conflict/ConflictEvidence.java
package io.inksync.core.conflict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Type-specific proof attached to a conflict.
 * <p>
 * Closed union: each conflict type has exactly one evidence shape, so resolution
 * strategies can rely on what they receive.
 */
public sealed interface ConflictEvidence {

    /**
     * @param overlapArea  intersection area in canvas units squared
     * @param overlapRatio intersection over union, in [0,1]
     */
    record SpatialEvidence(double overlapArea, double overlapRatio) implements ConflictEvidence {
        public SpatialEvidence {
            if (overlapArea < 0.0) throw new IllegalArgumentException("overlapArea must be >= 0");
            if (overlapRatio < 0.0 || overlapRatio > 1.0) {
                throw new IllegalArgumentException("overlapRatio must be in [0,1], got " + overlapRatio);
            }
        }

        public double overlapPercent() {
            return overlapRatio * 100.0;
        }
    }

    /**
     * @param deltaMillis  absolute distance between emission times
     * @param simultaneous true when deltaMillis is inside the simultaneity window
     */
    record TemporalEvidence(long deltaMillis, boolean simultaneous) implements ConflictEvidence {
        public TemporalEvidence {
            if (deltaMillis < 0) throw new IllegalArgumentException("deltaMillis must be >= 0");
        }
    }

    /**
     * Values written by the two operations, in the conflict's canonical operation order.
     */
    record FieldValues(Object first, Object second) {}

    /**
     * @param incompatibleFields fields written by both sides with different values, sorted
     * @param values             per-field pair of written values
     */
    record SemanticEvidence(List<String> incompatibleFields, Map<String, FieldValues> values)
            implements ConflictEvidence {
        public SemanticEvidence {
            incompatibleFields = List.copyOf(incompatibleFields);
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    /**
     * @param reason short description of why the parts form one conflict
     * @param parts  sub-evidence (never another CompoundEvidence)
     */
    record CompoundEvidence(String reason, List<ConflictEvidence> parts) implements ConflictEvidence {
        public CompoundEvidence {
            Objects.requireNonNull(reason, "reason");
            parts = List.copyOf(parts);
            for (var p : parts) {
                if (p instanceof CompoundEvidence) {
                    throw new IllegalArgumentException("compound evidence must not nest");
                }
            }
        }
    }
}
