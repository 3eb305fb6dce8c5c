// file: core/src/main/java/io/inksync/core/predict/Prediction.java
package io.inksync.core.predict;

import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Advisory forecast of a conflict that has not happened yet.
 */
public record Prediction(
        String id,
        ConflictType type,
        double probability,
        Severity estimatedSeverity,
        List<String> affectedUsers,
        List<String> affectedElements,
        PreventionStrategy prevention,
        long createdAtMillis
) {
    public Prediction {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(estimatedSeverity, "estimatedSeverity");
        Objects.requireNonNull(prevention, "prevention");
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("probability must be in [0,1], got " + probability);
        }
        affectedUsers = affectedUsers.stream().distinct().sorted().toList();
        affectedElements = affectedElements.stream().distinct().sorted().toList();
    }
}
