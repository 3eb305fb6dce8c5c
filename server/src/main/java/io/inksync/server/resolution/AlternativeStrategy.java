// file: server/src/main/java/io/inksync/server/resolution/AlternativeStrategy.java
package io.inksync.server.resolution;

import io.inksync.core.conflict.ResolutionStrategy;

import java.util.Objects;

/**
 * A strategy the service may fall back to if the recommended one fails.
 */
public record AlternativeStrategy(ResolutionStrategy strategy, double confidence, String description) {
    public AlternativeStrategy {
        Objects.requireNonNull(strategy, "strategy");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
    }
}
