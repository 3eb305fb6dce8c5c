// file: server/src/main/java/io/inksync/server/resolution/ResolutionRecommendation.java
package io.inksync.server.resolution;

import io.inksync.core.conflict.ResolutionStrategy;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link ConflictAnalyzer#analyze}.
 *
 * @param confidence               in [0,1]; how likely the strategy yields an acceptable result
 * @param estimatedResolutionMillis rough cost of running the strategy
 * @param alternatives             other applicable automatic strategies, most confident first
 */
public record ResolutionRecommendation(
        String conflictId,
        ResolutionStrategy strategy,
        double confidence,
        String reasoning,
        long estimatedResolutionMillis,
        RiskLevel risk,
        List<AlternativeStrategy> alternatives
) {
    public ResolutionRecommendation {
        Objects.requireNonNull(conflictId, "conflictId");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(risk, "risk");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
        alternatives = List.copyOf(alternatives);
    }

    public boolean recommendsManual() {
        return strategy == ResolutionStrategy.MANUAL;
    }
}
