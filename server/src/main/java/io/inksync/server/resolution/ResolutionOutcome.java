// file: server/src/main/java/io/inksync/server/resolution/ResolutionOutcome.java
package io.inksync.server.resolution;

import io.inksync.core.Operation;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.error.ResolutionException;

import java.util.List;
import java.util.Optional;

/**
 * Result of {@link ConflictResolutionService#resolveConflictAutomatically}.
 * Never thrown; failures are described by {@code error}.
 *
 * @param resolution      operation that settles the conflict, null unless successful
 * @param strategy        strategy that produced the resolution, null unless successful
 * @param attemptHistory  one line per strategy attempt, in order
 * @param error           why no resolution was produced, null on success and on cancellation
 */
public record ResolutionOutcome(
        String conflictId,
        boolean success,
        Operation resolution,
        ResolutionStrategy strategy,
        boolean requiresManualIntervention,
        ResolutionException error,
        List<String> attemptHistory,
        boolean cancelled,
        ResolutionState state
) {
    public ResolutionOutcome {
        attemptHistory = List.copyOf(attemptHistory);
    }

    static ResolutionOutcome resolved(String conflictId, Operation resolution, ResolutionStrategy strategy,
                                      List<String> history) {
        return new ResolutionOutcome(conflictId, true, resolution, strategy, false, null, history,
                false, ResolutionState.RESOLVED_AUTOMATIC);
    }

    static ResolutionOutcome manual(String conflictId, ResolutionException error, List<String> history,
                                    ResolutionState state) {
        return new ResolutionOutcome(conflictId, false, null, null, true, error, history, false, state);
    }

    static ResolutionOutcome cancelled(String conflictId, List<String> history) {
        return new ResolutionOutcome(conflictId, false, null, null, false, null, history,
                true, ResolutionState.DETECTED);
    }

    public Optional<Operation> resolutionOperation() {
        return Optional.ofNullable(resolution);
    }

    public int attempts() {
        return attemptHistory.size();
    }
}
