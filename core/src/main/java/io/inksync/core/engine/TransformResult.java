// file: core/src/main/java/io/inksync/core/engine/TransformResult.java
package io.inksync.core.engine;

import io.inksync.core.Operation;
import io.inksync.core.conflict.Conflict;

import java.util.List;

/**
 * Output of {@link TransformEngine#transformOperation}.
 *
 * @param transformedOperation the queued copy (element id assigned, Lamport possibly lifted)
 * @param queuePosition        causal position in the pending queue at insertion time
 * @param conflicts            conflicts newly detected for this operation
 * @param duplicate            the operation id was already pending; nothing was changed
 */
public record TransformResult(
        Operation transformedOperation,
        int queuePosition,
        List<Conflict> conflicts,
        PerformanceSnapshot performance,
        boolean duplicate
) {
    public TransformResult {
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
