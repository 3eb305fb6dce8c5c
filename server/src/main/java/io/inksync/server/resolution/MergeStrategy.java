// file: server/src/main/java/io/inksync/server/resolution/MergeStrategy.java
package io.inksync.server.resolution;

import io.inksync.core.Bounds;
import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.engine.TransformContext;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Unions the payload fields of all operations into one update.
 * Fields written by several operations take the last writer's value.
 * <p>
 * Only semantic and temporal conflicts on a single element qualify; an
 * operation that creates or deletes the element cannot be merged.
 */
public final class MergeStrategy implements ResolutionStrategyHandler {

    @Override
    public ResolutionStrategy strategy() {
        return ResolutionStrategy.MERGE;
    }

    @Override
    public boolean supports(Conflict conflict) {
        return (conflict.type() == ConflictType.SEMANTIC || conflict.type() == ConflictType.TEMPORAL)
                && !conflict.touchesExistence()
                && conflict.affectedElementIds().size() == 1;
    }

    @Override
    public Optional<Operation> resolve(Conflict conflict, TransformContext context) {
        if (!supports(conflict)) {
            return Optional.empty();
        }
        var merged = new LinkedHashMap<String, Object>();
        Bounds bounds = null;
        for (Operation op : conflict.operations()) {
            merged.putAll(op.payload());
            if (op.bounds() != null) {
                bounds = op.bounds();
            }
        }
        return Optional.of(ResolutionOperations.build(conflict, strategy(), OperationType.UPDATE,
                conflict.affectedElementIds().get(0), merged, bounds));
    }
}
