// file: server/src/main/java/io/inksync/server/resolution/SpatialOffsetStrategy.java
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
 * Moves the later element horizontally until it clears the earlier one.
 * <p>
 * The earlier operation keeps its placement; the later one is shifted right by
 * the horizontal overlap plus {@link #GAP_PX}. Emits a MOVE for the shifted element.
 */
public final class SpatialOffsetStrategy implements ResolutionStrategyHandler {

    static final double GAP_PX = 10.0;

    @Override
    public ResolutionStrategy strategy() {
        return ResolutionStrategy.SPATIAL_OFFSET;
    }

    @Override
    public boolean supports(Conflict conflict) {
        if (conflict.type() != ConflictType.SPATIAL) {
            return false;
        }
        return conflict.operations().stream().allMatch(op -> op.bounds() != null && op.bounds().isFinite());
    }

    @Override
    public Optional<Operation> resolve(Conflict conflict, TransformContext context) {
        if (!supports(conflict)) {
            return Optional.empty();
        }
        Operation first = conflict.operations().get(0);
        Operation later = ResolutionOperations.lastWriter(conflict.operations());
        double dx = first.bounds().right() - later.bounds().x() + GAP_PX;
        if (dx <= 0.0) {
            return Optional.empty();
        }
        Bounds shifted = later.bounds().translate(dx, 0.0);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("x", shifted.x());
        payload.put("y", shifted.y());
        return Optional.of(ResolutionOperations.build(conflict, strategy(), OperationType.MOVE,
                later.elementId(), payload, shifted));
    }
}
