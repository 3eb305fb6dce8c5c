// file: server/src/main/java/io/inksync/server/resolution/AutomaticStrategy.java
package io.inksync.server.resolution;

import io.inksync.core.Operation;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.engine.TransformContext;

import java.util.Optional;

/**
 * Picks a concrete strategy by conflict type: spatial conflicts are offset,
 * semantic ones merged, everything else falls to last-writer-wins.
 */
public final class AutomaticStrategy implements ResolutionStrategyHandler {

    private final SpatialOffsetStrategy offset = new SpatialOffsetStrategy();
    private final MergeStrategy merge = new MergeStrategy();
    private final LastWriterWinsStrategy lastWriter = new LastWriterWinsStrategy();

    @Override
    public ResolutionStrategy strategy() {
        return ResolutionStrategy.AUTOMATIC;
    }

    @Override
    public boolean supports(Conflict conflict) {
        return true;
    }

    @Override
    public Optional<Operation> resolve(Conflict conflict, TransformContext context) {
        ResolutionStrategyHandler delegate = switch (conflict.type()) {
            case SPATIAL -> offset.supports(conflict) ? offset : lastWriter;
            case SEMANTIC -> merge.supports(conflict) ? merge : lastWriter;
            case TEMPORAL, COMPOUND -> lastWriter;
        };
        return delegate.resolve(conflict, context);
    }
}
