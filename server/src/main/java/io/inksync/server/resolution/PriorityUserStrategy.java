// file: server/src/main/java/io/inksync/server/resolution/PriorityUserStrategy.java
package io.inksync.server.resolution;

import io.inksync.core.Operation;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.engine.TransformContext;

import java.util.Optional;

/**
 * The operation whose author carries the highest priority weight in the context wins.
 * When the top weight is shared, the last writer among the tied authors wins.
 */
public final class PriorityUserStrategy implements ResolutionStrategyHandler {

    @Override
    public ResolutionStrategy strategy() {
        return ResolutionStrategy.PRIORITY_USER;
    }

    @Override
    public boolean supports(Conflict conflict) {
        return true;
    }

    @Override
    public Optional<Operation> resolve(Conflict conflict, TransformContext context) {
        Operation winner = null;
        double best = Double.NEGATIVE_INFINITY;
        // operations are in Lamport order, so >= lets the later writer take a tie
        for (Operation op : conflict.operations()) {
            double weight = context.userPriority(op.userId());
            if (weight >= best) {
                best = weight;
                winner = op;
            }
        }
        return Optional.of(ResolutionOperations.adopt(conflict, strategy(), winner));
    }
}
