// file: server/src/main/java/io/inksync/server/resolution/LastWriterWinsStrategy.java
package io.inksync.server.resolution;

import io.inksync.core.Operation;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.engine.TransformContext;

import java.util.Optional;

/**
 * The operation with the highest (lamport, userId, id) wins. Applies to every conflict type.
 */
public final class LastWriterWinsStrategy implements ResolutionStrategyHandler {

    @Override
    public ResolutionStrategy strategy() {
        return ResolutionStrategy.LAST_WRITER_WINS;
    }

    @Override
    public boolean supports(Conflict conflict) {
        return true;
    }

    @Override
    public Optional<Operation> resolve(Conflict conflict, TransformContext context) {
        Operation winner = ResolutionOperations.lastWriter(conflict.operations());
        return Optional.of(ResolutionOperations.adopt(conflict, strategy(), winner));
    }
}
