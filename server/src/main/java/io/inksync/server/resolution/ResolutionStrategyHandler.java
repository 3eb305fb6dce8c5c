// file: server/src/main/java/io/inksync/server/resolution/ResolutionStrategyHandler.java
package io.inksync.server.resolution;

import io.inksync.core.Operation;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.engine.TransformContext;

import java.util.Optional;

/**
 * One pluggable resolution procedure.
 * <p>
 * Contract (apply-or-discard):
 *  - resolve() only reads the conflict and the context; it never mutates either.
 *  - It returns the operation that settles the conflict, or empty when it cannot.
 *  - A thrown exception counts as a failed attempt; nothing has been applied.
 */
public interface ResolutionStrategyHandler {

    ResolutionStrategy strategy();

    /** Whether this handler can meaningfully resolve the conflict at all. */
    boolean supports(Conflict conflict);

    Optional<Operation> resolve(Conflict conflict, TransformContext context);
}
