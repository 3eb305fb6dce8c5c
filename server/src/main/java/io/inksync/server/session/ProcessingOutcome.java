// file: server/src/main/java/io/inksync/server/session/ProcessingOutcome.java
package io.inksync.server.session;

import io.inksync.core.engine.TransformResult;
import io.inksync.server.resolution.ResolutionOutcome;

import java.util.List;

/**
 * What happened to one submitted operation.
 */
public sealed interface ProcessingOutcome {

    String operationId();

    /**
     * Queued and checked for conflicts.
     *
     * @param resolutions one entry per conflict the operation raised, in detection order
     */
    record Accepted(TransformResult result, List<ResolutionOutcome> resolutions) implements ProcessingOutcome {
        public Accepted {
            resolutions = List.copyOf(resolutions);
        }

        @Override
        public String operationId() {
            return result.transformedOperation().id();
        }
    }

    record Rejected(String operationId, List<String> violations) implements ProcessingOutcome {
        public Rejected {
            violations = List.copyOf(violations);
        }
    }

    /** Already accepted recently; nothing was changed. */
    record Duplicate(String operationId) implements ProcessingOutcome {}
}
