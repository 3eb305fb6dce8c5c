// file: core/src/main/java/io/inksync/core/engine/TransformOutcome.java
package io.inksync.core.engine;

import java.util.List;

/**
 * Per-operation result of a batch: either accepted or rejected, never dropped.
 */
public sealed interface TransformOutcome {

    String operationId();

    record Accepted(TransformResult result) implements TransformOutcome {
        @Override
        public String operationId() {
            return result.transformedOperation().id();
        }
    }

    record Rejected(String operationId, List<String> violations) implements TransformOutcome {
        public Rejected {
            violations = List.copyOf(violations);
        }
    }
}
