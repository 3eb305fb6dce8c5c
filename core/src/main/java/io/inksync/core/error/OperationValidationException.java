// file: core/src/main/java/io/inksync/core/error/OperationValidationException.java
package io.inksync.core.error;

import java.util.List;

/**
 * A single operation is structurally malformed.
 * <p>
 * Only the offending operation is rejected; other operations of the same batch
 * or session are unaffected.
 */
public final class OperationValidationException extends InkSyncException {

    private final String operationId;
    private final List<String> violations;

    public OperationValidationException(String operationId, List<String> violations) {
        super("operation " + operationId + " rejected: " + String.join("; ", violations));
        this.operationId = operationId;
        this.violations = List.copyOf(violations);
    }

    /** May be null when the operation carried no id at all. */
    public String operationId() {
        return operationId;
    }

    public List<String> violations() {
        return violations;
    }
}
