// file: storage/src/main/java/io/inksync/storage/AuditAction.java
package io.inksync.storage;

/** What happened to a conflict at the time of an audit record. */
public enum AuditAction {
    CONFLICT_DETECTED,
    RESOLUTION_SUCCEEDED,
    RESOLUTION_FAILED,
    MANUAL_INTERVENTION_REQUESTED,
    MANUAL_INTERVENTION_COMPLETED,
    MANUAL_INTERVENTION_EXPIRED;

    /** True for the actions that close a conflict's lifecycle. */
    public boolean isTerminal() {
        return this == RESOLUTION_SUCCEEDED || this == MANUAL_INTERVENTION_COMPLETED;
    }
}
