// file: storage/src/main/java/io/inksync/storage/AuditRecord.java
package io.inksync.storage;

import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.conflict.Severity;

import java.util.List;
import java.util.Objects;

/**
 * One immutable entry of the conflict audit trail.
 * <p>
 * Records are append-only; a conflict's history is the sequence of records
 * sharing its id. Analytics are derived purely from these records.
 *
 * @param strategy         strategy used or recommended, null when not applicable
 * @param resolutionMillis time from detection to this record, null unless the record closes the conflict
 * @param automatic        true when the engine acted without a human
 * @param detail           free-form note (failure reason, resolver, ...), may be null
 */
public record AuditRecord(
        String conflictId,
        String whiteboardId,
        AuditAction action,
        ConflictType conflictType,
        Severity severity,
        List<String> userIds,
        List<String> operationIds,
        ResolutionStrategy strategy,
        Long resolutionMillis,
        boolean automatic,
        String detail,
        long timestampMillis
) {

    public AuditRecord {
        Objects.requireNonNull(conflictId, "conflictId");
        Objects.requireNonNull(whiteboardId, "whiteboardId");
        Objects.requireNonNull(action, "action");
        userIds = userIds == null ? List.of() : List.copyOf(userIds);
        operationIds = operationIds == null ? List.of() : List.copyOf(operationIds);
        if (resolutionMillis != null && resolutionMillis < 0) {
            throw new IllegalArgumentException("resolutionMillis must be >= 0");
        }
    }

    /**
     * Record about {@code conflict}; resolution time is filled in for terminal actions.
     */
    public static AuditRecord of(Conflict conflict,
                                 AuditAction action,
                                 ResolutionStrategy strategy,
                                 boolean automatic,
                                 String detail,
                                 long nowMillis) {
        Long took = action.isTerminal() ? Math.max(0L, nowMillis - conflict.detectedAtMillis()) : null;
        return new AuditRecord(
                conflict.id(),
                conflict.whiteboardId(),
                action,
                conflict.type(),
                conflict.severity(),
                List.copyOf(conflict.involvedUsers()),
                conflict.operationIds(),
                strategy,
                took,
                automatic,
                detail,
                nowMillis
        );
    }
}
