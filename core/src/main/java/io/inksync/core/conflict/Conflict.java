// file: core/src/main/java/io/inksync/core/conflict/Conflict.java
package io.inksync.core.conflict;

import io.inksync.core.Operation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A detected collision between two or more operations from different users.
 * <p>
 * Invariants:
 *  - at least two operations, from at least two distinct users;
 *  - operations are stored in canonical {@link Operation#LAMPORT_ORDER};
 *  - evidence matches the type (compound conflicts carry CompoundEvidence, etc.).
 * <p>
 * Immutable; {@link #resolved} returns an annotated copy.
 *
 * @param strategy       strategy that resolved the conflict, null while unresolved
 * @param resolvedAtMillis null while unresolved
 */
public record Conflict(
        String id,
        String whiteboardId,
        ConflictType type,
        Severity severity,
        List<Operation> operations,
        List<String> affectedElementIds,
        ConflictEvidence evidence,
        ResolutionStrategy strategy,
        long detectedAtMillis,
        Long resolvedAtMillis
) {

    public Conflict {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(evidence, "evidence");
        operations = operations.stream().sorted(Operation.LAMPORT_ORDER).toList();
        affectedElementIds = affectedElementIds.stream().distinct().sorted().toList();
        if (operations.size() < 2) {
            throw new IllegalArgumentException("a conflict needs at least two operations");
        }
        if (operations.stream().map(Operation::userId).distinct().count() < 2) {
            throw new IllegalArgumentException("a conflict needs operations from different users");
        }
        boolean evidenceMatches = switch (type) {
            case SPATIAL -> evidence instanceof ConflictEvidence.SpatialEvidence;
            case TEMPORAL -> evidence instanceof ConflictEvidence.TemporalEvidence;
            case SEMANTIC -> evidence instanceof ConflictEvidence.SemanticEvidence;
            case COMPOUND -> evidence instanceof ConflictEvidence.CompoundEvidence;
        };
        if (!evidenceMatches) {
            throw new IllegalArgumentException(type + " conflict cannot carry " + evidence.getClass().getSimpleName());
        }
    }

    /** Order-independent key of an operation pair. */
    public static String pairKey(String opIdA, String opIdB) {
        return opIdA.compareTo(opIdB) <= 0 ? opIdA + "|" + opIdB : opIdB + "|" + opIdA;
    }

    public Set<String> involvedUsers() {
        var users = new LinkedHashSet<String>();
        for (var op : operations) users.add(op.userId());
        return users;
    }

    public List<String> operationIds() {
        return operations.stream().map(Operation::id).toList();
    }

    public boolean touchesExistence() {
        return operations.stream().anyMatch(Operation::changesExistence);
    }

    public boolean isResolved() {
        return resolvedAtMillis != null;
    }

    public Conflict resolved(ResolutionStrategy by, long atMillis) {
        return new Conflict(id, whiteboardId, type, severity, operations, affectedElementIds,
                evidence, by, detectedAtMillis, atMillis);
    }
}
