// file: core/src/main/java/io/inksync/core/Operation.java
package io.inksync.core;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An atomic, idempotent edit intent on one whiteboard element.
 * <p>
 * Semantics:
 *  - vectorClock is the author's causal view at emission time; it is the
 *    authoritative ordering signal.
 *  - lamportTimestamp only breaks ties between concurrent operations.
 *  - emittedAtMillis is the client's wall clock and is advisory only.
 *  - compressedFrom counts how many submitted operations this one stands for
 *    (1 unless produced by the compressor).
 * <p>
 * Operations are immutable once created. Adjustments (a positional Lamport lift,
 * an assigned element id, a merged payload) produce annotated copies via the
 * {@code withX} methods. The constructor does not reject missing fields so that
 * malformed submissions can reach the validator and be reported as a whole.
 */
public record Operation(
        String id,
        OperationType type,
        String elementId,
        String userId,
        VectorClock vectorClock,
        long lamportTimestamp,
        long version,
        Map<String, Object> payload,
        Bounds bounds,
        List<String> parentIds,
        long emittedAtMillis,
        int compressedFrom
) {

    /**
     * Deterministic total order used wherever clocks are concurrent:
     * lower Lamport first, then lower user id, then lower operation id.
     */
    public static final Comparator<Operation> LAMPORT_ORDER = Comparator
            .comparingLong(Operation::lamportTimestamp)
            .thenComparing(Operation::userId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Operation::id, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Operation {
        // LinkedHashMap keeps insertion order and tolerates null field values (field cleared).
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        parentIds = parentIds == null ? List.of() : List.copyOf(parentIds);
        if (compressedFrom < 1) {
            throw new IllegalArgumentException("compressedFrom must be >= 1, got " + compressedFrom);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).type(type).elementId(elementId).userId(userId)
                .vectorClock(vectorClock).lamportTimestamp(lamportTimestamp).version(version)
                .payload(payload).bounds(bounds).parentIds(parentIds)
                .emittedAtMillis(emittedAtMillis).compressedFrom(compressedFrom);
    }

    public Operation withElementId(String newElementId) {
        return toBuilder().elementId(newElementId).build();
    }

    public Operation withLamportTimestamp(long newLamport) {
        return toBuilder().lamportTimestamp(newLamport).build();
    }

    public Operation withBounds(Bounds newBounds) {
        return toBuilder().bounds(newBounds).build();
    }

    /** True for create/delete, which change the element's existence. */
    public boolean changesExistence() {
        return type != null && type.changesExistence();
    }

    public static final class Builder {
        private String id;
        private OperationType type;
        private String elementId;
        private String userId;
        private VectorClock vectorClock = VectorClock.empty();
        private long lamportTimestamp;
        private long version;
        private Map<String, Object> payload = Map.of();
        private Bounds bounds;
        private List<String> parentIds = List.of();
        private long emittedAtMillis;
        private int compressedFrom = 1;

        private Builder() {
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder type(OperationType type) { this.type = type; return this; }
        public Builder elementId(String elementId) { this.elementId = elementId; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder vectorClock(VectorClock vectorClock) { this.vectorClock = vectorClock; return this; }
        public Builder lamportTimestamp(long lamportTimestamp) { this.lamportTimestamp = lamportTimestamp; return this; }
        public Builder version(long version) { this.version = version; return this; }
        public Builder payload(Map<String, Object> payload) { this.payload = payload; return this; }
        public Builder bounds(Bounds bounds) { this.bounds = bounds; return this; }
        public Builder parentIds(List<String> parentIds) { this.parentIds = parentIds; return this; }
        public Builder emittedAtMillis(long emittedAtMillis) { this.emittedAtMillis = emittedAtMillis; return this; }
        public Builder compressedFrom(int compressedFrom) { this.compressedFrom = compressedFrom; return this; }

        public Operation build() {
            return new Operation(id, type, elementId, userId, vectorClock, lamportTimestamp, version,
                    payload, bounds, parentIds, emittedAtMillis, compressedFrom);
        }
    }
}
