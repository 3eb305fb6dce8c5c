// file: server/src/main/java/io/inksync/server/resolution/ResolutionOperations.java
package io.inksync.server.resolution;

import io.inksync.core.Bounds;
import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.VectorClock;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ResolutionStrategy;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the operation a strategy emits to settle a conflict.
 * <p>
 * Implementation notes:
 *  - The resolution is authored by {@link #SYSTEM_USER} and causally follows every
 *    operation in the conflict: its clock is their merge bumped for the system user,
 *    its Lamport stamp and version are one past the maximum.
 *  - Its id is derived from the conflict id and the strategy so a retry yields the same id.
 */
final class ResolutionOperations {

    static final String SYSTEM_USER = "system";

    private ResolutionOperations() {
    }

    static Operation build(Conflict conflict, ResolutionStrategy strategy, OperationType type,
                           String elementId, Map<String, Object> payload, Bounds bounds) {
        VectorClock clock = VectorClock.empty();
        long lamport = 0;
        long version = 0;
        long emittedAt = 0;
        for (Operation op : conflict.operations()) {
            clock = clock.merge(op.vectorClock());
            lamport = Math.max(lamport, op.lamportTimestamp());
            version = Math.max(version, op.version());
            emittedAt = Math.max(emittedAt, op.emittedAtMillis());
        }
        return Operation.builder()
                .id("resolution:" + conflict.id() + ":" + strategy.name().toLowerCase(Locale.ROOT))
                .type(type)
                .elementId(elementId)
                .userId(SYSTEM_USER)
                .vectorClock(clock.bump(SYSTEM_USER))
                .lamportTimestamp(lamport + 1)
                .version(version + 1)
                .payload(payload)
                .bounds(bounds)
                .parentIds(conflict.operationIds())
                .emittedAtMillis(emittedAt)
                .build();
    }

    /** Re-issue {@code winner}'s intent as the resolution of the conflict. */
    static Operation adopt(Conflict conflict, ResolutionStrategy strategy, Operation winner) {
        return build(conflict, strategy, winner.type(), winner.elementId(), winner.payload(), winner.bounds());
    }

    /** The last operation in (lamport, user, id) order. */
    static Operation lastWriter(List<Operation> ops) {
        return ops.get(ops.size() - 1);
    }
}
