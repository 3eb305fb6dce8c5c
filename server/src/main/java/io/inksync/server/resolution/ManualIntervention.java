// file: server/src/main/java/io/inksync/server/resolution/ManualIntervention.java
package io.inksync.server.resolution;

import io.inksync.core.Operation;
import io.inksync.core.conflict.Conflict;

import java.util.Objects;

/**
 * A conflict waiting for (or settled by) a human decision.
 *
 * @param recommendation analysis at request time, may be null
 * @param resolvedBy     user who settled it, null while pending
 * @param resolution     operation chosen by the reviewer, may be null even when completed
 */
public record ManualIntervention(
        String id,
        Conflict conflict,
        ResolutionRecommendation recommendation,
        Status status,
        long requestedAtMillis,
        String resolvedBy,
        Operation resolution,
        Long closedAtMillis
) {

    public enum Status { PENDING, COMPLETED, EXPIRED }

    public ManualIntervention {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(conflict, "conflict");
        Objects.requireNonNull(status, "status");
    }

    static String idFor(String conflictId) {
        return "mi-" + conflictId;
    }

    static ManualIntervention pending(Conflict conflict, ResolutionRecommendation recommendation, long now) {
        return new ManualIntervention(idFor(conflict.id()), conflict, recommendation, Status.PENDING,
                now, null, null, null);
    }

    ManualIntervention completed(String by, Operation chosen, long now) {
        return new ManualIntervention(id, conflict, recommendation, Status.COMPLETED, requestedAtMillis,
                by, chosen, now);
    }

    ManualIntervention expired(long now) {
        return new ManualIntervention(id, conflict, recommendation, Status.EXPIRED, requestedAtMillis,
                null, null, now);
    }
}
