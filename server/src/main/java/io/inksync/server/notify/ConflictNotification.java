// file: server/src/main/java/io/inksync/server/notify/ConflictNotification.java
package io.inksync.server.notify;

import io.inksync.core.conflict.ResolutionStrategy;

import java.util.List;
import java.util.Objects;

/**
 * Message to the users involved in a conflict.
 *
 * @param suggestedAlternatives strategies a reviewer may pick, empty unless kind is MANUAL_REVIEW_PENDING
 */
public record ConflictNotification(
        String conflictId,
        String whiteboardId,
        List<String> userIds,
        Kind kind,
        String message,
        List<ResolutionStrategy> suggestedAlternatives,
        long timestampMillis
) {

    public enum Kind {
        RESOLVED_AUTOMATICALLY,
        MANUAL_REVIEW_PENDING,
        MANUAL_REVIEW_COMPLETED,
        MANUAL_REVIEW_EXPIRED
    }

    public ConflictNotification {
        Objects.requireNonNull(conflictId, "conflictId");
        Objects.requireNonNull(kind, "kind");
        userIds = List.copyOf(userIds);
        suggestedAlternatives = suggestedAlternatives == null ? List.of() : List.copyOf(suggestedAlternatives);
    }
}
