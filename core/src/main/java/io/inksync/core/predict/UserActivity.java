// file: core/src/main/java/io/inksync/core/predict/UserActivity.java
package io.inksync.core.predict;

import io.inksync.core.Bounds;
import io.inksync.core.Point;

import java.util.Objects;

/**
 * Latest live signal from one user: cursor, viewport and focused element.
 * Ephemeral; only ever used for advisory predictions.
 *
 * @param viewport         may be null
 * @param focusedElementId may be null
 */
public record UserActivity(
        String userId,
        Point cursor,
        Bounds viewport,
        String focusedElementId,
        long observedAtMillis
) {
    public UserActivity {
        Objects.requireNonNull(userId, "userId");
        if (userId.isBlank()) throw new IllegalArgumentException("userId must not be blank");
    }
}
