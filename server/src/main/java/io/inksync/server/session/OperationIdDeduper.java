// file: server/src/main/java/io/inksync/server/session/OperationIdDeduper.java
package io.inksync.server.session;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL-bounded memory of accepted operation ids.
 * <p>
 * Semantics:
 *  - isDuplicate(id) is true while the id was remembered less than the TTL ago.
 *  - remember(id) starts (or restarts) the TTL for the id.
 * <p>
 * Implementation notes:
 *  - Backed by a ConcurrentHashMap of id -> expireAtMillis.
 *  - Lazy cleanup: each remember() scans a few entries and drops expired ones,
 *    so there is no background thread and memory stays bounded under steady load.
 *  - Complements the engine's own check against the pending queue: ids that were
 *    already acknowledged and committed are still caught here.
 */
public final class OperationIdDeduper {

    private static final int CLEANUP_SCAN_LIMIT = 64;

    private final Map<String, Long> seen = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile long ttlMillis;

    public OperationIdDeduper(Duration ttl, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        setTtl(ttl);
    }

    public boolean isDuplicate(String operationId) {
        Objects.requireNonNull(operationId, "operationId");
        Long expireAt = seen.get(operationId);
        return expireAt != null && expireAt >= clock.millis();
    }

    public void remember(String operationId) {
        Objects.requireNonNull(operationId, "operationId");
        long now = clock.millis();
        seen.put(operationId, now + ttlMillis);
        cleanup(now);
    }

    public void setTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.ttlMillis = ttl.toMillis();
    }

    int size() {
        return seen.size();
    }

    private void cleanup(long now) {
        int scanned = 0;
        for (var it = seen.entrySet().iterator(); it.hasNext() && scanned < CLEANUP_SCAN_LIMIT; scanned++) {
            var e = it.next();
            if (e.getValue() < now) {
                it.remove();
            }
        }
    }
}
