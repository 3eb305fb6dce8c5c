// file: server/src/main/java/io/inksync/server/perf/Bottleneck.java
package io.inksync.server.perf;

import io.inksync.core.conflict.Severity;

import java.util.Objects;

/**
 * One threshold crossed by a performance snapshot.
 *
 * @param value     observed value, in the unit of the kind (ms, MB, entries, ratio)
 * @param threshold the limit that was exceeded
 */
public record Bottleneck(Kind kind, Severity severity, double value, double threshold, String description) {

    public enum Kind { LATENCY, MEMORY, QUEUE, CONFLICT_RATE }

    public Bottleneck {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
    }
}
