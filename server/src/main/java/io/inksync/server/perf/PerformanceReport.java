// file: server/src/main/java/io/inksync/server/perf/PerformanceReport.java
package io.inksync.server.perf;

import io.inksync.core.conflict.Severity;
import io.inksync.core.engine.PerformanceSnapshot;

import java.util.List;

public record PerformanceReport(PerformanceSnapshot snapshot, List<Bottleneck> bottlenecks, List<String> recommendations) {

    public PerformanceReport {
        bottlenecks = List.copyOf(bottlenecks);
        recommendations = List.copyOf(recommendations);
    }

    public boolean hasHighSeverity() {
        return bottlenecks.stream().anyMatch(b -> b.severity().atLeast(Severity.HIGH));
    }
}
