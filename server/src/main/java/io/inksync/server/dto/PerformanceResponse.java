// file: server/src/main/java/io/inksync/server/dto/PerformanceResponse.java
package io.inksync.server.dto;

import java.util.List;

/**
 * JSON response for GET /admin/whiteboards/{id}/performance.
 */
public class PerformanceResponse {
    public String whiteboardId;
    public long operationCount;
    public double averageLatencyMillis;
    public double p95LatencyMillis;
    public double maxLatencyMillis;
    public double conflictRate;
    public double resolutionSuccessRate;
    public double operationThroughput;
    public int queueSize;
    public int activeConflicts;
    public int activeUsers;
    public double recommendedOpsPerSecond;
    public long memoryUsedMb;
    public List<BottleneckView> bottlenecks;
    public List<String> recommendations;

    public static class BottleneckView {
        public String kind;
        public String severity;
        public double value;
        public double threshold;
        public String description;
    }
}
