// file: server/src/main/java/io/inksync/server/dto/EngineConfigJson.java
package io.inksync.server.dto;

import java.util.Map;

/**
 * JSON shape of the engine configuration file. Every section and field is
 * optional; absent values keep their defaults.
 * {
 *   "resolution": {
 *     "automaticResolutionEnabled": true,
 *     "maxAutomaticResolutionAttempts": 3,
 *     "conflictTimeoutMs": 30000,
 *     "minAutomaticConfidence": 0.5,
 *     "strategyByType": { "spatial": "spatial_offset", "compound": "manual" }
 *   },
 *   "performance": { "maxLatencyMs": 500, "maxMemoryMb": 1024, "maxQueueSize": 1000, "targetLatencyMs": 50 },
 *   "detection":   { "spatialOverlapThresholdPercent": 10, "temporalWindowMs": 1000, ... },
 *   "compression": { "enabled": true, "maxRunLength": 1000, "triggerQueueSize": 256 },
 *   "prediction":  { "proximityThresholdPx": 100, "periodMs": 250, ... }
 * }
 */
public class EngineConfigJson {

    public ResolutionSection resolution;
    public PerformanceSection performance;
    public DetectionSection detection;
    public CompressionSection compression;
    public PredictionSection prediction;

    public static class ResolutionSection {
        public Boolean automaticResolutionEnabled;
        public Integer maxAutomaticResolutionAttempts;
        public Long conflictTimeoutMs;
        public Double minAutomaticConfidence;
        public Map<String, String> strategyByType;   // conflict type -> strategy, case-insensitive
    }

    public static class PerformanceSection {
        public Long maxLatencyMs;
        public Long maxMemoryMb;
        public Integer maxQueueSize;
        public Long targetLatencyMs;
    }

    public static class DetectionSection {
        public Double spatialOverlapThresholdPercent;
        public Long temporalWindowMs;
        public Long simultaneityMs;
        public Long recencyWindowMs;
        public Integer recencyWindowMaxOperations;
        public Integer maxConflictHistory;
    }

    public static class CompressionSection {
        public Boolean enabled;
        public Integer maxRunLength;
        public Integer triggerQueueSize;
    }

    public static class PredictionSection {
        public Double proximityThresholdPx;
        public Long temporalWindowMs;
        public Long activityTtlMs;
        public Long periodMs;
        public Integer cacheCapacity;
    }
}
