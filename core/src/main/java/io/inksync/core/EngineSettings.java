// file: core/src/main/java/io/inksync/core/EngineSettings.java
package io.inksync.core;

import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.error.ConfigurationException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Every tunable of the engine, grouped by concern.
 * <p>
 * Each section validates itself in its compact constructor and throws
 * {@link ConfigurationException} naming the offending key, so a bad
 * configuration fails at startup rather than during editing.
 */
public record EngineSettings(
        Resolution resolution,
        Performance performance,
        Detection detection,
        Compression compression,
        Prediction prediction
) {

    public EngineSettings {
        require(resolution != null, "resolution", "section missing");
        require(performance != null, "performance", "section missing");
        require(detection != null, "detection", "section missing");
        require(compression != null, "compression", "section missing");
        require(prediction != null, "prediction", "section missing");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                Resolution.defaults(),
                Performance.defaults(),
                Detection.defaults(),
                Compression.defaults(),
                Prediction.defaults()
        );
    }

    public EngineSettings withResolution(Resolution r) {
        return new EngineSettings(r, performance, detection, compression, prediction);
    }

    public EngineSettings withDetection(Detection d) {
        return new EngineSettings(resolution, performance, d, compression, prediction);
    }

    public EngineSettings withCompression(Compression c) {
        return new EngineSettings(resolution, performance, detection, c, prediction);
    }

    public EngineSettings withPerformance(Performance p) {
        return new EngineSettings(resolution, p, detection, compression, prediction);
    }

    /**
     * @param minAutomaticConfidence below this the analyzer recommends MANUAL
     * @param strategyByType         default strategy per conflict type
     */
    public record Resolution(
            boolean automaticResolutionEnabled,
            int maxAutomaticResolutionAttempts,
            long conflictTimeoutMs,
            double minAutomaticConfidence,
            Map<ConflictType, ResolutionStrategy> strategyByType
    ) {
        public Resolution {
            require(maxAutomaticResolutionAttempts >= 1, "resolution.maxAutomaticResolutionAttempts", "must be >= 1");
            require(maxAutomaticResolutionAttempts <= 10, "resolution.maxAutomaticResolutionAttempts", "must be <= 10");
            require(conflictTimeoutMs > 0, "resolution.conflictTimeoutMs", "must be > 0");
            require(minAutomaticConfidence >= 0.0 && minAutomaticConfidence <= 1.0,
                    "resolution.minAutomaticConfidence", "must be in [0,1]");
            require(strategyByType != null, "resolution.strategyByType", "must be present");
            var full = new EnumMap<ConflictType, ResolutionStrategy>(defaultStrategies());
            full.putAll(strategyByType);
            strategyByType = Map.copyOf(full);
        }

        public static Resolution defaults() {
            return new Resolution(true, 3, 30_000, 0.5, defaultStrategies());
        }

        public Resolution withAutomaticResolutionEnabled(boolean enabled) {
            return new Resolution(enabled, maxAutomaticResolutionAttempts, conflictTimeoutMs,
                    minAutomaticConfidence, strategyByType);
        }

        public Resolution withMaxAutomaticResolutionAttempts(int attempts) {
            return new Resolution(automaticResolutionEnabled, attempts, conflictTimeoutMs,
                    minAutomaticConfidence, strategyByType);
        }

        private static Map<ConflictType, ResolutionStrategy> defaultStrategies() {
            var m = new EnumMap<ConflictType, ResolutionStrategy>(ConflictType.class);
            m.put(ConflictType.SPATIAL, ResolutionStrategy.SPATIAL_OFFSET);
            m.put(ConflictType.TEMPORAL, ResolutionStrategy.LAST_WRITER_WINS);
            m.put(ConflictType.SEMANTIC, ResolutionStrategy.LAST_WRITER_WINS);
            m.put(ConflictType.COMPOUND, ResolutionStrategy.MANUAL);
            return m;
        }
    }

    /**
     * @param targetLatencyMs latency the adaptive throttle steers toward
     */
    public record Performance(
            long maxLatencyMs,
            long maxMemoryMb,
            int maxQueueSize,
            long targetLatencyMs
    ) {
        public Performance {
            require(maxLatencyMs > 0, "performance.maxLatencyMs", "must be > 0");
            require(maxMemoryMb > 0, "performance.maxMemoryMb", "must be > 0");
            require(maxQueueSize > 0, "performance.maxQueueSize", "must be > 0");
            require(targetLatencyMs > 0 && targetLatencyMs <= maxLatencyMs,
                    "performance.targetLatencyMs", "must be in (0, maxLatencyMs]");
        }

        public static Performance defaults() {
            return new Performance(500, 1024, 1000, 50);
        }
    }

    /**
     * @param spatialOverlapThresholdPercent minimum intersection-over-union, in percent
     * @param simultaneityMs                 temporal conflicts closer than this are flagged simultaneous
     * @param recencyWindowMs                how far back the detector looks
     * @param recencyWindowMaxOperations     hard cap on operations kept in the window
     */
    public record Detection(
            double spatialOverlapThresholdPercent,
            long temporalWindowMs,
            long simultaneityMs,
            long recencyWindowMs,
            int recencyWindowMaxOperations,
            int maxConflictHistory
    ) {
        public Detection {
            require(spatialOverlapThresholdPercent > 0.0 && spatialOverlapThresholdPercent <= 100.0,
                    "detection.spatialOverlapThresholdPercent", "must be in (0,100]");
            require(temporalWindowMs > 0, "detection.temporalWindowMs", "must be > 0");
            require(simultaneityMs >= 0 && simultaneityMs <= temporalWindowMs,
                    "detection.simultaneityMs", "must be in [0, temporalWindowMs]");
            require(recencyWindowMs > 0, "detection.recencyWindowMs", "must be > 0");
            require(recencyWindowMaxOperations > 0, "detection.recencyWindowMaxOperations", "must be > 0");
            require(maxConflictHistory > 0, "detection.maxConflictHistory", "must be > 0");
        }

        public static Detection defaults() {
            return new Detection(10.0, 1_000, 100, 5_000, 512, 500);
        }

        public double spatialOverlapThreshold() {
            return spatialOverlapThresholdPercent / 100.0;
        }
    }

    /**
     * @param maxRunLength     most submitted operations a single compressed operation may stand for
     * @param triggerQueueSize pending-queue depth at which the engine compresses automatically
     */
    public record Compression(
            boolean enabled,
            int maxRunLength,
            int triggerQueueSize
    ) {
        public Compression {
            require(maxRunLength >= 1, "compression.maxRunLength", "must be >= 1");
            require(triggerQueueSize >= 1, "compression.triggerQueueSize", "must be >= 1");
        }

        public static Compression defaults() {
            return new Compression(true, 1_000, 256);
        }
    }

    public record Prediction(
            double proximityThresholdPx,
            long temporalWindowMs,
            long activityTtlMs,
            long periodMs,
            int cacheCapacity
    ) {
        public Prediction {
            require(proximityThresholdPx > 0.0, "prediction.proximityThresholdPx", "must be > 0");
            require(temporalWindowMs > 0, "prediction.temporalWindowMs", "must be > 0");
            require(activityTtlMs > 0, "prediction.activityTtlMs", "must be > 0");
            require(periodMs > 0, "prediction.periodMs", "must be > 0");
            require(cacheCapacity > 0, "prediction.cacheCapacity", "must be > 0");
        }

        public static Prediction defaults() {
            return new Prediction(100.0, 1_000, 5_000, 250, 1_024);
        }
    }

    private static void require(boolean condition, String key, String message) {
        if (!condition) {
            throw new ConfigurationException(key, message);
        }
    }
}
