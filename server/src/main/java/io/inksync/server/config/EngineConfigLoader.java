// file: server/src/main/java/io/inksync/server/config/EngineConfigLoader.java
package io.inksync.server.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import io.inksync.core.EngineSettings;
import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.error.ConfigurationException;
import io.inksync.server.dto.EngineConfigJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads {@link EngineSettings} from a JSON file.
 * <p>
 * Rules:
 *  - Missing sections and fields keep the values of {@link EngineSettings#defaults()}.
 *  - Unknown properties and malformed values fail fast with a
 *    {@link ConfigurationException} naming the offending key.
 *  - Range checks are the ones of the {@link EngineSettings} records.
 */
public final class EngineConfigLoader {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    public EngineSettings load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("config", "file not found: " + path);
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new ConfigurationException("config", "cannot read " + path, e);
        }
    }

    public EngineSettings parse(String json) {
        EngineConfigJson cfg;
        try {
            cfg = mapper.readValue(json, EngineConfigJson.class);
        } catch (UnrecognizedPropertyException e) {
            throw new ConfigurationException(keyOf(e), "unknown property", e);
        } catch (JsonMappingException e) {
            throw new ConfigurationException(keyOf(e), "invalid value: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("config", "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (cfg == null) {
            return EngineSettings.defaults();
        }
        return toSettings(cfg);
    }

    static EngineSettings toSettings(EngineConfigJson cfg) {
        EngineSettings d = EngineSettings.defaults();
        return new EngineSettings(
                resolution(cfg.resolution, d.resolution()),
                performance(cfg.performance, d.performance()),
                detection(cfg.detection, d.detection()),
                compression(cfg.compression, d.compression()),
                prediction(cfg.prediction, d.prediction())
        );
    }

    private static EngineSettings.Resolution resolution(EngineConfigJson.ResolutionSection s,
                                                        EngineSettings.Resolution d) {
        if (s == null) return d;
        return new EngineSettings.Resolution(
                or(s.automaticResolutionEnabled, d.automaticResolutionEnabled()),
                or(s.maxAutomaticResolutionAttempts, d.maxAutomaticResolutionAttempts()),
                or(s.conflictTimeoutMs, d.conflictTimeoutMs()),
                or(s.minAutomaticConfidence, d.minAutomaticConfidence()),
                s.strategyByType == null ? d.strategyByType() : strategies(s.strategyByType)
        );
    }

    private static EngineSettings.Performance performance(EngineConfigJson.PerformanceSection s,
                                                          EngineSettings.Performance d) {
        if (s == null) return d;
        return new EngineSettings.Performance(
                or(s.maxLatencyMs, d.maxLatencyMs()),
                or(s.maxMemoryMb, d.maxMemoryMb()),
                or(s.maxQueueSize, d.maxQueueSize()),
                or(s.targetLatencyMs, d.targetLatencyMs())
        );
    }

    private static EngineSettings.Detection detection(EngineConfigJson.DetectionSection s,
                                                      EngineSettings.Detection d) {
        if (s == null) return d;
        return new EngineSettings.Detection(
                or(s.spatialOverlapThresholdPercent, d.spatialOverlapThresholdPercent()),
                or(s.temporalWindowMs, d.temporalWindowMs()),
                or(s.simultaneityMs, d.simultaneityMs()),
                or(s.recencyWindowMs, d.recencyWindowMs()),
                or(s.recencyWindowMaxOperations, d.recencyWindowMaxOperations()),
                or(s.maxConflictHistory, d.maxConflictHistory())
        );
    }

    private static EngineSettings.Compression compression(EngineConfigJson.CompressionSection s,
                                                          EngineSettings.Compression d) {
        if (s == null) return d;
        return new EngineSettings.Compression(
                or(s.enabled, d.enabled()),
                or(s.maxRunLength, d.maxRunLength()),
                or(s.triggerQueueSize, d.triggerQueueSize())
        );
    }

    private static EngineSettings.Prediction prediction(EngineConfigJson.PredictionSection s,
                                                        EngineSettings.Prediction d) {
        if (s == null) return d;
        return new EngineSettings.Prediction(
                or(s.proximityThresholdPx, d.proximityThresholdPx()),
                or(s.temporalWindowMs, d.temporalWindowMs()),
                or(s.activityTtlMs, d.activityTtlMs()),
                or(s.periodMs, d.periodMs()),
                or(s.cacheCapacity, d.cacheCapacity())
        );
    }

    private static Map<ConflictType, ResolutionStrategy> strategies(Map<String, String> raw) {
        var out = new EnumMap<ConflictType, ResolutionStrategy>(ConflictType.class);
        for (var e : raw.entrySet()) {
            String key = "resolution.strategyByType." + e.getKey();
            ConflictType type = parseEnum(ConflictType.class, e.getKey(), key);
            out.put(type, parseEnum(ResolutionStrategy.class, e.getValue(), key));
        }
        return out;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String key) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException(key, "value is required");
        }
        String name = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key, "unknown " + type.getSimpleName() + " '" + raw + "'", e);
        }
    }

    private static String keyOf(JsonMappingException e) {
        String key = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                .collect(Collectors.joining("."));
        return key.isEmpty() ? "config" : key;
    }

    private static <T> T or(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
