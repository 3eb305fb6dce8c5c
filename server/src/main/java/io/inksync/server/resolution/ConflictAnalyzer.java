// file: server/src/main/java/io/inksync/server/resolution/ConflictAnalyzer.java
package io.inksync.server.resolution;

import io.inksync.core.EngineSettings;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ConflictEvidence;
import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.conflict.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Scores a conflict and recommends how to settle it.
 * <p>
 * Responsibilities:
 *  - Derive a confidence in [0.05, 0.95] from the conflict type, its severity and
 *    a complexity score built from operation count, overlap and contested fields.
 *  - Pick the configured strategy for the type, escalating to MANUAL when the
 *    confidence is below the configured minimum.
 *  - Force MANUAL with HIGH risk for compound or critical conflicts. A spatial overlap
 *    with a freshly created element is scored like any other spatial conflict.
 *  - List the other automatic strategies able to handle the conflict, most confident first.
 * <p>
 * Pure function of its inputs; safe to share between sessions.
 */
public final class ConflictAnalyzer {

    static final double MIN_CONFIDENCE = 0.05;
    static final double MAX_CONFIDENCE = 0.95;
    static final double MANUAL_CONFIDENCE_CAP = 0.3;

    private final EngineSettings.Resolution settings;
    private final ResolutionStrategyRegistry registry;

    public ConflictAnalyzer(EngineSettings.Resolution settings, ResolutionStrategyRegistry registry) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ResolutionRecommendation analyze(Conflict conflict) {
        int opCount = conflict.operations().size();
        double overlap = overlapRatio(conflict.evidence());
        int fields = incompatibleFieldCount(conflict.evidence());
        double complexity = complexity(opCount, overlap, fields);

        double confidence = clamp((baseConfidence(conflict.type()) + severityAdjustment(conflict.severity()))
                * (1.0 - 0.2 * complexity));

        ResolutionStrategy strategy = settings.strategyByType().get(conflict.type());
        RiskLevel risk;
        String reasoning;

        if (conflict.type() == ConflictType.COMPOUND || conflict.severity() == Severity.CRITICAL) {
            strategy = ResolutionStrategy.MANUAL;
            risk = RiskLevel.HIGH;
            confidence = Math.min(confidence, MANUAL_CONFIDENCE_CAP);
            reasoning = conflict.touchesExistence()
                    ? "operations create or delete the same element; a person has to decide which intent survives"
                    : "critical severity; automatic resolution could lose user work";
        } else {
            risk = (conflict.severity() == Severity.HIGH || opCount > 5 || fields >= 3)
                    ? RiskLevel.MEDIUM
                    : RiskLevel.LOW;
            if (strategy == ResolutionStrategy.MANUAL) {
                reasoning = "configured default for " + conflict.type() + " conflicts is manual review";
            } else if (confidence < settings.minAutomaticConfidence()) {
                reasoning = String.format("confidence %.2f below minimum %.2f", confidence,
                        settings.minAutomaticConfidence());
                strategy = ResolutionStrategy.MANUAL;
            } else {
                reasoning = String.format("%s conflict (%s) with complexity %.2f suits %s",
                        conflict.type(), conflict.severity(), complexity, strategy);
            }
        }

        long estimate = Math.round(baseMillis(strategy) * (1.0 + complexity) * (1.0 + 0.1 * opCount));
        return new ResolutionRecommendation(conflict.id(), strategy, confidence, reasoning, estimate, risk,
                alternatives(conflict, strategy, confidence));
    }

    private List<AlternativeStrategy> alternatives(Conflict conflict, ResolutionStrategy chosen, double confidence) {
        var out = new ArrayList<AlternativeStrategy>();
        for (ResolutionStrategyHandler h : registry.handlers()) {
            if (h.strategy() == chosen || !h.supports(conflict)) {
                continue;
            }
            double c = clamp(confidence * fit(h.strategy(), conflict.type()));
            out.add(new AlternativeStrategy(h.strategy(), c, describe(h.strategy())));
        }
        out.sort(Comparator.comparingDouble(AlternativeStrategy::confidence).reversed()
                .thenComparing(AlternativeStrategy::strategy));
        return out;
    }

    static double complexity(int opCount, double overlap, int fields) {
        double c = Math.min(opCount / 10.0, 0.5) + overlap * 0.3 + Math.min(fields / 5.0, 0.4);
        return Math.min(c, 1.0);
    }

    static double baseConfidence(ConflictType type) {
        return switch (type) {
            case TEMPORAL -> 0.9;
            case SPATIAL -> 0.8;
            case SEMANTIC -> 0.75;
            case COMPOUND -> 0.3;
        };
    }

    static double severityAdjustment(Severity severity) {
        return switch (severity) {
            case LOW -> 0.05;
            case MEDIUM -> 0.0;
            case HIGH -> -0.15;
            case CRITICAL -> -0.3;
        };
    }

    static long baseMillis(ResolutionStrategy strategy) {
        return switch (strategy) {
            case LAST_WRITER_WINS -> 50;
            case PRIORITY_USER -> 100;
            case MERGE -> 200;
            case SPATIAL_OFFSET -> 120;
            case AUTOMATIC -> 150;
            case MANUAL -> 0;
        };
    }

    // How well a strategy suits a conflict type, relative to the recommendation.
    private static double fit(ResolutionStrategy strategy, ConflictType type) {
        return switch (strategy) {
            case SPATIAL_OFFSET -> type == ConflictType.SPATIAL ? 1.0 : 0.5;
            case MERGE -> type == ConflictType.SEMANTIC ? 0.95 : 0.85;
            case LAST_WRITER_WINS -> type == ConflictType.SPATIAL ? 0.8 : 1.0;
            case AUTOMATIC -> 0.9;
            case PRIORITY_USER -> 0.85;
            case MANUAL -> 0.0;
        };
    }

    private static String describe(ResolutionStrategy strategy) {
        return switch (strategy) {
            case LAST_WRITER_WINS -> "keep the operation with the highest Lamport timestamp";
            case PRIORITY_USER -> "keep the operation of the highest-priority user";
            case MERGE -> "merge fields, last writer wins on contested fields";
            case SPATIAL_OFFSET -> "shift the later element clear of the overlap";
            case AUTOMATIC -> "pick a strategy by conflict type";
            case MANUAL -> "ask a person";
        };
    }

    private static double overlapRatio(ConflictEvidence evidence) {
        if (evidence instanceof ConflictEvidence.SpatialEvidence s) {
            return s.overlapRatio();
        }
        if (evidence instanceof ConflictEvidence.CompoundEvidence c) {
            return c.parts().stream().mapToDouble(ConflictAnalyzer::overlapRatio).max().orElse(0.0);
        }
        return 0.0;
    }

    private static int incompatibleFieldCount(ConflictEvidence evidence) {
        if (evidence instanceof ConflictEvidence.SemanticEvidence s) {
            return s.incompatibleFields().size();
        }
        if (evidence instanceof ConflictEvidence.CompoundEvidence c) {
            return c.parts().stream().mapToInt(ConflictAnalyzer::incompatibleFieldCount).sum();
        }
        return 0;
    }

    private static double clamp(double v) {
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, v));
    }
}
