// file: core/src/main/java/io/inksync/core/predict/ConflictPredictor.java
package io.inksync.core.predict;

import io.inksync.core.ElementState;
import io.inksync.core.EngineSettings;
import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.cache.BoundedCache;
import io.inksync.core.cache.LruTtlCache;
import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.Severity;
import io.inksync.core.engine.TransformContext;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Forecasts likely conflicts from live activity and very recent operations.
 * <p>
 * Signals:
 *  - spatial:  two fresh cursors closer than the proximity threshold;
 *  - temporal: different users touching the same element within the window;
 *  - semantic: a delete mixed with other users' edits, or several users styling
 *              the same element.
 * <p>
 * Predictions are advisory only. Inputs are never mutated and nothing here is
 * on the operation acceptance path. Issued predictions are remembered for a
 * while so callers can report whether they came true (see {@link #accuracy()}).
 */
public final class ConflictPredictor {

    private static final double HIGH_PROXIMITY = 0.3;
    private static final double MEDIUM_PROXIMITY = 0.6;
    private static final long HIGH_TEMPORAL_MS = 200;
    private static final long MEDIUM_TEMPORAL_MS = 500;
    private static final double SEMANTIC_WEIGHT_PER_OP = 0.3;

    private final EngineSettings.Prediction settings;
    private final Clock clock;
    private final BoundedCache<String, Prediction> issued;
    private final AtomicLong evaluated = new AtomicLong();
    private final AtomicLong correct = new AtomicLong();

    public ConflictPredictor(EngineSettings.Prediction settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.issued = new LruTtlCache<>(settings.cacheCapacity(),
                Duration.ofMillis(settings.activityTtlMs() * 12), clock);
    }

    public List<Prediction> predictConflicts(List<Operation> recentOperations,
                                             Map<String, UserActivity> liveUserActivity,
                                             TransformContext context) {
        return predictConflicts(recentOperations, liveUserActivity, context.elementStates());
    }

    /**
     * @param elementStates snapshot used to name elements under the cursors
     * @return predictions, most probable first
     */
    public List<Prediction> predictConflicts(List<Operation> recentOperations,
                                             Map<String, UserActivity> liveUserActivity,
                                             Map<String, ElementState> elementStates) {
        long now = clock.millis();
        var out = new ArrayList<Prediction>();
        spatial(liveUserActivity, elementStates, now, out);
        temporal(recentOperations, now, out);
        semantic(recentOperations, now, out);
        out.sort(Comparator.comparingDouble(Prediction::probability).reversed()
                .thenComparing(Prediction::type));
        for (Prediction p : out) {
            issued.set(p.id(), p);
        }
        return out;
    }

    /**
     * Report whether an issued prediction turned into a real conflict.
     *
     * @return false if the prediction is unknown or already expired
     */
    public boolean recordOutcome(String predictionId, boolean occurred) {
        if (issued.get(predictionId).isEmpty()) {
            return false;
        }
        issued.invalidate(predictionId);
        evaluated.incrementAndGet();
        if (occurred) {
            correct.incrementAndGet();
        }
        return true;
    }

    public PredictionAccuracy accuracy() {
        return new PredictionAccuracy(evaluated.get(), correct.get());
    }

    /** Drop remembered predictions past their TTL; scheduled by the owner. */
    public int sweepExpired() {
        return issued.sweepExpired();
    }

    // ---------- signals ----------

    private void spatial(Map<String, UserActivity> activity,
                         Map<String, ElementState> elementStates,
                         long now,
                         List<Prediction> out) {
        double threshold = settings.proximityThresholdPx();
        List<UserActivity> fresh = activity.values().stream()
                .filter(a -> a.cursor() != null && now - a.observedAtMillis() <= settings.activityTtlMs())
                .sorted(Comparator.comparing(UserActivity::userId))
                .toList();

        for (int i = 0; i < fresh.size(); i++) {
            for (int j = i + 1; j < fresh.size(); j++) {
                UserActivity a = fresh.get(i);
                UserActivity b = fresh.get(j);
                double d = a.cursor().distanceTo(b.cursor());
                if (d >= threshold) {
                    continue;
                }
                Severity severity = d < threshold * HIGH_PROXIMITY ? Severity.HIGH
                        : d < threshold * MEDIUM_PROXIMITY ? Severity.MEDIUM
                        : Severity.LOW;
                var elements = new TreeSet<String>();
                for (ElementState s : elementStates.values()) {
                    if (s.exists() && s.bounds() != null
                            && (s.bounds().contains(a.cursor()) || s.bounds().contains(b.cursor()))) {
                        elements.add(s.elementId());
                    }
                }
                if (a.focusedElementId() != null) elements.add(a.focusedElementId());
                if (b.focusedElementId() != null) elements.add(b.focusedElementId());
                out.add(new Prediction(newId(), ConflictType.SPATIAL, 1.0 - d / threshold, severity,
                        List.of(a.userId(), b.userId()), List.copyOf(elements),
                        severity == Severity.HIGH ? PreventionStrategy.LOCK_REGION : PreventionStrategy.SPLIT_WORK_AREA,
                        now));
            }
        }
    }

    private void temporal(List<Operation> recent, long now, List<Prediction> out) {
        long window = settings.temporalWindowMs();
        for (var entry : byElement(recent).entrySet()) {
            List<Operation> ops = new ArrayList<>(entry.getValue());
            ops.sort(Comparator.comparingLong(Operation::emittedAtMillis));
            long closest = Long.MAX_VALUE;
            var users = new LinkedHashSet<String>();
            for (int i = 1; i < ops.size(); i++) {
                Operation prev = ops.get(i - 1);
                Operation cur = ops.get(i);
                long dt = cur.emittedAtMillis() - prev.emittedAtMillis();
                if (!prev.userId().equals(cur.userId()) && dt < window) {
                    closest = Math.min(closest, dt);
                    users.add(prev.userId());
                    users.add(cur.userId());
                }
            }
            if (users.isEmpty()) {
                continue;
            }
            Severity severity = closest < HIGH_TEMPORAL_MS ? Severity.HIGH
                    : closest < MEDIUM_TEMPORAL_MS ? Severity.MEDIUM
                    : Severity.LOW;
            out.add(new Prediction(newId(), ConflictType.TEMPORAL, 1.0 - (double) closest / window, severity,
                    List.copyOf(users), List.of(entry.getKey()), PreventionStrategy.STAGGER_EDITS, now));
        }
    }

    private void semantic(List<Operation> recent, long now, List<Prediction> out) {
        for (var entry : byElement(recent).entrySet()) {
            List<Operation> ops = entry.getValue();
            var users = new TreeSet<String>();
            var stylers = new TreeSet<String>();
            boolean delete = false;
            for (Operation op : ops) {
                users.add(op.userId());
                if (op.type() == OperationType.DELETE) delete = true;
                if (op.type() == OperationType.STYLE) stylers.add(op.userId());
            }
            boolean deleteMixed = delete && users.size() > 1
                    && ops.stream().anyMatch(op -> op.type() != OperationType.DELETE);
            if (!deleteMixed && stylers.size() < 2) {
                continue;
            }
            double probability = Math.min(1.0, SEMANTIC_WEIGHT_PER_OP * ops.size());
            Severity severity = deleteMixed ? Severity.HIGH : Severity.MEDIUM;
            out.add(new Prediction(newId(), ConflictType.SEMANTIC, probability, severity,
                    List.copyOf(deleteMixed ? users : stylers), List.of(entry.getKey()),
                    PreventionStrategy.LOCK_ELEMENT, now));
        }
    }

    private static Map<String, List<Operation>> byElement(List<Operation> ops) {
        var m = new LinkedHashMap<String, List<Operation>>();
        for (Operation op : ops) {
            if (op.elementId() != null && op.userId() != null) {
                m.computeIfAbsent(op.elementId(), k -> new ArrayList<>()).add(op);
            }
        }
        return m;
    }

    private static String newId() {
        return "pred-" + UUID.randomUUID();
    }
}
