// file: core/src/main/java/io/inksync/core/conflict/ConflictDetector.java
package io.inksync.core.conflict;

import io.inksync.core.EngineSettings;
import io.inksync.core.Operation;
import io.inksync.core.VectorClockTracker;
import io.inksync.core.conflict.ConflictEvidence.CompoundEvidence;
import io.inksync.core.conflict.ConflictEvidence.FieldValues;
import io.inksync.core.conflict.ConflictEvidence.SemanticEvidence;
import io.inksync.core.conflict.ConflictEvidence.SpatialEvidence;
import io.inksync.core.conflict.ConflictEvidence.TemporalEvidence;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Classifies operation pairs as conflicting.
 * <p>
 * Only pairs from different users whose clocks are concurrent (or equal) are
 * candidates: if one operation causally follows the other, its author already
 * saw the earlier edit and there is nothing to resolve.
 * <p>
 * At most one conflict is reported per pair, by precedence:
 *  1. same element, create/delete involved  -> COMPOUND, CRITICAL
 *  2. same element, a field written twice with different values -> SEMANTIC
 *  3. same element, emitted within the temporal window -> TEMPORAL, LOW
 *  4. different elements, bounds overlap above the threshold -> SPATIAL
 * <p>
 * Symmetry: the pair is put into {@link Operation#LAMPORT_ORDER} before any
 * evidence is computed, and the conflict id is derived from the unordered pair,
 * so detect(A,B) and detect(B,A) build the same record.
 */
public final class ConflictDetector {

    /** Semantic conflicts with at least this many incompatible fields are HIGH. */
    static final int HIGH_SEVERITY_FIELD_COUNT = 5;
    /** Spatial overlap ratio above which a spatial conflict is HIGH. */
    static final double HIGH_SEVERITY_OVERLAP = 0.5;

    private final EngineSettings.Detection settings;
    private final Clock clock;

    public ConflictDetector(EngineSettings.Detection settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<Conflict> detect(String whiteboardId, Operation incoming, Collection<Operation> window) {
        return detect(whiteboardId, incoming, window, key -> false);
    }

    /**
     * Check {@code incoming} against every operation of the recency window.
     *
     * @param alreadyRecorded pair keys (see {@link Conflict#pairKey}) that already
     *                        produced a conflict and must not be reported again
     */
    public List<Conflict> detect(String whiteboardId,
                                 Operation incoming,
                                 Collection<Operation> window,
                                 Predicate<String> alreadyRecorded) {
        Objects.requireNonNull(incoming, "incoming");
        var out = new ArrayList<Conflict>();
        var seen = new HashSet<String>();
        for (Operation other : window) {
            if (other.id().equals(incoming.id())) {
                continue;
            }
            String key = Conflict.pairKey(incoming.id(), other.id());
            if (alreadyRecorded.test(key) || !seen.add(key)) {
                continue;
            }
            detectPair(whiteboardId, incoming, other).ifPresent(out::add);
        }
        return out;
    }

    public Optional<Conflict> detectPair(String whiteboardId, Operation a, Operation b) {
        if (a.userId() == null || a.userId().equals(b.userId())) {
            return Optional.empty();
        }
        if (VectorClockTracker.compare(a.vectorClock(), b.vectorClock()).isOrdered()) {
            return Optional.empty();
        }

        Operation first = Operation.LAMPORT_ORDER.compare(a, b) <= 0 ? a : b;
        Operation second = first == a ? b : a;

        boolean sameElement = first.elementId() != null && first.elementId().equals(second.elementId());
        if (sameElement) {
            return sameElementConflict(whiteboardId, first, second);
        }
        return spatialConflict(whiteboardId, first, second);
    }

    private Optional<Conflict> sameElementConflict(String whiteboardId, Operation first, Operation second) {
        long delta = Math.abs(first.emittedAtMillis() - second.emittedAtMillis());
        var temporal = new TemporalEvidence(delta, delta <= settings.simultaneityMs());
        SemanticEvidence semantic = semanticEvidence(first, second);

        if (first.changesExistence() || second.changesExistence()) {
            var parts = new ArrayList<ConflictEvidence>();
            parts.add(temporal);
            if (semantic != null) {
                parts.add(semantic);
            }
            String reason = describe(first) + " vs " + describe(second) + " on " + first.elementId();
            return Optional.of(build(whiteboardId, ConflictType.COMPOUND, Severity.CRITICAL,
                    first, second, new CompoundEvidence(reason, parts)));
        }

        if (semantic != null) {
            Severity severity = semantic.incompatibleFields().size() >= HIGH_SEVERITY_FIELD_COUNT
                    ? Severity.HIGH
                    : Severity.MEDIUM;
            return Optional.of(build(whiteboardId, ConflictType.SEMANTIC, severity, first, second, semantic));
        }

        if (delta <= settings.temporalWindowMs()) {
            return Optional.of(build(whiteboardId, ConflictType.TEMPORAL, Severity.LOW, first, second, temporal));
        }
        return Optional.empty();
    }

    private Optional<Conflict> spatialConflict(String whiteboardId, Operation first, Operation second) {
        if (first.bounds() == null || second.bounds() == null) {
            return Optional.empty();
        }
        double ratio = first.bounds().overlapRatio(second.bounds());
        if (ratio <= 0.0 || ratio < settings.spatialOverlapThreshold()) {
            return Optional.empty();
        }
        Severity severity = ratio > HIGH_SEVERITY_OVERLAP ? Severity.HIGH : Severity.MEDIUM;
        if (first.changesExistence() || second.changesExistence()) {
            severity = Severity.max(severity, Severity.HIGH);
        }
        var evidence = new SpatialEvidence(first.bounds().intersectionArea(second.bounds()), ratio);
        return Optional.of(build(whiteboardId, ConflictType.SPATIAL, severity, first, second, evidence));
    }

    /** Fields written by both with different values; null when there are none. */
    private static SemanticEvidence semanticEvidence(Operation first, Operation second) {
        var shared = new TreeSet<>(first.payload().keySet());
        shared.retainAll(second.payload().keySet());
        var values = new LinkedHashMap<String, FieldValues>();
        for (String field : shared) {
            Object v1 = first.payload().get(field);
            Object v2 = second.payload().get(field);
            if (!sameValue(v1, v2)) {
                values.put(field, new FieldValues(v1, v2));
            }
        }
        if (values.isEmpty()) {
            return null;
        }
        return new SemanticEvidence(List.copyOf(values.keySet()), values);
    }

    /** Payload equality where numbers compare by value, so 100, 100L and 100.0 agree. */
    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            Number x = (Number) a;
            Number y = (Number) b;
            if (!isFinite(x) || !isFinite(y)) {
                return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
            }
            return decimal(x).compareTo(decimal(y)) == 0;
        }
        return Objects.equals(a, b);
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float) {
            return Double.isFinite(n.doubleValue());
        }
        return true;
    }

    private static BigDecimal decimal(Number n) {
        return n instanceof BigDecimal ? (BigDecimal) n : new BigDecimal(n.toString());
    }

    private Conflict build(String whiteboardId,
                           ConflictType type,
                           Severity severity,
                           Operation first,
                           Operation second,
                           ConflictEvidence evidence) {
        String id = whiteboardId + ":" + type.name().toLowerCase(Locale.ROOT) + ":"
                + Conflict.pairKey(first.id(), second.id());
        var elements = new ArrayList<String>();
        if (first.elementId() != null) elements.add(first.elementId());
        if (second.elementId() != null) elements.add(second.elementId());
        return new Conflict(id, whiteboardId, type, severity, List.of(first, second), elements,
                evidence, null, clock.millis(), null);
    }

    private static String describe(Operation op) {
        return op.type().name().toLowerCase(Locale.ROOT) + "(" + op.userId() + ")";
    }
}
