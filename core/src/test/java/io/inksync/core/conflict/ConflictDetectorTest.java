package io.inksync.core.conflict;

import io.inksync.core.Bounds;
import io.inksync.core.EngineSettings;
import io.inksync.core.MutableClock;
import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.Ops;
import io.inksync.core.VectorClock;
import io.inksync.core.conflict.ConflictEvidence.CompoundEvidence;
import io.inksync.core.conflict.ConflictEvidence.FieldValues;
import io.inksync.core.conflict.ConflictEvidence.SemanticEvidence;
import io.inksync.core.conflict.ConflictEvidence.SpatialEvidence;
import io.inksync.core.conflict.ConflictEvidence.TemporalEvidence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Classification, symmetry and de-duplication of conflicts.
 */
class ConflictDetectorTest {

    private final MutableClock clock = new MutableClock(50_000);
    private final ConflictDetector detector = new ConflictDetector(EngineSettings.Detection.defaults(), clock);

    @Test
    void concurrent_width_updates_within_50ms_are_one_medium_semantic_conflict() {
        var op1 = Ops.update("op1", "E1", "user1", VectorClock.of("user1", 1), 1, 1_000, Map.of("width", 100));
        var op2 = Ops.update("op2", "E1", "user2", VectorClock.of("user2", 1), 1, 1_050, Map.of("width", 150));

        List<Conflict> conflicts = detector.detect("wb", op2, List.of(op1));

        assertEquals(1, conflicts.size());
        Conflict c = conflicts.get(0);
        assertEquals(ConflictType.SEMANTIC, c.type());
        assertEquals(Severity.MEDIUM, c.severity());
        assertEquals(List.of("E1"), c.affectedElementIds());
        assertEquals(Set.of("user1", "user2"), c.involvedUsers());
        var evidence = assertInstanceOf(SemanticEvidence.class, c.evidence());
        assertEquals(List.of("width"), evidence.incompatibleFields());
        assertEquals(new FieldValues(100, 150), evidence.values().get("width"));
    }

    @Test
    void numbers_of_different_boxed_types_compare_by_value() {
        var ints = Ops.update("i", "E1", "u1", VectorClock.of("u1", 1), 1, 1_000, Map.of("width", 100));
        var longs = Ops.update("l", "E1", "u2", VectorClock.of("u2", 1), 1, 1_050, Map.of("width", 100L));
        var doubles = Ops.update("d", "E1", "u3", VectorClock.of("u3", 1), 1, 1_060, Map.of("width", 100.0));
        var wider = Ops.update("w", "E1", "u4", VectorClock.of("u4", 1), 1, 1_070, Map.of("width", 150L));

        // same width: only the timing is contested
        assertEquals(ConflictType.TEMPORAL, detector.detectPair("wb", ints, longs).orElseThrow().type());
        assertEquals(ConflictType.TEMPORAL, detector.detectPair("wb", ints, doubles).orElseThrow().type());
        assertEquals(ConflictType.TEMPORAL, detector.detectPair("wb", longs, doubles).orElseThrow().type());

        var evidence = assertInstanceOf(SemanticEvidence.class,
                detector.detectPair("wb", ints, wider).orElseThrow().evidence());
        assertEquals(List.of("width"), evidence.incompatibleFields());
    }

    @Test
    void payload_value_equality_handles_numbers_and_other_values() {
        assertTrue(ConflictDetector.sameValue(100, 100.0));
        assertTrue(ConflictDetector.sameValue(0.5f, 0.5));
        assertTrue(ConflictDetector.sameValue(Double.NaN, Double.NaN));
        assertFalse(ConflictDetector.sameValue(100, 100.5));
        assertFalse(ConflictDetector.sameValue(100, "100"));
        assertTrue(ConflictDetector.sameValue("red", "red"));
        assertTrue(ConflictDetector.sameValue(null, null));
        assertFalse(ConflictDetector.sameValue(1, null));
    }

    @Test
    void detection_is_symmetric() {
        var a = Ops.update("a", "E1", "u1", VectorClock.of("u1", 1), 3, 1_000, Map.of("width", 1, "height", 2));
        var b = Ops.update("b", "E1", "u2", VectorClock.of("u2", 1), 2, 1_020, Map.of("width", 5, "height", 2));

        var ab = detector.detectPair("wb", a, b).orElseThrow();
        var ba = detector.detectPair("wb", b, a).orElseThrow();

        assertEquals(ab, ba);
        // canonical order: lower Lamport first
        assertEquals(List.of("b", "a"), ab.operationIds());
    }

    @Test
    void delete_against_concurrent_update_is_a_critical_compound_conflict() {
        var delete = Ops.of("C", OperationType.DELETE, "E1", "user1", VectorClock.of("user1", 1), 1);
        var style = Operation.builder().id("D").type(OperationType.STYLE).elementId("E1").userId("user2")
                .vectorClock(VectorClock.of("user2", 1)).lamportTimestamp(1).emittedAtMillis(1_010)
                .payload(Map.of("style.color", "blue")).build();

        Conflict c = detector.detectPair("wb", delete, style).orElseThrow();

        assertEquals(ConflictType.COMPOUND, c.type());
        assertEquals(Severity.CRITICAL, c.severity());
        assertTrue(c.touchesExistence());
        var evidence = assertInstanceOf(CompoundEvidence.class, c.evidence());
        assertTrue(evidence.parts().stream().anyMatch(p -> p instanceof TemporalEvidence));
    }

    @Test
    void causally_ordered_operations_never_conflict() {
        var first = Ops.update("a", "E1", "u1", VectorClock.of("u1", 1), 1, 1_000, Map.of("width", 1));
        // u2 saw u1's edit before writing
        var second = Ops.update("b", "E1", "u2", VectorClock.of("u1", 1, "u2", 1), 2, 1_001, Map.of("width", 2));

        assertTrue(detector.detectPair("wb", first, second).isEmpty());
    }

    @Test
    void same_user_operations_never_conflict() {
        var a = Ops.update("a", "E1", "u1", VectorClock.of("u1", 1), 1, 1_000, Map.of("width", 1));
        var b = Ops.update("b", "E1", "u1", VectorClock.of("u1", 2), 2, 1_001, Map.of("width", 2));

        assertTrue(detector.detectPair("wb", a, b).isEmpty());
    }

    @Test
    void disjoint_fields_close_in_time_are_a_low_temporal_conflict() {
        var a = Ops.update("a", "E1", "u1", VectorClock.of("u1", 1), 1, 1_000, Map.of("width", 1));
        var b = Ops.update("b", "E1", "u2", VectorClock.of("u2", 1), 1, 1_040, Map.of("height", 2));

        Conflict c = detector.detectPair("wb", a, b).orElseThrow();

        assertEquals(ConflictType.TEMPORAL, c.type());
        assertEquals(Severity.LOW, c.severity());
        var evidence = assertInstanceOf(TemporalEvidence.class, c.evidence());
        assertEquals(40, evidence.deltaMillis());
        assertTrue(evidence.simultaneous());
    }

    @Test
    void disjoint_fields_far_apart_in_time_do_not_conflict() {
        var a = Ops.update("a", "E1", "u1", VectorClock.of("u1", 1), 1, 1_000, Map.of("width", 1));
        var b = Ops.update("b", "E1", "u2", VectorClock.of("u2", 1), 1, 4_000, Map.of("height", 2));

        assertTrue(detector.detectPair("wb", a, b).isEmpty());
    }

    @Test
    void overlapping_bounds_of_different_elements_are_spatial() {
        var a = Ops.of("a", OperationType.MOVE, "E1", "u1", VectorClock.of("u1", 1), 1)
                .withBounds(new Bounds(0, 0, 100, 100));
        var b = Ops.of("b", OperationType.MOVE, "E2", "u2", VectorClock.of("u2", 1), 1)
                .withBounds(new Bounds(50, 0, 100, 100));

        Conflict c = detector.detectPair("wb", a, b).orElseThrow();

        assertEquals(ConflictType.SPATIAL, c.type());
        assertEquals(Severity.MEDIUM, c.severity());
        assertEquals(List.of("E1", "E2"), c.affectedElementIds());
        var evidence = assertInstanceOf(SpatialEvidence.class, c.evidence());
        assertEquals(5_000.0, evidence.overlapArea(), 1e-9);
        assertEquals(5_000.0 / 15_000.0, evidence.overlapRatio(), 1e-9);
    }

    @Test
    void overlap_below_threshold_is_ignored() {
        var a = Ops.of("a", OperationType.MOVE, "E1", "u1", VectorClock.of("u1", 1), 1)
                .withBounds(new Bounds(0, 0, 100, 100));
        var b = Ops.of("b", OperationType.MOVE, "E2", "u2", VectorClock.of("u2", 1), 1)
                .withBounds(new Bounds(95, 95, 100, 100));

        assertTrue(detector.detectPair("wb", a, b).isEmpty());
    }

    @Test
    void already_recorded_pairs_are_not_reported_again() {
        var a = Ops.update("a", "E1", "u1", VectorClock.of("u1", 1), 1, 1_000, Map.of("width", 1));
        var b = Ops.update("b", "E1", "u2", VectorClock.of("u2", 1), 1, 1_010, Map.of("width", 2));
        var recorded = Set.of(Conflict.pairKey("b", "a"));

        assertTrue(detector.detect("wb", a, List.of(b, b), recorded::contains).isEmpty());
        assertEquals(1, detector.detect("wb", a, List.of(b, b)).size());
    }

    @Test
    void conflict_rejects_evidence_of_the_wrong_shape() {
        var a = Ops.update("a", "E1", "u1", VectorClock.of("u1", 1), 1, 1_000, Map.of());
        var b = Ops.update("b", "E1", "u2", VectorClock.of("u2", 1), 1, 1_000, Map.of());

        assertThrows(IllegalArgumentException.class, () -> new Conflict("x", "wb", ConflictType.SEMANTIC,
                Severity.LOW, List.of(a, b), List.of("E1"), new TemporalEvidence(0, true), null, 0, null));
    }
}
