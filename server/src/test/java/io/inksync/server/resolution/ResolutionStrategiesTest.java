package io.inksync.server.resolution;

import io.inksync.core.Bounds;
import io.inksync.core.EngineSettings;
import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.VectorClock;
import io.inksync.core.VectorClockTracker;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.engine.TransformContext;
import io.inksync.core.engine.TransformEngine;
import io.inksync.server.Fixtures;
import io.inksync.server.TestClock;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionStrategiesTest {

    private final TestClock clock = new TestClock(50_000);
    private final TransformEngine engine = new TransformEngine(new VectorClockTracker(), EngineSettings.defaults(), clock);
    private final TransformContext ctx = engine.newContext("wb");

    private Conflict overlappingMoves() {
        return overlappingMoves(ctx);
    }

    private Conflict overlappingMoves(TransformContext on) {
        engine.transformOperation(Fixtures.move("m1", "E1", "user1", 1, 1_000, new Bounds(0, 0, 100, 100)), on);
        return engine.transformOperation(
                Fixtures.move("m2", "E2", "user2", 1, 3_000, new Bounds(50, 0, 100, 100)), on).conflicts().get(0);
    }

    private Conflict fieldEdits() {
        return fieldEdits(ctx);
    }

    private Conflict fieldEdits(TransformContext on) {
        engine.transformOperation(Fixtures.update("a", "E1", "alice", 1, 1_000,
                Map.of("width", 100, "label", "draft")), on);
        return engine.transformOperation(Fixtures.update("b", "E1", "bob", 2, 1_020,
                Map.of("width", 150, "color", "red")), on).conflicts().get(0);
    }

    @Test
    void spatial_offset_moves_the_later_element_clear_of_the_earlier_one() {
        Conflict conflict = overlappingMoves();
        assertEquals(ConflictType.SPATIAL, conflict.type());

        Operation moved = new SpatialOffsetStrategy().resolve(conflict, ctx).orElseThrow();

        assertEquals(OperationType.MOVE, moved.type());
        assertEquals("E2", moved.elementId());
        assertEquals(new Bounds(110, 0, 100, 100), moved.bounds());
        assertEquals(110.0, moved.payload().get("x"));
        assertEquals(0.0, new Bounds(0, 0, 100, 100).intersectionArea(moved.bounds()));
        assertEquals("resolution:" + conflict.id() + ":spatial_offset", moved.id());
    }

    @Test
    void spatial_offset_does_not_apply_to_field_conflicts() {
        Conflict conflict = fieldEdits();

        assertFalse(new SpatialOffsetStrategy().supports(conflict));
        assertTrue(new SpatialOffsetStrategy().resolve(conflict, ctx).isEmpty());
    }

    @Test
    void merge_unions_fields_and_keeps_the_last_writer_on_contested_ones() {
        Conflict conflict = fieldEdits();

        Operation merged = new MergeStrategy().resolve(conflict, ctx).orElseThrow();

        assertEquals(OperationType.UPDATE, merged.type());
        assertEquals("E1", merged.elementId());
        assertEquals(Map.of("width", 150, "label", "draft", "color", "red"), merged.payload());
        assertEquals(3, merged.lamportTimestamp());
    }

    @Test
    void merge_refuses_conflicts_that_delete_the_element() {
        engine.transformOperation(Fixtures.delete("C", "E1", "user1", 1, 1_000), ctx);
        Conflict conflict = engine.transformOperation(Fixtures.style("D", "E1", "user2", 1, 1_010, "blue"), ctx)
                .conflicts().get(0);

        assertFalse(new MergeStrategy().supports(conflict));
    }

    @Test
    void priority_user_beats_lamport_order_and_falls_back_to_last_writer_on_ties() {
        Conflict conflict = fieldEdits();

        Operation tie = new PriorityUserStrategy().resolve(conflict, ctx).orElseThrow();
        assertEquals(150, tie.payload().get("width"), "equal weights: bob wrote last");

        ctx.setUserPriority("alice", 5.0);
        Operation weighted = new PriorityUserStrategy().resolve(conflict, ctx).orElseThrow();
        assertEquals(100, weighted.payload().get("width"));
        assertEquals("resolution:" + conflict.id() + ":priority_user", weighted.id());
    }

    @Test
    void resolution_ids_do_not_depend_on_the_default_locale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Conflict conflict = fieldEdits();

            Operation chosen = new PriorityUserStrategy().resolve(conflict, ctx).orElseThrow();

            assertEquals("resolution:" + conflict.id() + ":priority_user", chosen.id());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void automatic_picks_offset_for_spatial_and_merge_for_semantic() {
        var automatic = new AutomaticStrategy();

        Operation spatial = automatic.resolve(overlappingMoves(), ctx).orElseThrow();
        assertEquals(OperationType.MOVE, spatial.type());

        TransformContext other = engine.newContext("wb-other");
        Operation semantic = automatic.resolve(fieldEdits(other), other).orElseThrow();
        assertEquals("draft", semantic.payload().get("label"));
    }

    @Test
    void spatial_conflict_analysis_prefers_offset() {
        var analyzer = new ConflictAnalyzer(EngineSettings.defaults().resolution(), ResolutionStrategyRegistry.defaults());

        ResolutionRecommendation rec = analyzer.analyze(overlappingMoves());

        assertEquals(ResolutionStrategy.SPATIAL_OFFSET, rec.strategy());
        assertEquals(RiskLevel.LOW, rec.risk());
        assertEquals(0.752, rec.confidence(), 1e-9);
        assertFalse(rec.alternatives().stream().anyMatch(a -> a.strategy() == ResolutionStrategy.MERGE));
    }

    @Test
    void overlap_with_a_new_element_is_not_forced_to_manual_review() {
        var analyzer = new ConflictAnalyzer(EngineSettings.defaults().resolution(), ResolutionStrategyRegistry.defaults());
        Operation create = Operation.builder()
                .id("new").type(OperationType.CREATE).elementId("E3").userId("user1")
                .vectorClock(VectorClock.of("user1", 1)).lamportTimestamp(1).version(1)
                .emittedAtMillis(1_000).bounds(new Bounds(0, 0, 100, 100)).payload(Map.of("kind", "rect"))
                .build();
        engine.transformOperation(create, ctx);
        Conflict conflict = engine.transformOperation(
                Fixtures.move("m", "E2", "user2", 1, 1_100, new Bounds(20, 0, 100, 100)), ctx).conflicts().get(0);
        assertEquals(ConflictType.SPATIAL, conflict.type());
        assertTrue(conflict.touchesExistence());

        ResolutionRecommendation rec = analyzer.analyze(conflict);

        assertEquals(ResolutionStrategy.SPATIAL_OFFSET, rec.strategy());
        assertEquals(RiskLevel.MEDIUM, rec.risk());
        assertTrue(rec.confidence() > 0.5);
    }

    @Test
    void deleting_an_element_someone_restyles_still_needs_a_person() {
        var analyzer = new ConflictAnalyzer(EngineSettings.defaults().resolution(), ResolutionStrategyRegistry.defaults());
        engine.transformOperation(Fixtures.delete("C", "E1", "user1", 1, 1_000), ctx);
        Conflict conflict = engine.transformOperation(Fixtures.style("D", "E1", "user2", 1, 1_010, "blue"), ctx)
                .conflicts().get(0);

        ResolutionRecommendation rec = analyzer.analyze(conflict);

        assertEquals(ConflictType.COMPOUND, conflict.type());
        assertEquals(ResolutionStrategy.MANUAL, rec.strategy());
        assertEquals(RiskLevel.HIGH, rec.risk());
        assertTrue(rec.reasoning().contains("create or delete"));
    }

    @Test
    void registry_has_no_handler_for_manual() {
        var registry = ResolutionStrategyRegistry.defaults();

        assertTrue(registry.handlerFor(ResolutionStrategy.MANUAL).isEmpty());
        assertEquals(5, registry.handlers().size());
        assertThrows(IllegalArgumentException.class, () -> registry.register(new ResolutionStrategyHandler() {
            @Override
            public ResolutionStrategy strategy() {
                return ResolutionStrategy.MANUAL;
            }

            @Override
            public boolean supports(Conflict conflict) {
                return true;
            }

            @Override
            public java.util.Optional<Operation> resolve(Conflict conflict, TransformContext context) {
                return java.util.Optional.empty();
            }
        }));
    }
}
