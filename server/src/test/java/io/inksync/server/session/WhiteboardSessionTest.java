package io.inksync.server.session;

import io.inksync.core.EngineSettings;
import io.inksync.core.Operation;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.server.Fixtures;
import io.inksync.server.TestClock;
import io.inksync.server.notify.AsyncDispatcher;
import io.inksync.server.resolution.ConflictResolutionService;
import io.inksync.server.resolution.ManualIntervention;
import io.inksync.server.resolution.ResolutionOutcome;
import io.inksync.server.resolution.ResolutionStrategyRegistry;
import io.inksync.storage.AuditAction;
import io.inksync.storage.AuditRecord;
import io.inksync.storage.InMemoryConflictAuditLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class WhiteboardSessionTest {

    private final TestClock clock = new TestClock(10_000);
    private final InMemoryConflictAuditLog auditLog = new InMemoryConflictAuditLog();
    private final AsyncDispatcher dispatcher = new AsyncDispatcher(auditLog, n -> { }, Runnable::run);
    private final EngineSettings settings = EngineSettings.defaults();
    private final ConflictResolutionService service = new ConflictResolutionService(
            settings.resolution(), ResolutionStrategyRegistry.defaults(), dispatcher, auditLog, clock);

    private WhiteboardSessionRegistry registry =
            new WhiteboardSessionRegistry(settings, service, Duration.ofMinutes(10), clock, Runnable::run);

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void concurrent_edits_are_accepted_and_resolved() {
        WhiteboardSession session = registry.sessionFor("wb");

        session.submit(Fixtures.update("op1", "E1", "user1", 1, 1_000, Map.of("width", 100))).join();
        ProcessingOutcome outcome =
                session.submit(Fixtures.update("op2", "E1", "user2", 1, 1_050, Map.of("width", 150))).join();

        var accepted = assertInstanceOf(ProcessingOutcome.Accepted.class, outcome);
        assertEquals("op2", accepted.operationId());
        assertEquals(1, accepted.resolutions().size());
        ResolutionOutcome resolved = accepted.resolutions().get(0);
        assertTrue(resolved.success());
        assertEquals(ResolutionStrategy.LAST_WRITER_WINS, resolved.strategy());
        assertEquals(150, resolved.resolutionOperation().orElseThrow().payload().get("width"));
    }

    @Test
    void malformed_operation_is_rejected_with_violations() {
        WhiteboardSession session = registry.sessionFor("wb");
        Operation bad = Fixtures.update("op1", "E1", "user1", 1, 1_000, Map.of("width", 100))
                .toBuilder().userId("").build();

        ProcessingOutcome outcome = session.submit(bad).join();

        var rejected = assertInstanceOf(ProcessingOutcome.Rejected.class, outcome);
        assertEquals("op1", rejected.operationId());
        assertTrue(rejected.violations().contains("userId is required"));
    }

    @Test
    void retried_operation_is_a_duplicate_while_pending_and_after_acknowledge() {
        WhiteboardSession session = registry.sessionFor("wb");
        Operation op = Fixtures.update("op1", "E1", "user1", 1, 1_000, Map.of("width", 100));

        assertInstanceOf(ProcessingOutcome.Accepted.class, session.submit(op).join());
        assertEquals(new ProcessingOutcome.Duplicate("op1"), session.submit(op).join());

        assertEquals(1, session.acknowledge("op1").join());
        assertEquals(new ProcessingOutcome.Duplicate("op1"), session.submit(op).join());
        assertEquals(0, session.acknowledge("op1").join());
    }

    @Test
    void operations_from_many_threads_are_applied_one_at_a_time() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            registry = new WhiteboardSessionRegistry(settings, service, Duration.ofMinutes(10), clock, pool);
            WhiteboardSession session = registry.sessionFor("wb");

            var futures = new ArrayList<CompletableFuture<ProcessingOutcome>>();
            for (int i = 0; i < 50; i++) {
                Operation op = Fixtures.update("op" + i, "E" + i, "user" + (i % 5), i + 1, 1_000 + i,
                        Map.of("width", i));
                futures.add(CompletableFuture.supplyAsync(() -> session.submit(op), callers)
                        .thenCompose(f -> f));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            for (var f : futures) {
                assertInstanceOf(ProcessingOutcome.Accepted.class, f.join());
            }
            assertEquals(50, session.performance().join().snapshot().operationCount());
        } finally {
            callers.shutdownNow();
            registry.close();
            pool.shutdownNow();
        }
    }

    @Test
    void closed_session_refuses_new_work() {
        WhiteboardSession session = registry.sessionFor("wb");

        registry.close("wb").join();

        assertTrue(session.isClosed());
        assertTrue(registry.find("wb").isEmpty());
        CompletionException e = assertThrows(CompletionException.class,
                () -> session.submit(Fixtures.update("op1", "E1", "user1", 1, 1_000, Map.of("width", 1))).join());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertNotSame(session, registry.sessionFor("wb"));
    }

    @Test
    void completing_an_intervention_clears_the_active_conflict() {
        WhiteboardSession session = registry.sessionFor("wb");
        session.submit(Fixtures.delete("C", "E1", "user1", 1, 1_000)).join();
        var accepted = (ProcessingOutcome.Accepted) session
                .submit(Fixtures.style("D", "E1", "user2", 1, 1_010, "blue")).join();

        assertTrue(accepted.resolutions().get(0).requiresManualIntervention());
        assertEquals(1, session.performance().join().snapshot().activeConflicts());
        List<ManualIntervention> pending = service.getPendingManualInterventions();
        assertEquals(1, pending.size());

        Optional<ManualIntervention> done = session
                .completeManualIntervention(pending.get(0).id(), "reviewer", null).join();

        assertTrue(done.isPresent());
        assertEquals(ManualIntervention.Status.COMPLETED, done.get().status());
        assertEquals(0, session.performance().join().snapshot().activeConflicts());
        assertTrue(service.getPendingManualInterventions().isEmpty());
        List<AuditRecord> records = auditLog.readAll();
        assertEquals(AuditAction.MANUAL_INTERVENTION_COMPLETED, records.get(records.size() - 1).action());
    }

    @Test
    void expired_review_drops_the_conflict_from_the_session() {
        WhiteboardSession session = registry.sessionFor("wb");
        session.submit(Fixtures.delete("C", "E1", "user1", 1, 1_000)).join();
        session.submit(Fixtures.style("D", "E1", "user2", 1, 1_010, "blue")).join();
        assertEquals(1, session.performance().join().snapshot().activeConflicts());

        clock.advance(settings.resolution().conflictTimeoutMs());
        List<ManualIntervention> expired = registry.expireInterventions();

        assertEquals(1, expired.size());
        assertEquals(ManualIntervention.Status.EXPIRED, expired.get(0).status());
        assertEquals(0, session.performance().join().snapshot().activeConflicts());
        assertTrue(service.getActiveConflicts("wb").isEmpty());
        assertTrue(registry.expireInterventions().isEmpty());
    }

    @Test
    void closing_a_whiteboard_forgets_its_unsettled_conflicts() {
        WhiteboardSession session = registry.sessionFor("wb");
        session.submit(Fixtures.delete("C", "E1", "user1", 1, 1_000)).join();
        session.submit(Fixtures.style("D", "E1", "user2", 1, 1_010, "blue")).join();
        String conflictId = service.getActiveConflicts("wb").get(0).id();
        service.acknowledgeNotification(conflictId, "user1");

        WhiteboardSession other = registry.sessionFor("wb-other");
        other.submit(Fixtures.delete("C2", "E2", "user1", 1, 1_000)).join();
        other.submit(Fixtures.style("D2", "E2", "user2", 1, 1_010, "red")).join();

        registry.close("wb").join();

        assertTrue(service.getActiveConflicts("wb").isEmpty());
        assertTrue(service.acknowledgedBy(conflictId).isEmpty());
        assertEquals(1, service.getActiveConflicts("wb-other").size());
        assertEquals(1, service.getPendingManualInterventions().size());
        assertEquals("wb-other", service.getPendingManualInterventions().get(0).conflict().whiteboardId());
    }

    @Test
    void prediction_inputs_reflect_accepted_operations() {
        WhiteboardSession session = registry.sessionFor("wb");
        session.submit(Fixtures.update("op1", "E1", "user1", 1, 1_000, Map.of("width", 100))).join();

        PredictionInputs inputs = session.predictionInputs().join();

        assertEquals(1, inputs.recentOperations().size());
        assertTrue(inputs.elementStates().containsKey("E1"));
    }
}
