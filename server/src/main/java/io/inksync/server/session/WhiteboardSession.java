// file: server/src/main/java/io/inksync/server/session/WhiteboardSession.java
package io.inksync.server.session;

import io.inksync.core.Operation;
import io.inksync.core.VectorClockTracker;
import io.inksync.core.compress.CompressionStats;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.engine.TransformContext;
import io.inksync.core.engine.TransformEngine;
import io.inksync.core.engine.TransformResult;
import io.inksync.core.error.OperationValidationException;
import io.inksync.server.perf.Bottleneck;
import io.inksync.server.perf.PerformanceAnalyzer;
import io.inksync.server.perf.PerformanceReport;
import io.inksync.server.resolution.ConflictResolutionService;
import io.inksync.server.resolution.ManualIntervention;
import io.inksync.server.resolution.ResolutionOutcome;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-writer owner of one whiteboard's {@link TransformContext}.
 * <p>
 * Responsibilities:
 *  - Serialize every read and write of the context on a {@link SerialExecutor}.
 *  - Drop retried operation ids through an {@link OperationIdDeduper}.
 *  - Hand each detected conflict to the {@link ConflictResolutionService}.
 *  - Check the performance snapshot every {@link #PERFORMANCE_CHECK_EVERY} operations
 *    and warn about high-severity bottlenecks.
 * <p>
 * All public methods return at once; results arrive through the returned futures.
 * Audit appends and notifications are dispatched asynchronously by the resolution
 * service, so a slow audit log never delays the next operation.
 */
public final class WhiteboardSession {
    private static final Logger log = Logger.getLogger(WhiteboardSession.class.getName());

    static final int PERFORMANCE_CHECK_EVERY = 100;

    private final String whiteboardId;
    private final TransformEngine engine;
    private final TransformContext context;
    private final VectorClockTracker tracker;
    private final ConflictResolutionService resolution;
    private final OperationIdDeduper deduper;
    private final SerialExecutor serial;

    private volatile boolean closed = false;
    private long processed; // session thread only

    WhiteboardSession(String whiteboardId,
                      TransformEngine engine,
                      VectorClockTracker tracker,
                      ConflictResolutionService resolution,
                      OperationIdDeduper deduper,
                      Executor workers) {
        this.whiteboardId = Objects.requireNonNull(whiteboardId, "whiteboardId");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.resolution = Objects.requireNonNull(resolution, "resolution");
        this.deduper = Objects.requireNonNull(deduper, "deduper");
        this.context = engine.newContext(whiteboardId);
        this.serial = new SerialExecutor(workers, "whiteboard " + whiteboardId);
    }

    public String whiteboardId() {
        return whiteboardId;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Queue {@code op} for transformation.
     * The future completes with a typed outcome; it fails only if the session is closed.
     */
    public CompletableFuture<ProcessingOutcome> submit(Operation op) {
        return onSession(() -> process(op));
    }

    /** @see TransformEngine#acknowledge */
    public CompletableFuture<Integer> acknowledge(String operationId) {
        return onSession(() -> engine.acknowledge(context, operationId));
    }

    public CompletableFuture<CompressionStats> compress() {
        return onSession(() -> engine.compressPending(context));
    }

    public CompletableFuture<PerformanceReport> performance() {
        return onSession(this::analyzePerformance);
    }

    public CompletableFuture<Void> setUserPriority(String userId, double weight) {
        return onSession(() -> {
            context.setUserPriority(userId, weight);
            return null;
        });
    }

    /**
     * Settle a pending manual intervention and close the conflict in this whiteboard's context.
     *
     * @return the completed intervention, empty if it was not pending
     */
    public CompletableFuture<Optional<ManualIntervention>> completeManualIntervention(String interventionId,
                                                                                      String resolvedBy,
                                                                                      Operation chosen) {
        return onSession(() -> {
            Optional<ManualIntervention> done = resolution.completeManualIntervention(interventionId, resolvedBy, chosen);
            done.ifPresent(mi -> context.resolveConflict(mi.conflict().id(), ResolutionStrategy.MANUAL, true));
            return done;
        });
    }

    /**
     * Drop the conflict of an expired intervention from this whiteboard's context,
     * so its operations are no longer held back from compression.
     *
     * @return true if the conflict was still active here
     */
    CompletableFuture<Boolean> interventionExpired(ManualIntervention expired) {
        if (closed) {
            return CompletableFuture.completedFuture(false);
        }
        return onSession(() -> {
            boolean dropped = context.abandonConflict(expired.conflict().id()).isPresent();
            if (dropped) {
                log.fine(() -> "dropped conflict " + expired.conflict().id() + " after its review expired");
            }
            return dropped;
        });
    }

    /** Snapshot of what the conflict predictor needs, taken between operations. */
    public CompletableFuture<PredictionInputs> predictionInputs() {
        return onSession(() -> new PredictionInputs(context.recentOperations(), context.elementStates()));
    }

    /**
     * Stop accepting work. Operations already queued still run; an automatic
     * resolution in progress stops at its next attempt boundary.
     */
    public CompletableFuture<Void> close() {
        if (closed) {
            return CompletableFuture.completedFuture(null);
        }
        closed = true;
        return CompletableFuture.runAsync(() -> {
            tracker.forget(whiteboardId);
            log.fine(() -> "closed whiteboard session " + whiteboardId + " after " + processed + " operation(s)");
        }, serial);
    }

    // ---------- session thread ----------

    private ProcessingOutcome process(Operation op) {
        if (op != null && op.id() != null && deduper.isDuplicate(op.id())) {
            return new ProcessingOutcome.Duplicate(op.id());
        }

        TransformResult result;
        try {
            result = engine.transformOperation(op, context);
        } catch (OperationValidationException e) {
            log.log(Level.FINE, e.getMessage());
            return new ProcessingOutcome.Rejected(e.operationId(), e.violations());
        }
        if (result.duplicate()) {
            return new ProcessingOutcome.Duplicate(result.transformedOperation().id());
        }
        deduper.remember(result.transformedOperation().id());

        var resolutions = new ArrayList<ResolutionOutcome>(result.conflicts().size());
        for (Conflict c : result.conflicts()) {
            resolution.conflictDetected(c);
            resolutions.add(resolution.resolveConflictAutomatically(c, context, () -> closed));
        }

        if (++processed % PERFORMANCE_CHECK_EVERY == 0) {
            PerformanceReport report = analyzePerformance();
            if (report.hasHighSeverity()) {
                for (Bottleneck b : report.bottlenecks()) {
                    log.warning("whiteboard " + whiteboardId + ": " + b.kind() + " " + b.severity() + ": " + b.description());
                }
            }
        }
        return new ProcessingOutcome.Accepted(result, resolutions);
    }

    private PerformanceReport analyzePerformance() {
        return PerformanceAnalyzer.analyze(context.performance(), context.settings().performance());
    }

    private <T> CompletableFuture<T> onSession(Supplier<T> work) {
        if (closed) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("whiteboard session " + whiteboardId + " is closed"));
        }
        return CompletableFuture.supplyAsync(work, serial);
    }
}
