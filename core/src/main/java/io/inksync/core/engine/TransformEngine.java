// file: core/src/main/java/io/inksync/core/engine/TransformEngine.java
package io.inksync.core.engine;

import io.inksync.core.EngineSettings;
import io.inksync.core.Operation;
import io.inksync.core.VectorClock;
import io.inksync.core.VectorClockTracker;
import io.inksync.core.compress.CompressionStats;
import io.inksync.core.compress.OperationCompressor;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ConflictDetector;
import io.inksync.core.error.OperationValidationException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Orchestrates one incoming operation against a whiteboard's transform context.
 * <p>
 * Steps of {@link #transformOperation}:
 *  1. Validate structure; a malformed operation is rejected on its own.
 *  2. Merge its clock into the whiteboard clock via the tracker.
 *  3. Insert it into the pending queue at its causal position (not necessarily
 *     the tail), lifting Lamport stamps where clients sent inconsistent ones.
 *  4. Run the detector against the recency window only.
 *  5. Refresh element state, update metrics and the throttle, and return.
 * <p>
 * Housekeeping after step 5:
 *  - queue above maxQueueSize: the oldest entries are committed to the base states;
 *  - queue above the compression trigger: the queue is compressed, keeping
 *    operations referenced by unresolved conflicts.
 * <p>
 * The engine itself is stateless apart from the shared clock tracker and may
 * serve many contexts; each context must only be used by one thread at a time.
 */
public final class TransformEngine {

    private static final Logger log = Logger.getLogger(TransformEngine.class.getName());

    private final VectorClockTracker tracker;
    private final EngineSettings settings;
    private final ConflictDetector detector;
    private final OperationCompressor compressor;
    private final OperationValidator validator = new OperationValidator();
    private final Clock clock;

    public TransformEngine(VectorClockTracker tracker, EngineSettings settings, Clock clock) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.detector = new ConflictDetector(settings.detection(), clock);
        this.compressor = new OperationCompressor(settings.compression().maxRunLength());
    }

    public TransformContext newContext(String whiteboardId) {
        return new TransformContext(whiteboardId, settings, clock);
    }

    /**
     * @throws OperationValidationException if the operation is malformed; the
     *         context is left untouched in that case
     */
    public TransformResult transformOperation(Operation op, TransformContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        long start = System.nanoTime();

        Operation valid = validator.validate(op);

        if (ctx.pending().contains(valid.id())) {
            var existing = ctx.pending().insert(valid);
            return new TransformResult(existing.operation(), existing.position(), List.of(), ctx.performance(), true);
        }

        VectorClock merged = tracker.observe(ctx.whiteboardId(), valid.vectorClock());
        ctx.observeClock(merged, valid.lamportTimestamp());

        var placement = ctx.pending().insert(valid);
        Operation placed = placement.operation();

        long now = clock.millis();
        List<Conflict> conflicts = detector.detect(
                ctx.whiteboardId(), placed, ctx.window().operations(now), ctx::isPairRecorded);
        ctx.recordConflicts(conflicts);
        ctx.window().add(placed, now);

        ctx.refreshElement(placed);
        ctx.recordAccepted(placed);
        enforceQueueBound(ctx);
        maybeCompress(ctx);

        double latencyMillis = (System.nanoTime() - start) / 1_000_000.0;
        ctx.metrics().recordOperation(latencyMillis, !conflicts.isEmpty(), now);
        ctx.throttle().adjust(ctx.metrics().latencyEwmaMillis());

        if (!conflicts.isEmpty() && log.isLoggable(Level.FINE)) {
            log.fine(String.format("whiteboard=%s op=%s position=%d conflicts=%d",
                    ctx.whiteboardId(), placed.id(), placement.position(), conflicts.size()));
        }
        return new TransformResult(placed, placement.position(), conflicts, ctx.performance(), false);
    }

    /**
     * Transform every operation in order. Malformed operations become
     * {@link TransformOutcome.Rejected} entries; the rest of the batch proceeds.
     */
    public List<TransformOutcome> transformBatch(List<Operation> ops, TransformContext ctx) {
        var out = new ArrayList<TransformOutcome>(ops.size());
        for (Operation op : ops) {
            try {
                out.add(new TransformOutcome.Accepted(transformOperation(op, ctx)));
            } catch (OperationValidationException e) {
                log.log(Level.FINE, e.getMessage());
                out.add(new TransformOutcome.Rejected(e.operationId(), e.violations()));
            }
        }
        return out;
    }

    /**
     * Compress the pending queue in place. Operations referenced by unresolved
     * conflicts are preserved.
     */
    public CompressionStats compressPending(TransformContext ctx) {
        List<Operation> before = ctx.pending().snapshot();
        List<Operation> after = compressor.compressOperations(before, ctx.protectedOperationIds());
        ctx.setCompressionWatermark(after.size());
        if (after.size() < before.size()) {
            ctx.replacePending(after);
            log.fine(() -> String.format("whiteboard=%s compressed pending queue %d -> %d",
                    ctx.whiteboardId(), before.size(), after.size()));
        }
        return compressor.stats(before, after);
    }

    /**
     * The gateway persisted everything up to and including {@code operationId}:
     * commit that prefix of the queue into the base element states.
     *
     * @return number of operations committed, 0 if the id is not pending
     */
    public int acknowledge(TransformContext ctx, String operationId) {
        if (!ctx.pending().contains(operationId)) {
            return 0;
        }
        int committed = 0;
        while (true) {
            var head = ctx.commitHead();
            if (head.isEmpty()) {
                break;
            }
            committed++;
            if (head.get().id().equals(operationId)) {
                break;
            }
        }
        return committed;
    }

    public OperationCompressor compressor() {
        return compressor;
    }

    private void enforceQueueBound(TransformContext ctx) {
        int max = settings.performance().maxQueueSize();
        int overflow = ctx.pending().size() - max;
        if (overflow <= 0) {
            return;
        }
        for (int i = 0; i < overflow; i++) {
            ctx.commitHead();
        }
        log.warning(String.format("whiteboard=%s pending queue exceeded %d, committed %d oldest operation(s)",
                ctx.whiteboardId(), max, overflow));
    }

    private void maybeCompress(TransformContext ctx) {
        var c = settings.compression();
        if (!c.enabled()) {
            return;
        }
        // Incompressible queues are only retried after they grew by a quarter of the trigger.
        int next = Math.max(c.triggerQueueSize(),
                ctx.compressionWatermark() + Math.max(1, c.triggerQueueSize() / 4));
        if (ctx.pending().size() >= next) {
            compressPending(ctx);
        }
    }
}
