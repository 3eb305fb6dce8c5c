// file: server/src/main/java/io/inksync/server/session/WhiteboardSessionRegistry.java
package io.inksync.server.session;

import io.inksync.core.EngineSettings;
import io.inksync.core.VectorClockTracker;
import io.inksync.core.engine.TransformEngine;
import io.inksync.server.resolution.ConflictResolutionService;
import io.inksync.server.resolution.ManualIntervention;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates, finds and closes {@link WhiteboardSession}s.
 * <p>
 * Responsibilities:
 *  - One session per whiteboard id, created on first use.
 *  - One worker pool shared by all sessions; each session stays single-writer.
 *  - A maintenance scheduler that expires stale manual interventions.
 * <p>
 * Implementation notes:
 *  - Sessions share one {@link TransformEngine} and {@link VectorClockTracker};
 *    the tracker keys its state by whiteboard id.
 */
public final class WhiteboardSessionRegistry implements AutoCloseable {
    private static final Logger log = Logger.getLogger(WhiteboardSessionRegistry.class.getName());

    private final TransformEngine engine;
    private final VectorClockTracker tracker;
    private final ConflictResolutionService resolution;
    private final EngineSettings settings;
    private final Duration dedupeTtl;
    private final Clock clock;
    private final Executor workers;
    private final ExecutorService ownedWorkers; // null when supplied by the caller
    private final ScheduledExecutorService maintenance;

    private final Map<String, WhiteboardSession> sessions = new ConcurrentHashMap<>();
    private volatile boolean started = false;

    public WhiteboardSessionRegistry(EngineSettings settings,
                                     ConflictResolutionService resolution,
                                     Duration dedupeTtl,
                                     Clock clock) {
        this(settings, resolution, dedupeTtl, clock, newWorkerPool(), true);
    }

    /** Run sessions on a caller-supplied executor (tests pass {@code Runnable::run}). */
    public WhiteboardSessionRegistry(EngineSettings settings,
                                     ConflictResolutionService resolution,
                                     Duration dedupeTtl,
                                     Clock clock,
                                     Executor workers) {
        this(settings, resolution, dedupeTtl, clock, workers, false);
    }

    private WhiteboardSessionRegistry(EngineSettings settings,
                                      ConflictResolutionService resolution,
                                      Duration dedupeTtl,
                                      Clock clock,
                                      Executor workers,
                                      boolean own) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.resolution = Objects.requireNonNull(resolution, "resolution");
        this.dedupeTtl = Objects.requireNonNull(dedupeTtl, "dedupeTtl");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.ownedWorkers = own ? (ExecutorService) workers : null;
        this.tracker = new VectorClockTracker();
        this.engine = new TransformEngine(tracker, settings, clock);
        this.maintenance = Executors.newSingleThreadScheduledExecutor(daemon("inksync-maintenance"));
    }

    /** Start the periodic expiry of stale manual interventions. */
    public void start() {
        if (started) {
            return;
        }
        started = true;
        long period = Math.max(1_000L, settings.resolution().conflictTimeoutMs() / 4);
        maintenance.scheduleAtFixedRate(this::expireInterventions, period, period, TimeUnit.MILLISECONDS);
    }

    public WhiteboardSession sessionFor(String whiteboardId) {
        Objects.requireNonNull(whiteboardId, "whiteboardId");
        return sessions.computeIfAbsent(whiteboardId, id -> {
            log.info("opening whiteboard session " + id);
            return new WhiteboardSession(id, engine, tracker, resolution,
                    new OperationIdDeduper(dedupeTtl, clock), workers);
        });
    }

    public Optional<WhiteboardSession> find(String whiteboardId) {
        return Optional.ofNullable(sessions.get(whiteboardId));
    }

    public List<String> whiteboardIds() {
        return List.copyOf(sessions.keySet());
    }

    /**
     * Close and forget the session; a later sessionFor() starts from an empty whiteboard.
     * Once queued work has drained, the resolution service drops the whiteboard's
     * unsettled conflicts and interventions.
     */
    public CompletableFuture<Void> close(String whiteboardId) {
        WhiteboardSession s = sessions.remove(whiteboardId);
        if (s == null) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("closing whiteboard session " + whiteboardId);
        return s.close().thenRun(() -> {
            if (!sessions.containsKey(whiteboardId)) {
                resolution.forgetWhiteboard(whiteboardId);
            }
        });
    }

    /** Close every session, wait up to {@code timeout} for queued work, then stop the threads. */
    public void shutdown(Duration timeout) {
        maintenance.shutdownNow();
        var closing = new ArrayList<CompletableFuture<Void>>();
        for (String id : List.copyOf(sessions.keySet())) {
            closing.add(close(id));
        }
        try {
            CompletableFuture.allOf(closing.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.log(Level.WARNING, "sessions did not close cleanly within " + timeout, e);
        }
        if (ownedWorkers != null) {
            ownedWorkers.shutdown();
            try {
                if (!ownedWorkers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    ownedWorkers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ownedWorkers.shutdownNow();
            }
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    /** Expire stale interventions and drop their conflicts from the owning sessions. */
    List<ManualIntervention> expireInterventions() {
        try {
            List<ManualIntervention> expired = resolution.expireStaleInterventions();
            for (ManualIntervention mi : expired) {
                find(mi.conflict().whiteboardId()).ifPresent(s -> s.interventionExpired(mi));
            }
            if (!expired.isEmpty()) {
                log.info("expired " + expired.size() + " stale manual intervention(s)");
            }
            return expired;
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "error while expiring manual interventions", e);
            return List.of();
        }
    }

    private static ExecutorService newWorkerPool() {
        int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(threads, daemon("inksync-worker"));
    }

    private static ThreadFactory daemon(String prefix) {
        var seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
