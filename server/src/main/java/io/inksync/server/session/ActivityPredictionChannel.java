// file: server/src/main/java/io/inksync/server/session/ActivityPredictionChannel.java
package io.inksync.server.session;

import io.inksync.core.EngineSettings;
import io.inksync.core.cache.LruTtlCache;
import io.inksync.core.predict.ConflictPredictor;
import io.inksync.core.predict.Prediction;
import io.inksync.core.predict.UserActivity;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort feed of live user activity into the conflict predictor.
 * <p>
 * Responsibilities:
 *  - Coalesce the latest activity per user and whiteboard in a bounded LRU/TTL cache.
 *  - On a fixed period, sweep stale activity, snapshot each whiteboard between
 *    operations and pass the predictions to the {@link PredictionListener}.
 * <p>
 * Never on the acceptance path: publish() only touches the cache, and a failing
 * tick is logged and retried on the next period.
 */
public final class ActivityPredictionChannel {
    private static final Logger log = Logger.getLogger(ActivityPredictionChannel.class.getName());

    private final WhiteboardSessionRegistry sessions;
    private final ConflictPredictor predictor;
    private final PredictionListener listener;
    private final EngineSettings.Prediction settings;
    private final Clock clock;

    private final Map<String, LruTtlCache<String, UserActivity>> activity = new ConcurrentHashMap<>();
    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "inksync-prediction");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean started = false;

    public ActivityPredictionChannel(WhiteboardSessionRegistry sessions,
                                     ConflictPredictor predictor,
                                     PredictionListener listener,
                                     EngineSettings.Prediction settings,
                                     Clock clock) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.predictor = Objects.requireNonNull(predictor, "predictor");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Record the latest activity of a user; replaces the previous entry for that user. */
    public void publish(String whiteboardId, UserActivity update) {
        Objects.requireNonNull(update, "update");
        activity.computeIfAbsent(whiteboardId, id -> new LruTtlCache<>(
                settings.cacheCapacity(), Duration.ofMillis(settings.activityTtlMs()), clock))
                .set(update.userId(), update);
    }

    public void start() {
        if (started) {
            return;
        }
        started = true;
        exec.scheduleAtFixedRate(this::tick, settings.periodMs(), settings.periodMs(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        exec.shutdownNow();
    }

    int trackedUsers(String whiteboardId) {
        var cache = activity.get(whiteboardId);
        return cache == null ? 0 : cache.size();
    }

    void tick() {
        try {
            predictor.sweepExpired();
            for (var e : activity.entrySet()) {
                String whiteboardId = e.getKey();
                var cache = e.getValue();
                cache.sweepExpired();
                var session = sessions.find(whiteboardId);
                if (session.isEmpty() || session.get().isClosed()) {
                    activity.remove(whiteboardId);
                    continue;
                }
                if (cache.size() == 0) {
                    continue;
                }
                Map<String, UserActivity> live = cache.snapshot();
                session.get().predictionInputs()
                        .thenAccept(in -> deliver(whiteboardId,
                                predictor.predictConflicts(in.recentOperations(), live, in.elementStates())))
                        .exceptionally(err -> {
                            log.log(Level.WARNING, "prediction failed for whiteboard " + whiteboardId, err);
                            return null;
                        });
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "error during prediction tick", e);
        }
    }

    private void deliver(String whiteboardId, List<Prediction> predictions) {
        if (!predictions.isEmpty()) {
            listener.onPredictions(whiteboardId, predictions);
        }
    }
}
