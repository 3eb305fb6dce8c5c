// file: core/src/main/java/io/inksync/core/engine/TransformContext.java
package io.inksync.core.engine;

import io.inksync.core.ElementState;
import io.inksync.core.EngineSettings;
import io.inksync.core.Operation;
import io.inksync.core.VectorClock;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ResolutionStrategy;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Working state of one whiteboard's transform pipeline.
 * <p>
 * Holds:
 *  - canvas version, merged vector clock and Lamport counter,
 *  - the causally ordered pending queue and the recency window,
 *  - element snapshots: committed base states plus live states that include
 *    every pending operation,
 *  - active (unresolved) conflicts, a bounded history and the pairs already reported,
 *  - per-user priority weights, rolling metrics and the adaptive throttle.
 * <p>
 * Lifecycle: created when a whiteboard session opens, mutated in place by the
 * transform engine, discarded when the session ends.
 * <p>
 * Not thread-safe. Exactly one worker (the whiteboard's session) may mutate it;
 * {@link #performance()} is the only method meant for other threads.
 */
public final class TransformContext {

    private final String whiteboardId;
    private final EngineSettings settings;
    private final Clock clock;

    private final PendingOperationQueue pending = new PendingOperationQueue();
    private final RecentOperationWindow window;
    private final Map<String, ElementState> baseStates = new HashMap<>();
    private final Map<String, ElementState> liveStates = new HashMap<>();

    private final LinkedHashMap<String, Conflict> activeConflicts = new LinkedHashMap<>();
    private final ArrayDeque<Conflict> conflictHistory = new ArrayDeque<>();
    private final LinkedHashSet<String> recordedPairs = new LinkedHashSet<>();
    private final int maxRecordedPairs;

    private final Map<String, Double> userPriorities = new HashMap<>();
    private final Set<String> activeUsers = new LinkedHashSet<>();
    private final PerformanceMetrics metrics = new PerformanceMetrics();
    private final AdaptiveThrottle throttle;

    private volatile long canvasVersion;
    private volatile int queueSize;
    private volatile int activeConflictCount;
    private VectorClock vectorClock = VectorClock.empty();
    private long lamportClock;
    private int compressionWatermark;

    public TransformContext(String whiteboardId, EngineSettings settings, Clock clock) {
        this.whiteboardId = Objects.requireNonNull(whiteboardId, "whiteboardId");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        var d = settings.detection();
        this.window = new RecentOperationWindow(d.recencyWindowMs(), d.recencyWindowMaxOperations());
        this.maxRecordedPairs = d.recencyWindowMaxOperations() * 4;
        this.throttle = new AdaptiveThrottle(settings.performance().targetLatencyMs());
    }

    // ---------- read side ----------

    public String whiteboardId() { return whiteboardId; }

    public EngineSettings settings() { return settings; }

    public Clock clock() { return clock; }

    public long canvasVersion() { return canvasVersion; }

    public VectorClock vectorClock() { return vectorClock; }

    public long lamportClock() { return lamportClock; }

    public AdaptiveThrottle throttle() { return throttle; }

    /** Pending operations in causal order. */
    public List<Operation> pendingOperations() {
        return pending.snapshot();
    }

    public int pendingSize() {
        return pending.size();
    }

    public int positionOf(String operationId) {
        return pending.positionOf(operationId);
    }

    public Optional<ElementState> elementState(String elementId) {
        return Optional.ofNullable(liveStates.get(elementId));
    }

    /** Immutable copy of all live element states, safe to hand to other threads. */
    public Map<String, ElementState> elementStates() {
        return Map.copyOf(liveStates);
    }

    public List<Operation> recentOperations() {
        return window.operations(clock.millis());
    }

    public List<Conflict> activeConflicts() {
        return List.copyOf(activeConflicts.values());
    }

    public Optional<Conflict> activeConflict(String conflictId) {
        return Optional.ofNullable(activeConflicts.get(conflictId));
    }

    /** Most recent last. */
    public List<Conflict> conflictHistory() {
        return List.copyOf(conflictHistory);
    }

    public boolean isPairRecorded(String pairKey) {
        return recordedPairs.contains(pairKey);
    }

    /** Ids of operations referenced by unresolved conflicts; never compressed away. */
    public Set<String> protectedOperationIds() {
        var ids = new LinkedHashSet<String>();
        for (Conflict c : activeConflicts.values()) {
            ids.addAll(c.operationIds());
        }
        return ids;
    }

    /** Resolution tie-break weight, 1.0 unless configured. */
    public double userPriority(String userId) {
        return userPriorities.getOrDefault(userId, 1.0);
    }

    public Map<String, Double> userPriorities() {
        return Collections.unmodifiableMap(userPriorities);
    }

    public void setUserPriority(String userId, double weight) {
        Objects.requireNonNull(userId, "userId");
        if (!(weight >= 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("priority weight must be a finite value >= 0, got " + weight);
        }
        userPriorities.put(userId, weight);
    }

    public PerformanceSnapshot performance() {
        return metrics.snapshot(queueSize, activeConflictCount, activeUsers.size(),
                throttle.recommendedOpsPerSecond(), clock.millis());
    }

    // ---------- resolution feedback ----------

    /**
     * Record the outcome of a resolution attempt for an active conflict.
     * A successful one moves the conflict to history as resolved; a failed
     * one keeps it active (pending manual review) and still counts toward
     * the resolution success rate.
     *
     * @return the resolved conflict, empty on failure or unknown id
     */
    public Optional<Conflict> resolveConflict(String conflictId, ResolutionStrategy strategy, boolean success) {
        Conflict c = activeConflicts.get(conflictId);
        if (c == null) {
            return Optional.empty();
        }
        metrics.recordResolution(success);
        if (!success) {
            return Optional.empty();
        }
        activeConflicts.remove(conflictId);
        activeConflictCount = activeConflicts.size();
        Conflict resolved = c.resolved(strategy, clock.millis());
        appendHistory(resolved);
        return Optional.of(resolved);
    }

    /**
     * Drop an active conflict nobody will resolve any more, e.g. when its manual
     * review timed out. Its operations become compressible again. It is not
     * counted as a resolution attempt; the history keeps it unresolved.
     *
     * @return the dropped conflict, empty for an unknown id
     */
    public Optional<Conflict> abandonConflict(String conflictId) {
        Conflict c = activeConflicts.remove(conflictId);
        if (c == null) {
            return Optional.empty();
        }
        activeConflictCount = activeConflicts.size();
        return Optional.of(c);
    }

    // ---------- engine side (package-private) ----------

    PendingOperationQueue pending() {
        return pending;
    }

    RecentOperationWindow window() {
        return window;
    }

    PerformanceMetrics metrics() {
        return metrics;
    }

    void observeClock(VectorClock merged, long operationLamport) {
        vectorClock = merged;
        lamportClock = Math.max(lamportClock, operationLamport) + 1;
    }

    void recordConflicts(List<Conflict> conflicts) {
        for (Conflict c : conflicts) {
            recordedPairs.add(Conflict.pairKey(c.operations().get(0).id(), c.operations().get(1).id()));
            activeConflicts.put(c.id(), c);
            appendHistory(c);
        }
        Iterator<String> it = recordedPairs.iterator();
        while (recordedPairs.size() > maxRecordedPairs && it.hasNext()) {
            it.next();
            it.remove();
        }
        activeConflictCount = activeConflicts.size();
    }

    void recordAccepted(Operation op) {
        activeUsers.add(op.userId());
        canvasVersion++;
        queueSize = pending.size();
    }

    /** Refresh the live state of the operation's element after it was queued. */
    void refreshElement(Operation placed) {
        String elementId = placed.elementId();
        if (pending.isLastForElement(placed)) {
            liveStates.put(elementId, liveOrBase(elementId).apply(placed));
        } else {
            // Out-of-order arrival: rebuild from the committed base in causal order.
            liveStates.put(elementId, ElementState.replay(baseOf(elementId), pending.operationsFor(elementId)));
        }
    }

    /**
     * Commit the head of the queue into the base states.
     *
     * @return the committed operation, empty if the queue is empty
     */
    Optional<Operation> commitHead() {
        Optional<Operation> head = pending.pollFirst();
        head.ifPresent(op -> {
            baseStates.put(op.elementId(), baseOf(op.elementId()).apply(op));
            queueSize = pending.size();
        });
        return head;
    }

    int compressionWatermark() {
        return compressionWatermark;
    }

    void setCompressionWatermark(int size) {
        compressionWatermark = size;
    }

    void replacePending(List<Operation> ops) {
        pending.replaceAll(ops);
        queueSize = pending.size();
    }

    private ElementState baseOf(String elementId) {
        return baseStates.getOrDefault(elementId, ElementState.absent(elementId));
    }

    private ElementState liveOrBase(String elementId) {
        ElementState live = liveStates.get(elementId);
        return live != null ? live : baseOf(elementId);
    }

    private void appendHistory(Conflict c) {
        conflictHistory.addLast(c);
        while (conflictHistory.size() > settings.detection().maxConflictHistory()) {
            conflictHistory.pollFirst();
        }
    }

    /** Users seen on this whiteboard, in order of first appearance. */
    public List<String> activeUsers() {
        return new ArrayList<>(activeUsers);
    }
}
