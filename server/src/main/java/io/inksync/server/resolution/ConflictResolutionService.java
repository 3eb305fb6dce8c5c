// file: server/src/main/java/io/inksync/server/resolution/ConflictResolutionService.java
package io.inksync.server.resolution;

import io.inksync.core.EngineSettings;
import io.inksync.core.Operation;
import io.inksync.core.conflict.Conflict;
import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.ResolutionStrategy;
import io.inksync.core.conflict.Severity;
import io.inksync.core.engine.TransformContext;
import io.inksync.core.error.AutomaticResolutionDisabledException;
import io.inksync.core.error.PersistenceException;
import io.inksync.core.error.ResolutionExhaustedException;
import io.inksync.core.error.RiskTooHighException;
import io.inksync.server.notify.AsyncDispatcher;
import io.inksync.server.notify.ConflictNotification;
import io.inksync.storage.AuditAction;
import io.inksync.storage.AuditRecord;
import io.inksync.storage.ConflictAuditLog;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives conflicts from detection to a resolution, automatic or manual.
 * <p>
 * Responsibilities:
 *  - Analyze conflicts and run the bounded automatic attempt loop.
 *  - Hold the pending manual interventions and expire stale ones.
 *  - Append audit records and notify users through the {@link AsyncDispatcher}.
 *  - Derive analytics from the audit log.
 * <p>
 * Implementation notes:
 *  - Automatic resolution is an explicit loop over [recommended, alternatives...]
 *    capped at maxAutomaticResolutionAttempts; it always terminates.
 *  - Strategies only propose an operation. The service records the outcome in the
 *    {@link TransformContext}; the caller must be the context's single writer.
 *  - One service instance is shared by every whiteboard session, so its own
 *    state is guarded by this.
 */
public final class ConflictResolutionService {
    private static final Logger log = Logger.getLogger(ConflictResolutionService.class.getName());

    private final EngineSettings.Resolution settings;
    private final ResolutionStrategyRegistry registry;
    private final ConflictAnalyzer analyzer;
    private final AsyncDispatcher dispatcher;
    private final ConflictAuditLog auditLog;
    private final Clock clock;

    // guarded by this
    private final Map<String, Tracked> tracked = new LinkedHashMap<>();
    private final Map<String, ManualIntervention> pending = new LinkedHashMap<>();
    private final Map<String, Set<String>> acknowledgements = new HashMap<>();

    private record Tracked(Conflict conflict, ResolutionState state) {}

    public ConflictResolutionService(EngineSettings.Resolution settings,
                                     ResolutionStrategyRegistry registry,
                                     AsyncDispatcher dispatcher,
                                     ConflictAuditLog auditLog,
                                     Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.analyzer = new ConflictAnalyzer(settings, registry);
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Start tracking a freshly detected conflict and audit it. */
    public void conflictDetected(Conflict conflict) {
        synchronized (this) {
            tracked.put(conflict.id(), new Tracked(conflict, ResolutionState.DETECTED));
        }
        dispatcher.audit(AuditRecord.of(conflict, AuditAction.CONFLICT_DETECTED, null, true,
                conflict.type() + "/" + conflict.severity(), clock.millis()));
    }

    public ResolutionRecommendation analyzeConflict(Conflict conflict) {
        return analyzer.analyze(conflict);
    }

    public ResolutionOutcome resolveConflictAutomatically(Conflict conflict, TransformContext context) {
        return resolveConflictAutomatically(conflict, context, () -> false);
    }

    /**
     * Try to settle {@code conflict} without a human.
     *
     * @param cancelled polled between attempts; a cancelled run leaves the conflict DETECTED
     * @return outcome describing the resolution or why none was produced; never throws for policy or strategy failures
     */
    public ResolutionOutcome resolveConflictAutomatically(Conflict conflict,
                                                          TransformContext context,
                                                          BooleanSupplier cancelled) {
        Objects.requireNonNull(conflict, "conflict");
        Objects.requireNonNull(context, "context");

        if (!settings.automaticResolutionEnabled()) {
            var error = new AutomaticResolutionDisabledException(conflict.id());
            requestManualIntervention(conflict, null);
            return ResolutionOutcome.manual(conflict.id(), error, List.of(),
                    ResolutionState.RESOLVED_MANUAL_PENDING);
        }

        transition(conflict, ResolutionState.ANALYZING);
        ResolutionRecommendation rec = analyzer.analyze(conflict);

        if (rec.risk() == RiskLevel.HIGH || rec.recommendsManual()) {
            var error = new RiskTooHighException(conflict.id(), rec.reasoning());
            log.info(error.getMessage());
            requestManualIntervention(conflict, rec);
            return ResolutionOutcome.manual(conflict.id(), error, List.of(),
                    ResolutionState.RESOLVED_MANUAL_PENDING);
        }

        List<ResolutionStrategy> candidates = candidates(rec);
        var history = new ArrayList<String>();

        for (int attempt = 0; attempt < candidates.size(); attempt++) {
            if (attempt > 0 && cancelled.getAsBoolean()) {
                transition(conflict, ResolutionState.DETECTED);
                log.fine(() -> "resolution of " + conflict.id() + " cancelled after " + history.size() + " attempt(s)");
                return ResolutionOutcome.cancelled(conflict.id(), history);
            }
            ResolutionStrategy strategy = candidates.get(attempt);
            Optional<Operation> resolution = attempt(strategy, conflict, context, history);
            if (resolution.isPresent()) {
                return succeed(conflict, context, strategy, resolution.get(), history);
            }
        }

        var error = new ResolutionExhaustedException(conflict.id(), history);
        log.warning(error.getMessage());
        context.resolveConflict(conflict.id(), rec.strategy(), false);
        transition(conflict, ResolutionState.FAILED);
        dispatcher.audit(AuditRecord.of(conflict, AuditAction.RESOLUTION_FAILED, rec.strategy(), true,
                String.join("; ", history), clock.millis()));
        requestManualIntervention(conflict, rec);
        return ResolutionOutcome.manual(conflict.id(), error, history, ResolutionState.FAILED);
    }

    /**
     * Park {@code conflict} for human review and tell the involved users.
     *
     * @param recommendation analysis to show the reviewer, may be null
     */
    public ManualIntervention requestManualIntervention(Conflict conflict, ResolutionRecommendation recommendation) {
        long now = clock.millis();
        ManualIntervention mi;
        synchronized (this) {
            ManualIntervention existing = pending.get(ManualIntervention.idFor(conflict.id()));
            if (existing != null) {
                return existing;
            }
            mi = ManualIntervention.pending(conflict, recommendation, now);
            pending.put(mi.id(), mi);
            Tracked t = tracked.get(conflict.id());
            if (t == null || t.state() != ResolutionState.FAILED) {
                tracked.put(conflict.id(), new Tracked(conflict, ResolutionState.RESOLVED_MANUAL_PENDING));
            }
        }
        List<ResolutionStrategy> alternatives = recommendation == null
                ? List.of()
                : recommendation.alternatives().stream().map(AlternativeStrategy::strategy).toList();
        dispatcher.audit(AuditRecord.of(conflict, AuditAction.MANUAL_INTERVENTION_REQUESTED,
                ResolutionStrategy.MANUAL, false,
                recommendation == null ? null : recommendation.reasoning(), now));
        dispatcher.notifyUsers(new ConflictNotification(conflict.id(), conflict.whiteboardId(),
                List.copyOf(conflict.involvedUsers()), ConflictNotification.Kind.MANUAL_REVIEW_PENDING,
                "conflict on " + conflict.affectedElementIds() + " is pending manual review",
                alternatives, now));
        return mi;
    }

    public synchronized List<ManualIntervention> getPendingManualInterventions() {
        return List.copyOf(pending.values());
    }

    /**
     * Settle a pending intervention.
     *
     * @param resolution operation chosen by the reviewer, may be null (keep the current state)
     * @return the completed intervention, empty if the id is unknown or no longer pending
     */
    public Optional<ManualIntervention> completeManualIntervention(String interventionId,
                                                                   String resolvedBy,
                                                                   Operation resolution) {
        Objects.requireNonNull(resolvedBy, "resolvedBy");
        long now = clock.millis();
        ManualIntervention done;
        synchronized (this) {
            ManualIntervention mi = pending.remove(interventionId);
            if (mi == null) {
                return Optional.empty();
            }
            done = mi.completed(resolvedBy, resolution, now);
            tracked.remove(mi.conflict().id());
            acknowledgements.remove(mi.conflict().id());
        }
        Conflict c = done.conflict();
        dispatcher.audit(AuditRecord.of(c, AuditAction.MANUAL_INTERVENTION_COMPLETED, ResolutionStrategy.MANUAL,
                false, "resolved by " + resolvedBy, now));
        dispatcher.notifyUsers(new ConflictNotification(c.id(), c.whiteboardId(), List.copyOf(c.involvedUsers()),
                ConflictNotification.Kind.MANUAL_REVIEW_COMPLETED, "conflict resolved by " + resolvedBy,
                List.of(), now));
        return Optional.of(done);
    }

    /**
     * Expire interventions pending for at least conflictTimeoutMs.
     *
     * @return the interventions that expired in this call
     */
    public List<ManualIntervention> expireStaleInterventions() {
        long now = clock.millis();
        var expired = new ArrayList<ManualIntervention>();
        synchronized (this) {
            var it = pending.values().iterator();
            while (it.hasNext()) {
                ManualIntervention mi = it.next();
                if (now - mi.requestedAtMillis() >= settings.conflictTimeoutMs()) {
                    it.remove();
                    tracked.remove(mi.conflict().id());
                    acknowledgements.remove(mi.conflict().id());
                    expired.add(mi.expired(now));
                }
            }
        }
        for (ManualIntervention mi : expired) {
            Conflict c = mi.conflict();
            log.info("manual intervention " + mi.id() + " expired after " + (now - mi.requestedAtMillis()) + " ms");
            dispatcher.audit(AuditRecord.of(c, AuditAction.MANUAL_INTERVENTION_EXPIRED, ResolutionStrategy.MANUAL,
                    false, "timed out", now));
            dispatcher.notifyUsers(new ConflictNotification(c.id(), c.whiteboardId(),
                    List.copyOf(c.involvedUsers()), ConflictNotification.Kind.MANUAL_REVIEW_EXPIRED,
                    "manual review timed out", List.of(), now));
        }
        return expired;
    }

    /**
     * Mark a user's notification about {@code conflictId} as seen.
     *
     * @return false if the user had already acknowledged it
     */
    public synchronized boolean acknowledgeNotification(String conflictId, String userId) {
        return acknowledgements.computeIfAbsent(conflictId, k -> new LinkedHashSet<>()).add(userId);
    }

    public synchronized Set<String> acknowledgedBy(String conflictId) {
        return Set.copyOf(acknowledgements.getOrDefault(conflictId, Set.of()));
    }

    /**
     * Drop everything held for a whiteboard whose session closed: tracked conflicts,
     * pending interventions and acknowledgements. Nothing is audited; the
     * interventions are discarded, not expired.
     *
     * @return how many conflicts were dropped
     */
    public int forgetWhiteboard(String whiteboardId) {
        Objects.requireNonNull(whiteboardId, "whiteboardId");
        int dropped = 0;
        synchronized (this) {
            var conflictIds = new HashSet<String>();
            var it = tracked.values().iterator();
            while (it.hasNext()) {
                Conflict c = it.next().conflict();
                if (whiteboardId.equals(c.whiteboardId())) {
                    conflictIds.add(c.id());
                    it.remove();
                }
            }
            var mis = pending.values().iterator();
            while (mis.hasNext()) {
                Conflict c = mis.next().conflict();
                if (whiteboardId.equals(c.whiteboardId())) {
                    conflictIds.add(c.id());
                    mis.remove();
                }
            }
            // conflict ids are prefixed with their whiteboard id
            String prefix = whiteboardId + ":";
            acknowledgements.keySet().removeIf(id -> conflictIds.contains(id) || id.startsWith(prefix));
            dropped = conflictIds.size();
        }
        if (dropped > 0) {
            log.info("forgot " + dropped + " unsettled conflict(s) of closed whiteboard " + whiteboardId);
        }
        return dropped;
    }

    /** Conflicts on {@code whiteboardId} that are detected, being analyzed, waiting for review or failed. */
    public synchronized List<Conflict> getActiveConflicts(String whiteboardId) {
        return tracked.values().stream()
                .map(Tracked::conflict)
                .filter(c -> whiteboardId.equals(c.whiteboardId()))
                .toList();
    }

    public synchronized Optional<ResolutionState> stateOf(String conflictId) {
        return Optional.ofNullable(tracked.get(conflictId)).map(Tracked::state);
    }

    /**
     * Aggregate the audit trail.
     *
     * @param whiteboardId restrict to one whiteboard, null for all
     * @param range        restrict to records in the range, null for all time
     */
    public ConflictAnalytics getConflictAnalytics(String whiteboardId, TimeRange range) {
        TimeRange r = range == null ? TimeRange.all() : range;
        List<AuditRecord> records;
        try {
            records = auditLog.readAll();
        } catch (PersistenceException e) {
            log.log(Level.WARNING, "conflict analytics degraded: audit log unreadable", e);
            return ConflictAnalytics.degraded(whiteboardId, r, e.getMessage());
        }

        // conflictId -> records in append order
        var byConflict = new LinkedHashMap<String, List<AuditRecord>>();
        for (AuditRecord rec : records) {
            if (whiteboardId != null && !whiteboardId.equals(rec.whiteboardId())) continue;
            if (!r.contains(rec.timestampMillis())) continue;
            byConflict.computeIfAbsent(rec.conflictId(), k -> new ArrayList<>()).add(rec);
        }

        var byType = new EnumMap<ConflictType, Long>(ConflictType.class);
        var bySeverity = new EnumMap<Severity, Long>(Severity.class);
        var users = new TreeMap<String, Long>();
        var hours = new TreeMap<Integer, Long>();
        var days = new TreeMap<String, Long>();
        long resolved = 0;
        long automatic = 0;
        long resolutionMillisSum = 0;
        long resolutionMillisCount = 0;

        for (List<AuditRecord> trail : byConflict.values()) {
            AuditRecord first = trail.get(0);
            if (first.conflictType() != null) byType.merge(first.conflictType(), 1L, Long::sum);
            if (first.severity() != null) bySeverity.merge(first.severity(), 1L, Long::sum);
            for (String u : first.userIds()) users.merge(u, 1L, Long::sum);

            var at = Instant.ofEpochMilli(first.timestampMillis()).atZone(ZoneOffset.UTC);
            hours.merge(at.getHour(), 1L, Long::sum);
            days.merge(at.toLocalDate().toString(), 1L, Long::sum);

            for (AuditRecord rec : trail) {
                if (!rec.action().isTerminal()) continue;
                resolved++;
                if (rec.action() == AuditAction.RESOLUTION_SUCCEEDED && rec.automatic()) automatic++;
                if (rec.resolutionMillis() != null) {
                    resolutionMillisSum += rec.resolutionMillis();
                    resolutionMillisCount++;
                }
                break;
            }
        }

        long total = byConflict.size();
        var peakHours = new ArrayList<ConflictAnalytics.HourCount>();
        hours.forEach((h, n) -> peakHours.add(new ConflictAnalytics.HourCount(h, n)));
        peakHours.sort(Comparator.comparingLong(ConflictAnalytics.HourCount::count).reversed()
                .thenComparingInt(ConflictAnalytics.HourCount::hourUtc));
        var trend = new ArrayList<ConflictAnalytics.DayCount>();
        days.forEach((d, n) -> trend.add(new ConflictAnalytics.DayCount(d, n)));

        return new ConflictAnalytics(
                whiteboardId,
                r,
                total,
                byType,
                bySeverity,
                resolutionMillisCount == 0 ? 0.0 : (double) resolutionMillisSum / resolutionMillisCount,
                total == 0 ? 0.0 : (double) resolved / total,
                total == 0 ? 0.0 : (double) automatic / total,
                users,
                peakHours,
                trend,
                false,
                null
        );
    }

    // ---------- internals ----------

    private List<ResolutionStrategy> candidates(ResolutionRecommendation rec) {
        var ordered = new LinkedHashSet<ResolutionStrategy>();
        ordered.add(rec.strategy());
        for (AlternativeStrategy alt : rec.alternatives()) {
            ordered.add(alt.strategy());
        }
        return new ArrayList<>(ordered).subList(0, Math.min(ordered.size(), settings.maxAutomaticResolutionAttempts()));
    }

    private Optional<Operation> attempt(ResolutionStrategy strategy, Conflict conflict,
                                        TransformContext context, List<String> history) {
        Optional<ResolutionStrategyHandler> handler = registry.handlerFor(strategy);
        if (handler.isEmpty()) {
            history.add(strategy + ": no handler registered");
            return Optional.empty();
        }
        if (!handler.get().supports(conflict)) {
            history.add(strategy + ": not applicable to " + conflict.type());
            return Optional.empty();
        }
        try {
            Optional<Operation> result = handler.get().resolve(conflict, context);
            history.add(strategy + (result.isPresent() ? ": resolved" : ": no resolution"));
            return result;
        } catch (RuntimeException e) {
            history.add(strategy + ": failed: " + e.getMessage());
            log.log(Level.FINE, "strategy " + strategy + " failed for " + conflict.id(), e);
            return Optional.empty();
        }
    }

    private ResolutionOutcome succeed(Conflict conflict, TransformContext context, ResolutionStrategy strategy,
                                      Operation resolution, List<String> history) {
        long now = clock.millis();
        context.resolveConflict(conflict.id(), strategy, true);
        synchronized (this) {
            tracked.remove(conflict.id());
        }
        dispatcher.audit(AuditRecord.of(conflict, AuditAction.RESOLUTION_SUCCEEDED, strategy, true,
                "resolution " + resolution.id(), now));
        dispatcher.notifyUsers(new ConflictNotification(conflict.id(), conflict.whiteboardId(),
                List.copyOf(conflict.involvedUsers()), ConflictNotification.Kind.RESOLVED_AUTOMATICALLY,
                "conflict resolved automatically using " + strategy, List.of(), now));
        log.fine(() -> "resolved " + conflict.id() + " with " + strategy + " after " + history.size() + " attempt(s)");
        return ResolutionOutcome.resolved(conflict.id(), resolution, strategy, history);
    }

    private synchronized void transition(Conflict conflict, ResolutionState state) {
        tracked.put(conflict.id(), new Tracked(conflict, state));
    }
}
