// file: server/src/main/java/io/inksync/server/notify/AsyncDispatcher.java
package io.inksync.server.notify;

import io.inksync.core.error.PersistenceException;
import io.inksync.storage.AuditRecord;
import io.inksync.storage.ConflictAuditLog;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs audit appends and user notifications off the editing path.
 * <p>
 * Responsibilities:
 *  - Hand each audit record / notification to a background executor and return at once.
 *  - Log and count failures; a failing audit log or notifier never reaches the caller.
 * <p>
 * Records are dispatched in submission order when the executor is single-threaded
 * (the default), which keeps each conflict's audit trail ordered.
 */
public final class AsyncDispatcher implements AutoCloseable {
    private static final Logger log = Logger.getLogger(AsyncDispatcher.class.getName());

    private final ConflictAuditLog auditLog;
    private final ConflictNotifier notifier;
    private final Executor executor;
    private final ExecutorService owned; // null when the executor was supplied by the caller

    private final AtomicLong auditFailures = new AtomicLong();
    private final AtomicLong notificationFailures = new AtomicLong();

    /** Dispatch on a private single daemon thread. */
    public AsyncDispatcher(ConflictAuditLog auditLog, ConflictNotifier notifier) {
        this(auditLog, notifier, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "inksync-dispatch");
            t.setDaemon(true);
            return t;
        }), true);
    }

    /** Dispatch on a caller-supplied executor (tests pass {@code Runnable::run}). */
    public AsyncDispatcher(ConflictAuditLog auditLog, ConflictNotifier notifier, Executor executor) {
        this(auditLog, notifier, executor, false);
    }

    private AsyncDispatcher(ConflictAuditLog auditLog, ConflictNotifier notifier, Executor executor, boolean own) {
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.owned = own ? (ExecutorService) executor : null;
    }

    public void audit(AuditRecord record) {
        submit(() -> {
            try {
                auditLog.appendAuditRecord(record);
            } catch (PersistenceException e) {
                auditFailures.incrementAndGet();
                log.log(Level.WARNING, "audit append failed for conflict " + record.conflictId(), e);
            }
        }, auditFailures, "audit " + record.conflictId());
    }

    public void notifyUsers(ConflictNotification notification) {
        submit(() -> {
            try {
                notifier.notifyUsers(notification);
            } catch (RuntimeException e) {
                notificationFailures.incrementAndGet();
                log.log(Level.WARNING, "notification failed for conflict " + notification.conflictId(), e);
            }
        }, notificationFailures, "notification " + notification.conflictId());
    }

    public long auditFailures() {
        return auditFailures.get();
    }

    public long notificationFailures() {
        return notificationFailures.get();
    }

    /**
     * Stop accepting work and wait up to {@code timeout} for queued work to drain.
     * Supplied executors are left running; their owner shuts them down.
     */
    public void close(Duration timeout) {
        if (owned == null) {
            return;
        }
        owned.shutdown();
        try {
            if (!owned.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warning("dispatcher did not drain within " + timeout + ", dropping queued work");
                owned.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            owned.shutdownNow();
        }
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }

    private void submit(Runnable task, AtomicLong failures, String what) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            failures.incrementAndGet();
            log.log(Level.WARNING, "dispatcher rejected " + what + " (shutting down?)", e);
        }
    }
}
