// file: server/src/main/java/io/inksync/server/session/SerialExecutor.java
package io.inksync.server.session;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 * <p>
 * Implementation notes:
 *  - At most one task of this executor is on the delegate at any time; the next one
 *    is scheduled when the running one finishes.
 *  - Many SerialExecutors can share one pool: each whiteboard is single-writer,
 *    different whiteboards proceed in parallel.
 *  - A task that throws is logged and does not stop later tasks.
 */
final class SerialExecutor implements Executor {
    private static final Logger log = Logger.getLogger(SerialExecutor.class.getName());

    private final Executor delegate;
    private final String name;

    // guarded by this
    private final ArrayDeque<Runnable> tasks = new ArrayDeque<>();
    private Runnable active;

    SerialExecutor(Executor delegate, String name) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public synchronized void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        tasks.add(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "task failed on " + name, e);
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            try {
                delegate.execute(active);
            } catch (RejectedExecutionException e) {
                active = null;
                tasks.clear();
                throw e;
            }
        }
    }

    synchronized int queued() {
        return tasks.size();
    }
}
