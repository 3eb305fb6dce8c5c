// file: core/src/main/java/io/inksync/core/engine/PendingOperationQueue.java
package io.inksync.core.engine;

import io.inksync.core.CausalOrder;
import io.inksync.core.Operation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Causally ordered queue of operations not yet committed by the gateway.
 * <p>
 * Ordering:
 *  - Entries are keyed by (effectiveLamport, userId, operationId) in a sorted map;
 *    putting or re-keying one entry is O(log n).
 *  - Finding the causal predecessors and successors of an insert compares vector
 *    clocks with every queued entry, so an insert is O(n) overall. The queue is
 *    kept below performance.maxQueueSize by the engine.
 *  - effectiveLamport is the operation's own Lamport stamp, lifted when needed so
 *    that it is strictly greater than that of every queued causal predecessor.
 *    Well-behaved clients already satisfy this and are never lifted.
 *  - When an insert reveals that queued operations causally follow the new one
 *    but do not sort after it, those successors are lifted and re-keyed.
 * <p>
 * The lifted stamps are the least fixpoint of
 *   e(X) = max(lamport(X), max{ e(P) + 1 : P queued, P happened-before X })
 * which depends only on the set of queued operations, never on arrival order.
 * Operations whose clocks are concurrent keep the Lamport/user-id order.
 * <p>
 * Not thread-safe; owned by the whiteboard's transform context.
 */
public final class PendingOperationQueue {

    /** Sort key of a queued operation. */
    record OrderKey(long lamport, String userId, String operationId) implements Comparable<OrderKey> {
        static OrderKey of(Operation op) {
            return new OrderKey(op.lamportTimestamp(), op.userId(), op.id());
        }

        @Override
        public int compareTo(OrderKey o) {
            int c = Long.compare(lamport, o.lamport);
            if (c != 0) return c;
            c = userId.compareTo(o.userId);
            if (c != 0) return c;
            return operationId.compareTo(o.operationId);
        }
    }

    /**
     * Result of an insert.
     *
     * @param operation the queued (possibly Lamport-lifted) copy
     * @param position  zero-based index in causal order right after the insert
     * @param duplicate true when the id was already queued; nothing changed
     */
    public record Placement(Operation operation, int position, boolean duplicate) {}

    private final TreeMap<OrderKey, Operation> ordered = new TreeMap<>();
    private final Map<String, OrderKey> keysById = new HashMap<>();
    private final Map<String, TreeSet<OrderKey>> keysByElement = new HashMap<>();

    private long liftedCount;

    public Placement insert(Operation op) {
        Objects.requireNonNull(op, "op");
        OrderKey existing = keysById.get(op.id());
        if (existing != null) {
            return new Placement(ordered.get(existing), positionOf(existing), true);
        }

        long effective = op.lamportTimestamp();
        for (var e : ordered.entrySet()) {
            if (e.getValue().vectorClock().compare(op.vectorClock()) == CausalOrder.BEFORE) {
                effective = Math.max(effective, e.getKey().lamport() + 1);
            }
        }
        Operation placed = effective == op.lamportTimestamp() ? op : op.withLamportTimestamp(effective);
        if (placed != op) {
            liftedCount++;
        }
        put(placed);
        liftSuccessorsOf(placed);

        OrderKey key = keysById.get(op.id());
        return new Placement(ordered.get(key), positionOf(key), false);
    }

    public boolean contains(String operationId) {
        return keysById.containsKey(operationId);
    }

    public Optional<Operation> get(String operationId) {
        OrderKey k = keysById.get(operationId);
        return k == null ? Optional.empty() : Optional.of(ordered.get(k));
    }

    /** Zero-based causal position of a queued operation, -1 if absent. */
    public int positionOf(String operationId) {
        OrderKey k = keysById.get(operationId);
        return k == null ? -1 : positionOf(k);
    }

    public Optional<Operation> first() {
        var e = ordered.firstEntry();
        return e == null ? Optional.empty() : Optional.of(e.getValue());
    }

    /** Remove and return the causally earliest operation. */
    public Optional<Operation> pollFirst() {
        var e = ordered.firstEntry();
        if (e == null) {
            return Optional.empty();
        }
        remove(e.getValue().id());
        return Optional.of(e.getValue());
    }

    public boolean remove(String operationId) {
        OrderKey k = keysById.remove(operationId);
        if (k == null) {
            return false;
        }
        Operation op = ordered.remove(k);
        unindexElement(op, k);
        return true;
    }

    /** Queued operations of one element, in causal order. */
    public List<Operation> operationsFor(String elementId) {
        var keys = keysByElement.get(elementId);
        if (keys == null) {
            return List.of();
        }
        var out = new ArrayList<Operation>(keys.size());
        for (OrderKey k : keys) {
            out.add(ordered.get(k));
        }
        return out;
    }

    /** True when no queued operation of the same element sorts after this one. */
    public boolean isLastForElement(Operation op) {
        var keys = keysByElement.get(op.elementId());
        OrderKey k = keysById.get(op.id());
        return keys != null && k != null && keys.last().equals(k);
    }

    /** All queued operations in causal order. */
    public List<Operation> snapshot() {
        return List.copyOf(ordered.values());
    }

    /** Replace the whole content, e.g. with a compressed equivalent. */
    public void replaceAll(List<Operation> ops) {
        clear();
        for (Operation op : ops) {
            insert(op);
        }
    }

    public void clear() {
        ordered.clear();
        keysById.clear();
        keysByElement.clear();
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    /** How many inserts or re-keys had to lift a Lamport stamp so far. */
    public long liftedCount() {
        return liftedCount;
    }

    // ---------- internals ----------

    private void put(Operation op) {
        OrderKey k = OrderKey.of(op);
        ordered.put(k, op);
        keysById.put(op.id(), k);
        if (op.elementId() != null) {
            keysByElement.computeIfAbsent(op.elementId(), id -> new TreeSet<>()).add(k);
        }
    }

    private void unindexElement(Operation op, OrderKey k) {
        if (op.elementId() == null) {
            return;
        }
        var keys = keysByElement.get(op.elementId());
        if (keys != null) {
            keys.remove(k);
            if (keys.isEmpty()) {
                keysByElement.remove(op.elementId());
            }
        }
    }

    private void liftSuccessorsOf(Operation start) {
        var work = new ArrayDeque<Operation>();
        work.add(start);
        while (!work.isEmpty()) {
            Operation pred = work.poll();
            long floor = keysById.get(pred.id()).lamport() + 1;
            var toLift = new ArrayList<Operation>();
            for (var e : ordered.entrySet()) {
                if (e.getKey().lamport() < floor
                        && pred.vectorClock().compare(e.getValue().vectorClock()) == CausalOrder.BEFORE) {
                    toLift.add(e.getValue());
                }
            }
            for (Operation succ : toLift) {
                remove(succ.id());
                Operation lifted = succ.withLamportTimestamp(floor);
                liftedCount++;
                put(lifted);
                work.add(lifted);
            }
        }
    }

    private int positionOf(OrderKey k) {
        return ordered.headMap(k, false).size();
    }
}
