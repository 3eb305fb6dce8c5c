package io.inksync.core.engine;

import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.Ops;
import io.inksync.core.VectorClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Causal placement in the pending queue.
 */
class PendingOperationQueueTest {

    // A -> B -> C, each author saw the previous edit
    private final Operation a = Ops.of("A", OperationType.UPDATE, "E1", "u1", VectorClock.of("u1", 1), 1);
    private final Operation b = Ops.of("B", OperationType.UPDATE, "E1", "u2", VectorClock.of("u1", 1, "u2", 1), 2);
    private final Operation c = Ops.of("C", OperationType.UPDATE, "E1", "u3",
            VectorClock.of("u1", 1, "u2", 1, "u3", 1), 3);

    @Test
    void causal_chain_arriving_b_c_a_is_queued_a_b_c() {
        var q = new PendingOperationQueue();

        assertEquals(0, q.insert(b).position());
        assertEquals(1, q.insert(c).position());
        assertEquals(0, q.insert(a).position());

        assertEquals(List.of("A", "B", "C"), ids(q.snapshot()));
        assertEquals(0, q.liftedCount());
    }

    @Test
    void inconsistent_lamport_stamps_are_lifted_to_respect_causality() {
        // client clocks disagree: A carries a larger stamp than its successors
        var badA = Ops.of("A", OperationType.UPDATE, "E1", "u1", VectorClock.of("u1", 1), 5);
        var badB = Ops.of("B", OperationType.UPDATE, "E1", "u2", VectorClock.of("u1", 1, "u2", 1), 1);
        var badC = Ops.of("C", OperationType.UPDATE, "E1", "u3", VectorClock.of("u1", 1, "u2", 1, "u3", 1), 1);

        var q = new PendingOperationQueue();
        q.insert(badB);
        q.insert(badC);
        q.insert(badA);

        List<Operation> out = q.snapshot();
        assertEquals(List.of("A", "B", "C"), ids(out));
        assertEquals(List.of(5L, 6L, 7L), out.stream().map(Operation::lamportTimestamp).toList());
        assertTrue(q.liftedCount() > 0);
    }

    @Test
    void every_arrival_order_yields_the_same_queue() {
        var badA = Ops.of("A", OperationType.UPDATE, "E1", "u1", VectorClock.of("u1", 1), 5);
        var badB = Ops.of("B", OperationType.UPDATE, "E1", "u2", VectorClock.of("u1", 1, "u2", 1), 1);
        var badC = Ops.of("C", OperationType.UPDATE, "E1", "u3", VectorClock.of("u1", 1, "u2", 1, "u3", 1), 1);
        var other = Ops.of("X", OperationType.UPDATE, "E2", "u4", VectorClock.of("u4", 1), 3);
        List<Operation> all = List.of(badA, badB, badC, other);

        List<Operation> expected = null;
        for (List<Operation> order : permutations(all)) {
            var q = new PendingOperationQueue();
            order.forEach(q::insert);
            if (expected == null) {
                expected = q.snapshot();
            } else {
                assertEquals(expected, q.snapshot(), "arrival order " + ids(order));
            }
        }
    }

    @Test
    void chain_arriving_newest_first_is_lifted_transitively_across_the_queue() {
        var q = new PendingOperationQueue();
        var chain = new ArrayList<Operation>();
        for (int i = 1; i <= 20; i++) {
            // every stamp except the root's is stale
            chain.add(Ops.of("op" + i, OperationType.UPDATE, "E1", "u1", VectorClock.of("u1", i), i == 1 ? 10 : 1));
        }
        for (int i = chain.size() - 1; i >= 0; i--) {
            q.insert(chain.get(i));
        }

        List<Operation> out = q.snapshot();
        assertEquals(ids(chain), ids(out));
        for (int i = 0; i < out.size(); i++) {
            assertEquals(10L + i, out.get(i).lamportTimestamp());
        }
        assertEquals(ids(chain), ids(q.operationsFor("E1")));
        assertTrue(q.isLastForElement(out.get(out.size() - 1)));
        assertEquals(19, q.positionOf("op20"));
    }

    @Test
    void concurrent_operations_follow_lamport_then_user_order() {
        var x = Ops.of("x", OperationType.UPDATE, "E1", "bob", VectorClock.of("bob", 1), 4);
        var y = Ops.of("y", OperationType.UPDATE, "E1", "alice", VectorClock.of("alice", 1), 4);
        var z = Ops.of("z", OperationType.UPDATE, "E1", "carol", VectorClock.of("carol", 1), 2);

        var q = new PendingOperationQueue();
        q.insert(x);
        q.insert(y);
        q.insert(z);

        assertEquals(List.of("z", "y", "x"), ids(q.snapshot()));
    }

    @Test
    void duplicate_insert_changes_nothing() {
        var q = new PendingOperationQueue();
        q.insert(a);
        q.insert(b);

        var again = q.insert(b);

        assertTrue(again.duplicate());
        assertEquals(1, again.position());
        assertEquals(2, q.size());
    }

    @Test
    void element_index_tracks_inserts_and_removals() {
        var q = new PendingOperationQueue();
        var other = Ops.of("X", OperationType.UPDATE, "E2", "u4", VectorClock.of("u4", 1), 1);
        q.insert(c);
        q.insert(other);
        q.insert(a);

        assertEquals(List.of("A", "C"), ids(q.operationsFor("E1")));
        assertTrue(q.isLastForElement(c));
        assertFalse(q.isLastForElement(a));

        assertEquals("A", q.pollFirst().orElseThrow().id());
        assertTrue(q.remove("C"));
        assertFalse(q.remove("C"));
        assertEquals(List.of(), q.operationsFor("E1"));
        assertEquals(-1, q.positionOf("A"));
        assertEquals(0, q.positionOf("X"));
    }

    private static List<String> ids(List<Operation> ops) {
        return ops.stream().map(Operation::id).toList();
    }

    private static List<List<Operation>> permutations(List<Operation> items) {
        if (items.isEmpty()) {
            return List.of(List.of());
        }
        var out = new ArrayList<List<Operation>>();
        for (int i = 0; i < items.size(); i++) {
            var rest = new ArrayList<>(items);
            Operation head = rest.remove(i);
            for (List<Operation> tail : permutations(rest)) {
                var perm = new ArrayList<Operation>();
                perm.add(head);
                perm.addAll(tail);
                out.add(perm);
            }
        }
        return out;
    }
}
