package io.inksync.core.compress;

import io.inksync.core.Bounds;
import io.inksync.core.ElementState;
import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.VectorClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior is described in English, then asserted.
 */
class OperationCompressorTest {

    private final OperationCompressor compressor = new OperationCompressor(1000);

    @Test
    void hundred_moves_by_one_user_collapse_into_one() {
        var ops = new ArrayList<Operation>();
        for (int i = 1; i <= 100; i++) {
            ops.add(op("m" + i, OperationType.MOVE, "E1", "u1", i, Map.of("x", i, "y", i * 2)));
        }

        List<Operation> out = compressor.compressOperations(ops);

        assertEquals(1, out.size());
        Operation merged = out.get(0);
        assertEquals("m100", merged.id());
        assertEquals(OperationType.MOVE, merged.type());
        assertEquals(100, merged.payload().get("x"));
        assertEquals(200, merged.payload().get("y"));
        assertEquals(100, merged.compressedFrom());

        var stats = compressor.stats(ops, out);
        assertEquals(99, stats.savedOperations());
        assertEquals(0.01, stats.compressionRatio(), 1e-9);
    }

    @Test
    void create_followed_by_own_updates_folds_into_the_create() {
        var ops = List.of(
                op("c", OperationType.CREATE, "E1", "u1", 1, Map.of("kind", "rect", "width", 10)),
                op("u", OperationType.UPDATE, "E1", "u1", 2, Map.of("width", 20)),
                op("s", OperationType.STYLE, "E1", "u1", 3, Map.of("fill", "red")));

        List<Operation> out = compressor.compressOperations(ops);

        assertEquals(1, out.size());
        assertEquals(OperationType.CREATE, out.get(0).type());
        assertEquals(Map.of("kind", "rect", "width", 20, "fill", "red"), out.get(0).payload());
        assertEquals(3, out.get(0).compressedFrom());
    }

    @Test
    void another_users_operation_ends_the_fold() {
        var ops = List.of(
                op("c", OperationType.CREATE, "E1", "u1", 1, Map.of("width", 10)),
                op("x", OperationType.UPDATE, "E1", "u2", 2, Map.of("width", 15)),
                op("u", OperationType.UPDATE, "E1", "u1", 3, Map.of("width", 20)));

        assertEquals(ops, compressor.compressOperations(ops));
    }

    @Test
    void delete_absorbs_everything_before_it_on_the_element() {
        var ops = List.of(
                op("c", OperationType.CREATE, "E1", "u1", 1, Map.of("width", 10)),
                op("other", OperationType.UPDATE, "E2", "u2", 2, Map.of("width", 1)),
                op("u", OperationType.UPDATE, "E1", "u2", 3, Map.of("width", 20)),
                op("d", OperationType.DELETE, "E1", "u1", 4, Map.of()));

        List<Operation> out = compressor.compressOperations(ops);

        assertEquals(List.of("other", "d"), out.stream().map(Operation::id).toList());
    }

    @Test
    void protected_operations_survive_unchanged() {
        var ops = List.of(
                op("a", OperationType.UPDATE, "E1", "u1", 1, Map.of("width", 10)),
                op("b", OperationType.UPDATE, "E1", "u1", 2, Map.of("width", 20)),
                op("c", OperationType.UPDATE, "E1", "u1", 3, Map.of("width", 30)),
                op("d", OperationType.DELETE, "E1", "u1", 4, Map.of()));

        List<Operation> out = compressor.compressOperations(ops, Set.of("b"));

        assertEquals(List.of("b", "d"), out.stream().map(Operation::id).toList());
        assertSame(ops.get(1), out.get(0));
    }

    @Test
    void runs_never_exceed_the_configured_length() {
        var small = new OperationCompressor(3);
        var ops = new ArrayList<Operation>();
        for (int i = 1; i <= 7; i++) {
            ops.add(op("m" + i, OperationType.MOVE, "E1", "u1", i, Map.of("x", i)));
        }

        List<Operation> out = small.compressOperations(ops);

        assertEquals(List.of(3, 3, 1), out.stream().map(Operation::compressedFrom).toList());
        assertEquals(List.of("m3", "m6", "m7"), out.stream().map(Operation::id).toList());
    }

    @Test
    void compressing_twice_changes_nothing() {
        List<Operation> ops = randomOps(new Random(7), 200);
        List<Operation> once = compressor.compressOperations(ops);

        assertEquals(once, compressor.compressOperations(once));
        assertTrue(once.size() <= ops.size());
    }

    @Test
    void replaying_compressed_operations_gives_the_same_final_state() {
        var random = new Random(42);
        for (int round = 0; round < 50; round++) {
            List<Operation> ops = randomOps(random, 40);
            List<Operation> out = new OperationCompressor(1 + random.nextInt(5)).compressOperations(ops);

            for (String element : List.of("E1", "E2", "E3")) {
                var existing = new ElementState(element, true, Map.of("seed", 1), 0,
                        new Bounds(0, 0, 1, 1), "u0", "seed");
                for (ElementState start : List.of(ElementState.absent(element), existing)) {
                    assertEquals(replay(start, ops), replay(start, out),
                            "round " + round + " element " + element);
                }
            }
        }
    }

    @Test
    void deduplicate_keeps_the_first_occurrence() {
        var a = op("a", OperationType.UPDATE, "E1", "u1", 1, Map.of("width", 1));
        var b = op("b", OperationType.UPDATE, "E1", "u1", 2, Map.of("width", 2));
        var aAgain = op("a", OperationType.UPDATE, "E1", "u1", 3, Map.of("width", 3));

        assertEquals(List.of(a, b), compressor.deduplicate(List.of(a, b, aAgain)));
    }

    private static ElementState replay(ElementState start, List<Operation> ops) {
        var forElement = ops.stream().filter(o -> start.elementId().equals(o.elementId())).toList();
        return ElementState.replay(start, forElement);
    }

    private static List<Operation> randomOps(Random random, int count) {
        var types = new OperationType[]{
                OperationType.CREATE, OperationType.UPDATE, OperationType.MOVE,
                OperationType.STYLE, OperationType.DELETE, OperationType.UPDATE};
        var fields = new String[]{"x", "y", "width", "fill"};
        var out = new ArrayList<Operation>();
        for (int i = 0; i < count; i++) {
            OperationType type = types[random.nextInt(types.length)];
            String element = "E" + (1 + random.nextInt(3));
            String user = "u" + (1 + random.nextInt(2));
            Map<String, Object> payload = type == OperationType.DELETE
                    ? Map.of()
                    : Map.of(fields[random.nextInt(fields.length)], random.nextInt(100));
            Bounds bounds = random.nextBoolean() ? new Bounds(random.nextInt(50), 0, 10, 10) : null;
            out.add(op("op" + i, type, element, user, i + 1, payload).withBounds(bounds));
        }
        return out;
    }

    private static Operation op(String id, OperationType type, String element, String user,
                                long lamport, Map<String, Object> payload) {
        return Operation.builder()
                .id(id).type(type).elementId(element).userId(user)
                .vectorClock(VectorClock.of(user, (int) lamport))
                .lamportTimestamp(lamport).version(lamport)
                .emittedAtMillis(1_000 + lamport)
                .payload(payload)
                .build();
    }
}
