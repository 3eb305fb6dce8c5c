// file: core/src/main/java/io/inksync/core/compress/OperationCompressor.java
package io.inksync.core.compress;

import io.inksync.core.Operation;
import io.inksync.core.OperationType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lossless-for-final-state reduction of an operation sequence.
 * <p>
 * Rules, applied per element in sequence order:
 *  - Update runs: consecutive update-like operations of the same type by the
 *    same user merge into one (later fields win).
 *  - Create folding: a create followed only by updates from its author folds
 *    into a single create carrying the final payload. An operation from any
 *    other user on the element ends the fold.
 *  - Delete absorption: a delete discards every earlier operation on its element.
 *  - Protected operations (targets of unresolved conflicts) are never merged or
 *    dropped, and runs never extend across them.
 *  - A merged operation never stands for more than {@code maxRunLength}
 *    submitted operations ({@link Operation#compressedFrom()}).
 * <p>
 * A merged operation keeps the identity, clocks and list position of the last
 * operation it absorbed. Operations on different elements are never combined,
 * so the relative order between elements is preserved.
 * <p>
 * Pure and idempotent: compressing an already compressed list returns an equal list.
 */
public final class OperationCompressor {

    private record Slot(Operation op, int index, boolean pinned) {}

    private final int maxRunLength;

    public OperationCompressor(int maxRunLength) {
        if (maxRunLength < 1) {
            throw new IllegalArgumentException("maxRunLength must be >= 1");
        }
        this.maxRunLength = maxRunLength;
    }

    public List<Operation> compressOperations(List<Operation> ops) {
        return compressOperations(ops, Set.of());
    }

    /**
     * @param protectedIds ids of operations that must survive unchanged
     */
    public List<Operation> compressOperations(List<Operation> ops, Set<String> protectedIds) {
        Objects.requireNonNull(ops, "ops");
        Objects.requireNonNull(protectedIds, "protectedIds");
        if (ops.size() < 2) {
            return List.copyOf(ops);
        }

        Map<String, List<Slot>> byElement = new LinkedHashMap<>();
        for (int i = 0; i < ops.size(); i++) {
            Operation op = ops.get(i);
            // Operations without an element id never combine with anything.
            String key = op.elementId() != null ? op.elementId() : "\u0000#" + i;
            List<Slot> slots = byElement.computeIfAbsent(key, k -> new ArrayList<>());
            boolean pinned = protectedIds.contains(op.id());

            if (op.type() == OperationType.DELETE) {
                slots.removeIf(s -> !s.pinned());
                slots.add(new Slot(op, i, pinned));
                continue;
            }

            if (!pinned && !slots.isEmpty()) {
                Slot last = slots.get(slots.size() - 1);
                if (canAbsorb(last, op)) {
                    slots.set(slots.size() - 1, new Slot(absorb(last.op(), op), i, false));
                    continue;
                }
            }
            slots.add(new Slot(op, i, pinned));
        }

        return byElement.values().stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparingInt(Slot::index))
                .map(Slot::op)
                .toList();
    }

    /** Drop repeated operation ids, keeping the first occurrence. */
    public List<Operation> deduplicate(List<Operation> ops) {
        var byId = new LinkedHashMap<String, Operation>();
        for (Operation op : ops) {
            byId.putIfAbsent(op.id(), op);
        }
        return List.copyOf(byId.values());
    }

    public CompressionStats stats(List<Operation> original, List<Operation> compressed) {
        return CompressionStats.of(original.size(), compressed.size());
    }

    private boolean canAbsorb(Slot last, Operation next) {
        Operation prev = last.op();
        if (last.pinned()) return false;
        if (prev.userId() == null || !prev.userId().equals(next.userId())) return false;
        if (next.type() == OperationType.COMPOUND || !next.type().isUpdateLike()) return false;
        boolean sameRun = prev.type() == next.type();
        boolean createFold = prev.type() == OperationType.CREATE;
        if (!sameRun && !createFold) return false;
        return (long) prev.compressedFrom() + next.compressedFrom() <= maxRunLength;
    }

    private static Operation absorb(Operation prev, Operation next) {
        var payload = new LinkedHashMap<String, Object>(prev.payload());
        payload.putAll(next.payload());
        return next.toBuilder()
                .type(prev.type())
                .payload(payload)
                .bounds(next.bounds() != null ? next.bounds() : prev.bounds())
                .vectorClock(prev.vectorClock().merge(next.vectorClock()))
                .compressedFrom(prev.compressedFrom() + next.compressedFrom())
                .build();
    }
}
