// file: core/src/main/java/io/inksync/core/ElementState.java
package io.inksync.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Last known snapshot of a single element.
 * <p>
 * Replay semantics (shared by the transform context and the compressor):
 *  - CREATE: element exists, fields are replaced by the payload.
 *  - DELETE: element is absent, fields and bounds are cleared.
 *  - anything else: payload is merged into the fields of an existing element
 *    (later values win); it is a no-op on an absent element.
 * Every applied operation records its version, author and id.
 */
public record ElementState(
        String elementId,
        boolean exists,
        Map<String, Object> fields,
        long version,
        Bounds bounds,
        String lastUserId,
        String lastOperationId
) {

    public ElementState {
        Objects.requireNonNull(elementId, "elementId");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ElementState absent(String elementId) {
        return new ElementState(elementId, false, Map.of(), 0, null, null, null);
    }

    public ElementState apply(Operation op) {
        return switch (op.type()) {
            case CREATE -> new ElementState(elementId, true, op.payload(), op.version(),
                    op.bounds(), op.userId(), op.id());
            case DELETE -> new ElementState(elementId, false, Map.of(), op.version(),
                    null, op.userId(), op.id());
            default -> {
                if (!exists) {
                    yield this;
                }
                var merged = new LinkedHashMap<>(fields);
                merged.putAll(op.payload());
                yield new ElementState(elementId, true, merged, op.version(),
                        op.bounds() != null ? op.bounds() : bounds, op.userId(), op.id());
            }
        };
    }

    /** Replay {@code ops} in list order, starting from {@code start}. */
    public static ElementState replay(ElementState start, List<Operation> ops) {
        ElementState s = start;
        for (Operation op : ops) {
            s = s.apply(op);
        }
        return s;
    }
}
