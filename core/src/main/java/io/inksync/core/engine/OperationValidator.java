// file: core/src/main/java/io/inksync/core/engine/OperationValidator.java
package io.inksync.core.engine;

import io.inksync.core.Bounds;
import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.error.OperationValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks applied to every submitted operation before it touches
 * any state. All violations are collected and reported together.
 */
final class OperationValidator {

    static final double MAX_COORDINATE = 10_000.0;
    static final double MAX_DIMENSION = 5_000.0;
    static final int MAX_PAYLOAD_FIELDS = 256;

    /**
     * @return the operation, with a generated element id if it is a create without one
     * @throws OperationValidationException listing every violation found
     */
    Operation validate(Operation op) {
        if (op == null) {
            throw new OperationValidationException(null, List.of("operation is required"));
        }
        var violations = new ArrayList<String>();

        if (isBlank(op.id())) violations.add("id is required");
        if (op.type() == null) violations.add("type is required");
        if (isBlank(op.userId())) violations.add("userId is required");

        if (op.vectorClock() == null) {
            violations.add("vectorClock is required");
        } else if (!isBlank(op.userId()) && op.vectorClock().get(op.userId()) < 1) {
            violations.add("vectorClock must carry a counter >= 1 for its author " + op.userId());
        }

        if (op.type() != null && op.type() != OperationType.CREATE && isBlank(op.elementId())) {
            violations.add("elementId is required for " + op.type());
        }
        if (op.lamportTimestamp() < 0) violations.add("lamportTimestamp must be >= 0");
        if (op.version() < 0) violations.add("version must be >= 0");
        if (op.emittedAtMillis() < 0) violations.add("emittedAtMillis must be >= 0");

        if (op.type() == OperationType.COMPOUND && op.parentIds().isEmpty()) {
            violations.add("compound operations need parentIds");
        }
        for (String parent : op.parentIds()) {
            if (isBlank(parent)) {
                violations.add("parentIds must not contain blank ids");
                break;
            }
        }

        if (op.payload().size() > MAX_PAYLOAD_FIELDS) {
            violations.add("payload has " + op.payload().size() + " fields, limit is " + MAX_PAYLOAD_FIELDS);
        }
        if (op.bounds() != null) {
            checkBounds(op.bounds(), violations);
        }

        if (!violations.isEmpty()) {
            throw new OperationValidationException(op.id(), violations);
        }
        if (op.type() == OperationType.CREATE && isBlank(op.elementId())) {
            return op.withElementId("el-" + op.id());
        }
        return op;
    }

    private static void checkBounds(Bounds b, List<String> violations) {
        if (!b.isFinite()) {
            violations.add("bounds must be finite");
            return;
        }
        if (Math.abs(b.x()) > MAX_COORDINATE || Math.abs(b.y()) > MAX_COORDINATE) {
            violations.add("bounds position must be within +/-" + (int) MAX_COORDINATE);
        }
        if (b.width() < 0 || b.height() < 0 || b.width() > MAX_DIMENSION || b.height() > MAX_DIMENSION) {
            violations.add("bounds size must be within [0, " + (int) MAX_DIMENSION + "]");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
