package io.inksync.server;

import io.inksync.core.Bounds;
import io.inksync.core.Operation;
import io.inksync.core.OperationType;
import io.inksync.core.VectorClock;

import java.util.Map;

/**
 * Operations used across the server tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /** Field update on {@code elementId} by a user who has seen only their own edits. */
    public static Operation update(String id, String elementId, String user, long lamport,
                                   long emittedAt, Map<String, Object> payload) {
        return Operation.builder()
                .id(id).type(OperationType.UPDATE).elementId(elementId).userId(user)
                .vectorClock(VectorClock.of(user, 1)).lamportTimestamp(lamport).version(lamport)
                .emittedAtMillis(emittedAt).payload(payload)
                .build();
    }

    public static Operation delete(String id, String elementId, String user, long lamport, long emittedAt) {
        return Operation.builder()
                .id(id).type(OperationType.DELETE).elementId(elementId).userId(user)
                .vectorClock(VectorClock.of(user, 1)).lamportTimestamp(lamport).version(lamport)
                .emittedAtMillis(emittedAt)
                .build();
    }

    public static Operation style(String id, String elementId, String user, long lamport, long emittedAt,
                                  String color) {
        return Operation.builder()
                .id(id).type(OperationType.STYLE).elementId(elementId).userId(user)
                .vectorClock(VectorClock.of(user, 1)).lamportTimestamp(lamport).version(lamport)
                .emittedAtMillis(emittedAt).payload(Map.of("style.color", color))
                .build();
    }

    public static Operation move(String id, String elementId, String user, long lamport, long emittedAt,
                                 Bounds bounds) {
        return Operation.builder()
                .id(id).type(OperationType.MOVE).elementId(elementId).userId(user)
                .vectorClock(VectorClock.of(user, 1)).lamportTimestamp(lamport).version(lamport)
                .emittedAtMillis(emittedAt).bounds(bounds)
                .payload(Map.of("x", bounds.x(), "y", bounds.y()))
                .build();
    }
}
