package io.inksync.core;

import java.util.Map;

/**
 * Small fixtures for building operations in tests.
 */
public final class Ops {

    private Ops() {
    }

    public static Operation update(String id, String elementId, String user, VectorClock clock,
                                   long lamport, long emittedAt, Map<String, Object> payload) {
        return Operation.builder()
                .id(id).type(OperationType.UPDATE).elementId(elementId).userId(user)
                .vectorClock(clock).lamportTimestamp(lamport).version(lamport)
                .emittedAtMillis(emittedAt).payload(payload)
                .build();
    }

    public static Operation of(String id, OperationType type, String elementId, String user,
                               VectorClock clock, long lamport) {
        return Operation.builder()
                .id(id).type(type).elementId(elementId).userId(user)
                .vectorClock(clock).lamportTimestamp(lamport).version(lamport)
                .emittedAtMillis(1_000 + lamport)
                .build();
    }
}
