// file: server/src/main/java/io/inksync/server/session/PredictionInputs.java
package io.inksync.server.session;

import io.inksync.core.ElementState;
import io.inksync.core.Operation;

import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the whiteboard state the predictor reads, taken on the session thread.
 */
public record PredictionInputs(List<Operation> recentOperations, Map<String, ElementState> elementStates) {
    public PredictionInputs {
        recentOperations = List.copyOf(recentOperations);
        elementStates = Map.copyOf(elementStates);
    }
}
