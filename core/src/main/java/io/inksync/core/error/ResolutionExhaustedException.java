// file: core/src/main/java/io/inksync/core/error/ResolutionExhaustedException.java
package io.inksync.core.error;

import java.util.List;

/**
 * Every strategy that was allowed to run failed (or the attempt loop was cancelled).
 * <p>
 * The attempt history is kept as human-readable lines so it can be logged and
 * written to the audit trail without depending on resolution types.
 */
public final class ResolutionExhaustedException extends ResolutionException {

    private final List<String> attemptHistory;

    public ResolutionExhaustedException(String conflictId, List<String> attemptHistory) {
        super(conflictId, "automatic resolution exhausted for " + conflictId
                + " after " + attemptHistory.size() + " attempt(s): " + attemptHistory);
        this.attemptHistory = List.copyOf(attemptHistory);
    }

    public List<String> attemptHistory() {
        return attemptHistory;
    }
}
