// file: server/src/main/java/io/inksync/server/resolution/ResolutionState.java
package io.inksync.server.resolution;

/**
 * Lifecycle of one conflict inside the resolution service:
 * DETECTED -> ANALYZING -> {RESOLVED_AUTOMATIC | RESOLVED_MANUAL_PENDING | FAILED}.
 * A cancelled attempt loop returns the conflict to DETECTED.
 */
public enum ResolutionState {
    DETECTED,
    ANALYZING,
    RESOLVED_AUTOMATIC,
    RESOLVED_MANUAL_PENDING,
    FAILED;

    public boolean isTerminal() {
        return this == RESOLVED_AUTOMATIC || this == RESOLVED_MANUAL_PENDING || this == FAILED;
    }
}
