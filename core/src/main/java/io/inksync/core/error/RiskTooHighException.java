// file: core/src/main/java/io/inksync/core/error/RiskTooHighException.java
package io.inksync.core.error;

/** Automatic resolution declined by policy; the conflict goes to manual review. */
public final class RiskTooHighException extends ResolutionException {

    public RiskTooHighException(String conflictId, String reason) {
        super(conflictId, "automatic resolution declined for " + conflictId + ": " + reason);
    }
}
