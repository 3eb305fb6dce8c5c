// file: core/src/main/java/io/inksync/core/error/InkSyncException.java
package io.inksync.core.error;

/**
 * Root of the engine's exception hierarchy.
 * <p>
 * All engine exceptions are unchecked. Hot-path failures (validation, resolution)
 * are converted into typed results before they reach a caller; cold-path failures
 * (audit, analytics, notifications) are logged and suppressed where they occur.
 */
public abstract class InkSyncException extends RuntimeException {

    protected InkSyncException(String message) {
        super(message);
    }

    protected InkSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
