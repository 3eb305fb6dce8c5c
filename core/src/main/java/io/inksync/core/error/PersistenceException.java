// file: core/src/main/java/io/inksync/core/error/PersistenceException.java
package io.inksync.core.error;

/** Audit or analytics storage failed. Never fails a resolution outcome. */
public final class PersistenceException extends InkSyncException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
