// file: core/src/main/java/io/inksync/core/error/ResolutionException.java
package io.inksync.core.error;

/**
 * Base type for reasons an automatic resolution did not produce a result.
 * Instances travel inside resolution outcomes; they are not thrown across
 * the session boundary.
 */
public abstract class ResolutionException extends InkSyncException {

    private final String conflictId;

    protected ResolutionException(String conflictId, String message) {
        super(message);
        this.conflictId = conflictId;
    }

    public String conflictId() {
        return conflictId;
    }
}
