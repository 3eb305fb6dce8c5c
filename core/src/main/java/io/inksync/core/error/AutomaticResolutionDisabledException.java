// file: core/src/main/java/io/inksync/core/error/AutomaticResolutionDisabledException.java
package io.inksync.core.error;

public final class AutomaticResolutionDisabledException extends ResolutionException {

    public AutomaticResolutionDisabledException(String conflictId) {
        super(conflictId, "automatic resolution is disabled by configuration");
    }
}
