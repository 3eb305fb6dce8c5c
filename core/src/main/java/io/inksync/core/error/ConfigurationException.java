// file: core/src/main/java/io/inksync/core/error/ConfigurationException.java
package io.inksync.core.error;

/**
 * Invalid thresholds or unreadable configuration. Fatal at startup.
 */
public final class ConfigurationException extends InkSyncException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    /** Dotted configuration key that failed, e.g. {@code detection.temporalWindowMs}. */
    public String key() {
        return key;
    }
}
