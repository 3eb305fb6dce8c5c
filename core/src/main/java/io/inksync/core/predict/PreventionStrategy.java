// file: core/src/main/java/io/inksync/core/predict/PreventionStrategy.java
package io.inksync.core.predict;

/** What the gateway may suggest to clients before a predicted collision. */
public enum PreventionStrategy {
    STAGGER_EDITS("stagger edits"),
    LOCK_REGION("lock region"),
    LOCK_ELEMENT("lock element"),
    SPLIT_WORK_AREA("split work areas");

    private final String description;

    PreventionStrategy(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
