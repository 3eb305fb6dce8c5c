// file: core/src/main/java/io/inksync/core/OperationType.java
package io.inksync.core;

/**
 * Kinds of edit intents a client can submit.
 */
public enum OperationType {
    CREATE, UPDATE, DELETE, MOVE, STYLE, LAYER_CHANGE, COMPOUND;

    /** Create and delete change whether the element exists at all. */
    public boolean changesExistence() {
        return this == CREATE || this == DELETE;
    }

    /** Types whose payload is merged into the fields of an existing element. */
    public boolean isUpdateLike() {
        return this == UPDATE || this == MOVE || this == STYLE || this == LAYER_CHANGE || this == COMPOUND;
    }
}
