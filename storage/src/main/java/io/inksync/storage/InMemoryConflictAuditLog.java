// file: storage/src/main/java/io/inksync/storage/InMemoryConflictAuditLog.java
package io.inksync.storage;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Volatile audit log for tests and for running without an audit directory.
 */
public final class InMemoryConflictAuditLog implements ConflictAuditLog {

    private final CopyOnWriteArrayList<AuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void appendAuditRecord(AuditRecord record) {
        records.add(Objects.requireNonNull(record, "record"));
    }

    @Override
    public List<AuditRecord> readAll() {
        return List.copyOf(records);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
