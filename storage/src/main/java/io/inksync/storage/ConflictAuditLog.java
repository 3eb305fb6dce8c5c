// file: storage/src/main/java/io/inksync/storage/ConflictAuditLog.java
package io.inksync.storage;

import io.inksync.core.error.PersistenceException;

import java.util.List;

/**
 * Append-only store of conflict audit records.
 * <p>
 * Contract:
 *  - appendAuditRecord() is atomic per record: a partially written record is
 *    treated as absent when reading back.
 *  - readAll() returns records in append order.
 *  - Failures surface as {@link PersistenceException}; callers decide whether
 *    that is fatal (it never is for the editing path).
 */
public interface ConflictAuditLog extends AutoCloseable {

    void appendAuditRecord(AuditRecord record);

    List<AuditRecord> readAll();

    @Override
    void close();
}
