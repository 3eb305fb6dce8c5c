// file: storage/src/main/java/io/inksync/storage/AuditRecordCodec.java
package io.inksync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.inksync.core.error.PersistenceException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for audit log records.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xA0D1
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     - the {@link AuditRecord} as UTF-8 JSON
 * <p>
 * JSON keeps the trail readable with standard tools; the header is what lets
 * the reader detect a torn tail after a crash.
 */
final class AuditRecordCodec {
    static final short MAGIC = (short) 0xA0D1;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Encode a record into header+payload bytes ready for append. */
    byte[] encode(AuditRecord record) {
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("cannot serialize audit record for " + record.conflictId(), e);
        }
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a payload (header already stripped and verified). */
    AuditRecord decode(byte[] payload) {
        try {
            return mapper.readValue(payload, AuditRecord.class);
        } catch (IOException e) {
            throw new PersistenceException("corrupt audit record payload", e);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
