// file: storage/src/main/java/io/inksync/storage/FileConflictAuditLog.java
package io.inksync.storage;

import io.inksync.core.error.PersistenceException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed audit log that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment ("00000001.log", "00000002.log", ...),
 *      - truncates a torn tail left in it by a crash,
 *      - opens it for append.
 * <p>
 *  - appendAuditRecord():
 *      - writes the framed bytes and calls force(true),
 *      - rotates to the next segment once rotateBytes were written to the current one.
 * <p>
 *  - readAll():
 *      - walks every segment in name order,
 *      - validates magic/version/length and CRC of each record,
 *      - stops reading a segment at its first truncated or corrupt record
 *        (a torn tail left by a crash) and continues with the next segment.
 * <p>
 * Appends are serialized on this instance; readers open their own channels.
 */
public final class FileConflictAuditLog implements ConflictAuditLog {

    private static final Logger log = Logger.getLogger(FileConflictAuditLog.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private final AuditRecordCodec codec = new AuditRecordCodec();

    // guarded by this
    private FileChannel ch;
    private Path current;
    private long writtenInSegment;

    public FileConflictAuditLog(Path dir, long rotateBytes) {
        this.dir = Objects.requireNonNull(dir, "dir");
        if (rotateBytes <= 0) {
            throw new IllegalArgumentException("rotateBytes must be > 0");
        }
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceException("cannot create audit directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void appendAuditRecord(AuditRecord record) {
        Objects.requireNonNull(record, "record");
        if (ch == null) {
            throw new PersistenceException("audit log " + dir + " is closed");
        }
        byte[] bytes = codec.encode(record);
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += bytes.length;
            rotateIfNeeded();
        } catch (IOException e) {
            throw new PersistenceException("audit append failed for conflict " + record.conflictId(), e);
        }
    }

    @Override
    public List<AuditRecord> readAll() {
        var out = new ArrayList<AuditRecord>();
        for (Path segment : segments()) {
            scanSegment(segment, out);
        }
        return out;
    }

    @Override
    public synchronized void close() {
        if (ch == null) {
            return;
        }
        try {
            ch.close();
        } catch (IOException e) {
            throw new PersistenceException("cannot close audit segment " + current, e);
        } finally {
            ch = null;
        }
    }

    /** Segment currently appended to. */
    synchronized Path currentSegment() {
        return current;
    }

    private void rotateIfNeeded() throws IOException {
        if (writtenInSegment < rotateBytes) return;
        ch.close();
        int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
        current = dir.resolve(String.format("%08d.log", index + 1));
        ch = FileChannel.open(current, CREATE, WRITE, READ);
        writtenInSegment = 0;
    }

    /**
     * If there are existing segments, open the newest one positioned at its end;
     * otherwise create "00000001.log".
     */
    private void openNewestOrCreate() {
        List<Path> existing = segments();
        current = existing.isEmpty() ? dir.resolve("00000001.log") : existing.get(existing.size() - 1);
        try {
            long valid = Files.exists(current) ? scanSegment(current, null) : 0L;
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            if (ch.size() > valid) {
                log.warning(String.format("audit segment %s: truncating %d byte(s) of torn tail",
                        current.getFileName(), ch.size() - valid));
                ch.truncate(valid);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new PersistenceException("cannot open audit segment " + current, e);
        }
    }

    private List<Path> segments() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PersistenceException("cannot list audit directory " + dir, e);
        }
    }

    /**
     * Walk the records of one segment, decoding them into {@code out} unless it is null.
     *
     * @return offset just past the last intact record
     */
    private long scanSegment(Path segment, List<AuditRecord> out) {
        try (FileChannel in = FileChannel.open(segment, READ)) {
            long pos = 0;
            while (true) {
                ByteBuffer hdr = ByteBuffer.allocate(AuditRecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                int read = in.read(hdr, pos);
                if (read <= 0) return pos; // EOF or empty
                if (read < AuditRecordCodec.HEADER_BYTES) {
                    warnTail(segment, pos, "truncated header");
                    return pos;
                }
                hdr.flip();
                short magic = hdr.getShort();
                byte ver = hdr.get();
                int len = hdr.getInt();
                int crc = hdr.getInt();
                if (magic != AuditRecordCodec.MAGIC || ver != AuditRecordCodec.VERSION || len < 0) {
                    warnTail(segment, pos, "bad header");
                    return pos;
                }
                ByteBuffer payload = ByteBuffer.allocate(len);
                int r2 = in.read(payload, pos + AuditRecordCodec.HEADER_BYTES);
                if (r2 < len) {
                    warnTail(segment, pos, "truncated payload");
                    return pos;
                }
                byte[] bytes = payload.array();
                if (AuditRecordCodec.crc32(bytes) != crc) {
                    warnTail(segment, pos, "checksum mismatch");
                    return pos;
                }
                if (out != null) {
                    out.add(codec.decode(bytes));
                }
                pos += AuditRecordCodec.HEADER_BYTES + (long) len;
            }
        } catch (IOException e) {
            throw new PersistenceException("cannot read audit segment " + segment, e);
        }
    }

    private static void warnTail(Path segment, long pos, String reason) {
        log.log(Level.WARNING, String.format("audit segment %s: %s at offset %d, ignoring the rest",
                segment.getFileName(), reason, pos));
    }
}
