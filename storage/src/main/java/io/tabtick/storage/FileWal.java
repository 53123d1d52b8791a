package io.tabtick.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL writing framed records into numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction it creates the directory if needed and opens the newest
 *    segment for append (or creates the first one).
 *  - append() writes and fsyncs, tracking bytes written to the current segment.
 *  - rotateIfNeeded() opens the next segment once rotateBytes is reached.
 *  - The reader walks every segment in name order and stops at the first
 *    truncated header, truncated payload or CRC mismatch.
 */
public class FileWal implements Wal {
    private static final String FIRST_SEGMENT = "00000001.log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) {
            throw new IllegalArgumentException("rotateBytes must be > 0");
        }
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) {
            return;
        }
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
            current = dir.resolve(String.format("%08d.log", index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized void reset() {
        try {
            ch.close();
            for (Path seg : segments(dir)) {
                Files.deleteIfExists(seg);
            }
            current = dir.resolve(FIRST_SEGMENT);
            ch = FileChannel.open(current, CREATE, WRITE, READ, TRUNCATE_EXISTING);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL reset failed", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() throws IOException {
        if (ch != null) {
            ch.close();
        }
    }

    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve(FIRST_SEGMENT) : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Sequential reader used during recovery. */
    private static final class Reader implements WalReader {
        private final Deque<Path> pending;
        private FileChannel ch;
        private long pos = 0;
        private boolean corrupt = false;

        Reader(List<Path> segments) {
            this.pending = new ArrayDeque<>(segments);
        }

        @Override
        public byte[] next() {
            try {
                while (!corrupt) {
                    if (ch == null) {
                        Path seg = pending.poll();
                        if (seg == null) {
                            return null;
                        }
                        ch = FileChannel.open(seg, READ);
                        pos = 0;
                    }
                    byte[] payload = readRecord();
                    if (payload != null) {
                        return payload;
                    }
                    if (pos < ch.size()) {
                        // Garbage before the end of a segment: nothing after it can be trusted.
                        corrupt = true;
                    }
                    ch.close();
                    ch = null;
                }
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private byte[] readRecord() throws IOException {
            ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
            int read = ch.read(hdr, pos);
            if (read < RecordCodec.HEADER_BYTES) {
                return null;
            }
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) {
                return null;
            }
            ByteBuffer payload = ByteBuffer.allocate(len);
            int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
            if (r2 < len) {
                return null;
            }
            byte[] bytes = payload.array();
            if (RecordCodec.crc32(bytes) != crc) {
                return null;
            }
            pos += RecordCodec.HEADER_BYTES + (long) len;
            return bytes;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) {
                ch.close();
            }
        }
    }
}
