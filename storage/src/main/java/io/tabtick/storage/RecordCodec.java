package io.tabtick.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x7AB1
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - kind:      byte (see {@link RecordKind})
 *     - key:       int32 len + UTF-8 bytes
 *     - tombstone: byte (0 or 1)
 *     - body:      int32 len + JSON bytes (len == -1 => null, used by tombstones)
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x7AB1;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    /** Decoded payload. {@code body} is null for deletes. */
    record LogRecord(RecordKind kind, String key, boolean tombstone, byte[] body) {}

    private RecordCodec() {
    }

    static byte[] encode(RecordKind kind, String key, byte[] body) {
        byte[] payload = encodePayload(kind, key, body);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        RecordKind kind = RecordKind.fromCode(b.get());
        byte[] keyBytes = readBytes(b);
        if (keyBytes == null) {
            throw new IllegalStateException("WAL record without key");
        }
        boolean tombstone = b.get() != 0;
        byte[] body = readBytes(b);
        return new LogRecord(kind, new String(keyBytes, StandardCharsets.UTF_8), tombstone, body);
    }

    private static byte[] encodePayload(RecordKind kind, String key, byte[] body) {
        byte[] sKey = key.getBytes(StandardCharsets.UTF_8);
        int size = 1 + 4 + sKey.length + 1 + 4 + (body == null ? 0 : body.length);

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(kind.code());
        writeBytes(b, sKey);
        b.put((byte) (body == null ? 1 : 0));
        writeBytes(b, body);
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) {
            b.putInt(-1);
            return;
        }
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) {
            return null;
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
