package io.tabtick.storage;

/**
 * Write-Ahead Log for the record store.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partial write is treated as
 *    absent during recovery (the reader stops at the first corrupt/truncated record).
 *  - append() fsyncs before returning, so a record acknowledged to the caller
 *    survives a crash.
 *  - reset() drops every segment; it is only called once a snapshot covering
 *    all appended records has been written.
 */
public interface Wal extends AutoCloseable {

    /** Append a single framed record (header+payload) and fsync it. */
    void append(byte[] serializedRecord);

    /** Start a new segment once the current one has grown past the configured size. */
    void rotateIfNeeded();

    /** Delete all segments and start over with an empty one. */
    void reset();

    /** Sequential reader over all segments, oldest first. */
    WalReader openReader();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (header stripped), or null at the end of the
         *         log or at the first corrupt/truncated record.
         */
        byte[] next();
    }
}
