package io.tabtick.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Tuning knobs of the engine, optionally loaded from a JSON file.
 * <p>
 * Every field may be omitted; omitted or null fields take the defaults below.
 *
 * @param batchSize            tabs created per batch (default 10)
 * @param batchDelayMillis     pause between batches (default 100)
 * @param sweepIntervalSeconds periodic snooze sweep interval (default 300)
 * @param snapshotEveryOps     store writes between snapshots (default 10000)
 * @param walRotateBytes       WAL segment size (default 64 MiB)
 */
public record EngineConfig(
        Integer batchSize,
        Long batchDelayMillis,
        Long sweepIntervalSeconds,
        Integer snapshotEveryOps,
        Long walRotateBytes
) {
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final long DEFAULT_BATCH_DELAY_MILLIS = 100;
    public static final long DEFAULT_SWEEP_INTERVAL_SECONDS = 300;
    public static final int DEFAULT_SNAPSHOT_EVERY_OPS = 10_000;
    public static final long DEFAULT_WAL_ROTATE_BYTES = 64L * 1024 * 1024;

    public EngineConfig {
        batchSize = batchSize == null ? DEFAULT_BATCH_SIZE : batchSize;
        batchDelayMillis = batchDelayMillis == null ? DEFAULT_BATCH_DELAY_MILLIS : batchDelayMillis;
        sweepIntervalSeconds = sweepIntervalSeconds == null ? DEFAULT_SWEEP_INTERVAL_SECONDS : sweepIntervalSeconds;
        snapshotEveryOps = snapshotEveryOps == null ? DEFAULT_SNAPSHOT_EVERY_OPS : snapshotEveryOps;
        walRotateBytes = walRotateBytes == null ? DEFAULT_WAL_ROTATE_BYTES : walRotateBytes;

        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        if (batchDelayMillis < 0) throw new IllegalArgumentException("batchDelayMillis must be >= 0");
        if (sweepIntervalSeconds <= 0) throw new IllegalArgumentException("sweepIntervalSeconds must be > 0");
        if (snapshotEveryOps <= 0) throw new IllegalArgumentException("snapshotEveryOps must be > 0");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
    }

    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null, null);
    }

    public static EngineConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            EngineConfig cfg = mapper.readValue(path.toFile(), EngineConfig.class);
            return cfg == null ? defaults() : cfg;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load EngineConfig from " + path, e);
        }
    }

    public Duration batchDelay() {
        return Duration.ofMillis(batchDelayMillis);
    }

    public Duration sweepInterval() {
        return Duration.ofSeconds(sweepIntervalSeconds);
    }
}
