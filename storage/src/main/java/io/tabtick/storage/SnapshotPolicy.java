package io.tabtick.storage;

import java.util.function.Supplier;

/**
 * Triggers a full snapshot after every N writes.
 * <p>
 * Bounds recovery time by limiting WAL replay length. Not thread-safe on its
 * own; the store calls it under its lock.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private int sinceLast;

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) {
            throw new IllegalArgumentException("everyOps must be > 0");
        }
        this.everyOps = everyOps;
    }

    /**
     * Call after each durable write.
     *
     * @return true if a snapshot was written (the caller may then reset its WAL).
     */
    public boolean maybeSnapshot(Supplier<StoreImage> image, Snapshotter snaps) {
        if (++sinceLast < everyOps) {
            return false;
        }
        snaps.writeSnapshot(image.get());
        sinceLast = 0;
        return true;
    }
}
