package io.tabtick.storage;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * On restart the latest snapshot seeds memory, then the WAL written after it
 * is replayed.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the store.
     *
     * @return snapshot identifier (file name).
     */
    String writeSnapshot(StoreImage image);

    /** Latest snapshot, or null if none was ever written. */
    LoadedSnapshot loadLatest();

    record LoadedSnapshot(String id, StoreImage image) {}
}
