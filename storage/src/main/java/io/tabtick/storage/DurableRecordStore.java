package io.tabtick.storage;

import io.tabtick.core.CollectionRecord;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.SnoozedItem;
import io.tabtick.core.TabRecord;
import io.tabtick.core.WindowMetadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WAL-backed {@link RecordStore}.
 * <p>
 * Responsibilities:
 *  - Keep every record in memory, one insertion-ordered map per kind, plus
 *    parent-id indexes for folders and tabs and a live-id index for tabs.
 *  - On write:
 *      1) Encode the record as JSON and frame it (kind, key, body).
 *      2) Append+fsync to the WAL.
 *      3) Apply to memory.
 *      4) Rotate the WAL segment if needed.
 *      5) Possibly write a full snapshot, then reset the WAL.
 *  - On startup:
 *      1) Load the latest snapshot (if any).
 *      2) Replay the WAL in order. Saves and deletes are plain overwrites, so a
 *         WAL that overlaps the snapshot replays to the same state.
 *      3) If anything was replayed, write a fresh snapshot and reset the WAL.
 */
public class DurableRecordStore implements RecordStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableRecordStore.class.getName());

    private final Map<String, CollectionRecord> collections = new LinkedHashMap<>();
    private final Map<String, FolderRecord> folders = new LinkedHashMap<>();
    private final Map<String, TabRecord> tabs = new LinkedHashMap<>();
    private final Map<String, SnoozedItem> snoozed = new LinkedHashMap<>();
    private final Map<String, WindowMetadata> windowMetadata = new LinkedHashMap<>();

    // Secondary indexes: parent id -> child ids.
    private final Map<String, Set<String>> foldersByCollection = new HashMap<>();
    private final Map<String, Set<String>> tabsByFolder = new HashMap<>();
    // live tab id -> durable tab id
    private final Map<Integer, String> tabByLiveId = new HashMap<>();

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableRecordStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    // ---------- collections ----------

    @Override
    public synchronized Optional<CollectionRecord> getCollection(String id) {
        return Optional.ofNullable(collections.get(id));
    }

    @Override
    public synchronized List<CollectionRecord> listCollections() {
        return List.copyOf(collections.values());
    }

    @Override
    public synchronized Optional<CollectionRecord> findActiveCollectionByWindow(int windowId) {
        return collections.values().stream()
                .filter(c -> c.active() && c.windowId() != null && c.windowId() == windowId)
                .findFirst();
    }

    @Override
    public synchronized void saveCollection(CollectionRecord collection) {
        CollectionRecord existing = collections.get(collection.id());
        if (existing != null && existing.createdAt() != collection.createdAt()) {
            throw new IllegalArgumentException("createdAt is immutable for collection " + collection.id());
        }
        write(RecordKind.COLLECTION, collection.id(), collection);
    }

    @Override
    public synchronized void deleteCollection(String id) {
        if (collections.containsKey(id)) {
            write(RecordKind.COLLECTION, id, null);
        }
    }

    // ---------- folders ----------

    @Override
    public synchronized Optional<FolderRecord> getFolder(String id) {
        return Optional.ofNullable(folders.get(id));
    }

    @Override
    public synchronized List<FolderRecord> foldersOf(String collectionId) {
        List<FolderRecord> out = new ArrayList<>();
        for (String id : foldersByCollection.getOrDefault(collectionId, Set.of())) {
            out.add(folders.get(id));
        }
        out.sort(Comparator.comparingInt(FolderRecord::position));
        return out;
    }

    @Override
    public synchronized void saveFolder(FolderRecord folder) {
        FolderRecord existing = folders.get(folder.id());
        if (existing != null && !existing.collectionId().equals(folder.collectionId())) {
            throw new IllegalArgumentException("collectionId is immutable for folder " + folder.id());
        }
        write(RecordKind.FOLDER, folder.id(), folder);
    }

    @Override
    public synchronized void deleteFolder(String id) {
        if (folders.containsKey(id)) {
            write(RecordKind.FOLDER, id, null);
        }
    }

    // ---------- tabs ----------

    @Override
    public synchronized Optional<TabRecord> getTab(String id) {
        return Optional.ofNullable(tabs.get(id));
    }

    @Override
    public synchronized List<TabRecord> tabsOf(String folderId) {
        List<TabRecord> out = new ArrayList<>();
        for (String id : tabsByFolder.getOrDefault(folderId, Set.of())) {
            out.add(tabs.get(id));
        }
        out.sort(Comparator.comparingInt(TabRecord::position));
        return out;
    }

    @Override
    public synchronized Optional<TabRecord> findTabByLiveId(int liveTabId) {
        String id = tabByLiveId.get(liveTabId);
        return id == null ? Optional.empty() : Optional.ofNullable(tabs.get(id));
    }

    @Override
    public synchronized void saveTab(TabRecord tab) {
        TabRecord existing = tabs.get(tab.id());
        if (existing != null && !existing.folderId().equals(tab.folderId())) {
            throw new IllegalArgumentException("folderId is immutable for tab " + tab.id());
        }
        write(RecordKind.TAB, tab.id(), tab);
    }

    @Override
    public synchronized void deleteTab(String id) {
        if (tabs.containsKey(id)) {
            write(RecordKind.TAB, id, null);
        }
    }

    // ---------- snoozed items ----------

    @Override
    public synchronized Optional<SnoozedItem> getSnoozed(String id) {
        return Optional.ofNullable(snoozed.get(id));
    }

    @Override
    public synchronized List<SnoozedItem> listSnoozed() {
        return List.copyOf(snoozed.values());
    }

    @Override
    public synchronized void saveSnoozed(SnoozedItem item) {
        write(RecordKind.SNOOZED, item.id(), item);
    }

    @Override
    public synchronized void deleteSnoozed(String id) {
        if (snoozed.containsKey(id)) {
            write(RecordKind.SNOOZED, id, null);
        }
    }

    // ---------- window metadata ----------

    @Override
    public synchronized Optional<WindowMetadata> getWindowMetadata(String snoozeId) {
        return Optional.ofNullable(windowMetadata.get(snoozeId));
    }

    @Override
    public synchronized List<WindowMetadata> listWindowMetadata() {
        return List.copyOf(windowMetadata.values());
    }

    @Override
    public synchronized void saveWindowMetadata(WindowMetadata metadata) {
        write(RecordKind.WINDOW_METADATA, metadata.snoozeId(), metadata);
    }

    @Override
    public synchronized void deleteWindowMetadata(String snoozeId) {
        if (windowMetadata.containsKey(snoozeId)) {
            write(RecordKind.WINDOW_METADATA, snoozeId, null);
        }
    }

    /** Full copy of the current contents. */
    public synchronized StoreImage image() {
        return new StoreImage(
                List.copyOf(collections.values()),
                List.copyOf(folders.values()),
                List.copyOf(tabs.values()),
                List.copyOf(snoozed.values()),
                List.copyOf(windowMetadata.values())
        );
    }

    @Override
    public synchronized void close() throws Exception {
        wal.close();
    }

    // ---------- internals ----------

    /** Durable write path. A null record is a delete. Caller holds the lock. */
    private void write(RecordKind kind, String key, Object record) {
        byte[] body = record == null ? null : RecordJson.encode(record);
        wal.append(RecordCodec.encode(kind, key, body));

        apply(kind, key, record);

        wal.rotateIfNeeded();
        if (snapPolicy.maybeSnapshot(this::image, snaps)) {
            // Everything appended so far is covered by the snapshot.
            wal.reset();
        }
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null && loaded.image() != null) {
            StoreImage img = loaded.image();
            img.collections().forEach(c -> apply(RecordKind.COLLECTION, c.id(), c));
            img.folders().forEach(f -> apply(RecordKind.FOLDER, f.id(), f));
            img.tabs().forEach(t -> apply(RecordKind.TAB, t.id(), t));
            img.snoozed().forEach(s -> apply(RecordKind.SNOOZED, s.id(), s));
            img.windowMetadata().forEach(m -> apply(RecordKind.WINDOW_METADATA, m.snoozeId(), m));
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                Object value = rec.tombstone() ? null : RecordJson.decode(rec.body(), rec.kind().type());
                apply(rec.kind(), rec.key(), value);
                replayed++;
            }
        } catch (Exception e) {
            throw new IllegalStateException("Recovery failed", e);
        }

        if (replayed > 0) {
            // Fold the replayed WAL into a snapshot; this also drops any torn tail
            // that later appends would otherwise sit behind.
            snaps.writeSnapshot(image());
            wal.reset();
        }

        log.log(Level.INFO, "Record store recovered (snapshot={0}, walRecords={1}, collections={2}, snoozed={3})",
                new Object[]{loaded == null ? "none" : loaded.id(), replayed, collections.size(), snoozed.size()});
    }

    /** Apply one mutation to memory and keep the parent indexes in step. */
    private void apply(RecordKind kind, String key, Object value) {
        switch (kind) {
            case COLLECTION -> {
                if (value == null) {
                    collections.remove(key);
                } else {
                    collections.put(key, (CollectionRecord) value);
                }
            }
            case FOLDER -> {
                FolderRecord old = value == null ? folders.remove(key) : folders.put(key, (FolderRecord) value);
                if (old != null) {
                    unindex(foldersByCollection, old.collectionId(), key);
                }
                if (value != null) {
                    foldersByCollection.computeIfAbsent(((FolderRecord) value).collectionId(),
                            k -> new LinkedHashSet<>()).add(key);
                }
            }
            case TAB -> {
                TabRecord old = value == null ? tabs.remove(key) : tabs.put(key, (TabRecord) value);
                if (old != null) {
                    unindex(tabsByFolder, old.folderId(), key);
                    if (old.liveTabId() != null) {
                        tabByLiveId.remove(old.liveTabId(), key);
                    }
                }
                if (value != null) {
                    TabRecord tab = (TabRecord) value;
                    tabsByFolder.computeIfAbsent(tab.folderId(), k -> new LinkedHashSet<>()).add(key);
                    if (tab.liveTabId() != null) {
                        tabByLiveId.put(tab.liveTabId(), key);
                    }
                }
            }
            case SNOOZED -> {
                if (value == null) {
                    snoozed.remove(key);
                } else {
                    snoozed.put(key, (SnoozedItem) value);
                }
            }
            case WINDOW_METADATA -> {
                if (value == null) {
                    windowMetadata.remove(key);
                } else {
                    windowMetadata.put(key, (WindowMetadata) value);
                }
            }
        }
    }

    private static void unindex(Map<String, Set<String>> index, String parentId, String childId) {
        Set<String> children = index.get(parentId);
        if (children == null) {
            return;
        }
        children.remove(childId);
        if (children.isEmpty()) {
            index.remove(parentId);
        }
    }
}
