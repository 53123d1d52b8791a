package io.tabtick.storage;

import io.tabtick.core.CollectionRecord;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.SnoozedItem;
import io.tabtick.core.TabRecord;
import io.tabtick.core.WindowMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for the engine's records.
 * <p>
 * Semantics:
 *  - save*() is durable before returning and replaces any record with the same id.
 *  - delete*() of an absent id is a no-op.
 *  - Parent foreign keys (Folder.collectionId, Tab.folderId) are immutable: saving
 *    a record that moves an existing id to another parent is rejected.
 *  - There is no multi-record transaction. A crash between two saves leaves the
 *    first one in place.
 */
public interface RecordStore {

    // ----- collections -----

    Optional<CollectionRecord> getCollection(String id);

    List<CollectionRecord> listCollections();

    /** The active collection bound to the given live window, if any. */
    Optional<CollectionRecord> findActiveCollectionByWindow(int windowId);

    void saveCollection(CollectionRecord collection);

    void deleteCollection(String id);

    // ----- folders -----

    Optional<FolderRecord> getFolder(String id);

    /** Folders of a collection ordered by position. */
    List<FolderRecord> foldersOf(String collectionId);

    void saveFolder(FolderRecord folder);

    void deleteFolder(String id);

    // ----- tabs -----

    Optional<TabRecord> getTab(String id);

    /** Tabs of a folder ordered by position. */
    List<TabRecord> tabsOf(String folderId);

    /** The tab whose live counterpart has the given id, if any. */
    Optional<TabRecord> findTabByLiveId(int liveTabId);

    void saveTab(TabRecord tab);

    void deleteTab(String id);

    // ----- snoozed items -----

    Optional<SnoozedItem> getSnoozed(String id);

    /** All snoozed items in the order they were first saved. */
    List<SnoozedItem> listSnoozed();

    void saveSnoozed(SnoozedItem item);

    void deleteSnoozed(String id);

    // ----- window metadata -----

    Optional<WindowMetadata> getWindowMetadata(String snoozeId);

    List<WindowMetadata> listWindowMetadata();

    void saveWindowMetadata(WindowMetadata metadata);

    void deleteWindowMetadata(String snoozeId);
}
