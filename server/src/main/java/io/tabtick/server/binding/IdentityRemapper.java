package io.tabtick.server.binding;

import io.tabtick.core.FolderRecord;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.TabRecord;
import io.tabtick.storage.RecordStore;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maintains the dual-id scheme: a durable tab id that never changes and the
 * ephemeral live tab id of its current counterpart.
 * <p>
 * Invariant: a live id is held by at most one durable tab. Assigning an id that
 * another tab still holds clears it there first.
 */
public final class IdentityRemapper {
    private static final Logger log = Logger.getLogger(IdentityRemapper.class.getName());

    private final RecordStore store;

    public IdentityRemapper(RecordStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** Record the live counterpart of a durable tab. */
    public synchronized TabRecord assign(String tabId, int liveTabId) {
        TabRecord tab = store.getTab(tabId)
                .orElseThrow(() -> new NotFoundException("Tab not found: " + tabId));

        findByLiveId(liveTabId)
                .filter(holder -> !holder.id().equals(tabId))
                .ifPresent(holder -> {
                    log.log(Level.FINE, "Live tab {0} moves from {1} to {2}",
                            new Object[]{liveTabId, holder.id(), tabId});
                    store.saveTab(holder.withLiveTabId(null));
                });

        TabRecord updated = tab.withLiveTabId(liveTabId);
        store.saveTab(updated);
        return updated;
    }

    /** Forget the live counterpart of one tab. Unknown ids are ignored. */
    public synchronized void clear(String tabId) {
        store.getTab(tabId)
                .filter(t -> t.liveTabId() != null)
                .ifPresent(t -> store.saveTab(t.withLiveTabId(null)));
    }

    /**
     * Forget the live counterparts of every tab in a collection.
     *
     * @return number of tabs that had a live id.
     */
    public synchronized int clearAll(String collectionId) {
        int cleared = 0;
        for (FolderRecord folder : store.foldersOf(collectionId)) {
            for (TabRecord tab : store.tabsOf(folder.id())) {
                if (tab.liveTabId() != null) {
                    store.saveTab(tab.withLiveTabId(null));
                    cleared++;
                }
            }
        }
        return cleared;
    }

    /** The durable tab currently bound to a live tab id, if any. */
    public synchronized Optional<TabRecord> findByLiveId(int liveTabId) {
        return store.findTabByLiveId(liveTabId);
    }
}
