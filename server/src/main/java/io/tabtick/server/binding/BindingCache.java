package io.tabtick.server.binding;

import io.tabtick.core.CollectionRecord;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.browser.BrowserControl;
import io.tabtick.core.browser.LiveWindow;
import io.tabtick.server.browser.Futures;
import io.tabtick.storage.RecordStore;

import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-through map from live window id to the collection bound to it.
 * <p>
 * Responsibilities:
 *  - The store is the source of truth (Collection.active/windowId); the cache
 *    only saves the lookup and is rebuilt wholesale after a cold start.
 *  - A window is bound to at most one collection: binding displaces the
 *    previous holder.
 *  - Unbinding also forgets the live ids of the collection's tabs.
 * <p>
 * Concurrent updates are last-writer-wins.
 */
public final class BindingCache {
    private static final Logger log = Logger.getLogger(BindingCache.class.getName());

    /** Outcome of {@link #rebuild()}. */
    public record RebuildReport(int bound, int orphaned) {}

    private final RecordStore store;
    private final BrowserControl browser;
    private final IdentityRemapper remapper;
    private final Clock clock;
    private final Map<Integer, String> windowToCollection = new ConcurrentHashMap<>();

    public BindingCache(RecordStore store, BrowserControl browser, IdentityRemapper remapper, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.browser = Objects.requireNonNull(browser, "browser");
        this.remapper = Objects.requireNonNull(remapper, "remapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Bind a collection to a live window and persist the binding. */
    public CollectionRecord bind(String collectionId, int windowId) {
        CollectionRecord col = store.getCollection(collectionId)
                .orElseThrow(() -> NotFoundException.collection(collectionId));

        if (col.active() && col.windowId() != windowId) {
            windowToCollection.remove(col.windowId(), collectionId);
        }

        store.findActiveCollectionByWindow(windowId)
                .filter(other -> !other.id().equals(collectionId))
                .ifPresent(other -> {
                    log.log(Level.INFO, "Window {0} rebinds from collection {1} to {2}",
                            new Object[]{windowId, other.id(), collectionId});
                    store.saveCollection(other.unbound(clock.millis()));
                });

        CollectionRecord bound = col.bound(windowId, clock.millis());
        store.saveCollection(bound);
        windowToCollection.put(windowId, collectionId);
        return bound;
    }

    /** Mark a collection inactive. Repeated calls are no-ops. */
    public CollectionRecord unbind(String collectionId) {
        CollectionRecord col = store.getCollection(collectionId)
                .orElseThrow(() -> NotFoundException.collection(collectionId));
        windowToCollection.values().removeIf(collectionId::equals);
        if (!col.active()) {
            return col;
        }
        CollectionRecord unbound = col.unbound(clock.millis());
        store.saveCollection(unbound);
        remapper.clearAll(collectionId);
        return unbound;
    }

    /** The collection bound to a live window, if any. */
    public Optional<CollectionRecord> getForWindow(int windowId) {
        String cached = windowToCollection.get(windowId);
        if (cached != null) {
            Optional<CollectionRecord> col = store.getCollection(cached)
                    .filter(c -> c.active() && c.windowId() != null && c.windowId() == windowId);
            if (col.isPresent()) {
                return col;
            }
            // Collection deleted or rebound elsewhere behind the cache's back.
            windowToCollection.remove(windowId, cached);
        }

        Optional<CollectionRecord> found = store.findActiveCollectionByWindow(windowId);
        found.ifPresent(c -> windowToCollection.put(windowId, c.id()));
        return found;
    }

    /**
     * Rebuild the cache from the store, keeping only collections whose window is
     * still open. Collections bound to vanished windows are unbound in the store.
     */
    public RebuildReport rebuild() {
        Set<Integer> open = new HashSet<>();
        for (LiveWindow w : Futures.await(browser.listWindows())) {
            open.add(w.id());
        }

        Map<Integer, String> fresh = new HashMap<>();
        int orphaned = 0;
        for (CollectionRecord col : store.listCollections()) {
            if (!col.active()) {
                continue;
            }
            if (open.contains(col.windowId()) && !fresh.containsKey(col.windowId())) {
                fresh.put(col.windowId(), col.id());
            } else {
                store.saveCollection(col.unbound(clock.millis()));
                remapper.clearAll(col.id());
                orphaned++;
            }
        }

        windowToCollection.clear();
        windowToCollection.putAll(fresh);
        log.log(Level.INFO, "Binding cache rebuilt: bound={0}, orphaned={1}", new Object[]{fresh.size(), orphaned});
        return new RebuildReport(fresh.size(), orphaned);
    }

    public void clear() {
        windowToCollection.clear();
    }

    public int size() {
        return windowToCollection.size();
    }
}
