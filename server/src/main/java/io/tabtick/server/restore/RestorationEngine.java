package io.tabtick.server.restore;

import io.tabtick.core.CollectionRecord;
import io.tabtick.core.EmptyRestoreException;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.TabRecord;
import io.tabtick.core.UrlPolicy;
import io.tabtick.core.ValidationException;
import io.tabtick.core.browser.BrowserControl;
import io.tabtick.core.browser.GroupUpdate;
import io.tabtick.core.browser.LiveTab;
import io.tabtick.core.browser.LiveWindow;
import io.tabtick.core.browser.NewTab;
import io.tabtick.core.browser.NewWindow;
import io.tabtick.core.browser.WindowUpdate;
import io.tabtick.server.binding.BindingCache;
import io.tabtick.server.binding.IdentityRemapper;
import io.tabtick.server.browser.Futures;
import io.tabtick.storage.RecordStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds a live window from a stored collection.
 * <p>
 * Flow:
 *  1) Validate ids and the target window, load the record tree and drop tabs
 *     that cannot be reopened.
 *  2) Open a placeholder window (or use the given one).
 *  3) Per folder in position order: create its tabs through
 *     {@link BatchedTabCreator}, record live ids, and put them into the
 *     folder's live group (created on first use, styled once).
 *  4) Move every created tab to the index implied by folder and tab position.
 *  5) Remove the placeholder window's default tabs and bind the collection.
 * <p>
 * A failure on a single tab is a warning; only validation and the window
 * itself can fail the whole restore.
 */
public final class RestorationEngine {
    private static final Logger log = Logger.getLogger(RestorationEngine.class.getName());

    private final RecordStore store;
    private final BrowserControl browser;
    private final BatchedTabCreator creator;
    private final BindingCache bindings;
    private final IdentityRemapper remapper;

    public RestorationEngine(
            RecordStore store,
            BrowserControl browser,
            BatchedTabCreator creator,
            BindingCache bindings,
            IdentityRemapper remapper
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.browser = Objects.requireNonNull(browser, "browser");
        this.creator = Objects.requireNonNull(creator, "creator");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.remapper = Objects.requireNonNull(remapper, "remapper");
    }

    public RestoreResult restore(String collectionId, RestoreOptions options) {
        if (collectionId == null || collectionId.isBlank()) {
            throw new ValidationException("collectionId is required");
        }
        RestoreOptions opts = options == null ? RestoreOptions.defaults() : options;
        if (!opts.createNewWindow() && opts.windowId() == null) {
            throw new ValidationException("windowId is required when createNewWindow is false");
        }

        CollectionRecord collection = store.getCollection(collectionId)
                .orElseThrow(() -> NotFoundException.collection(collectionId));
        if (!opts.createNewWindow()) {
            Futures.await(browser.getWindow(opts.windowId()));
        }

        List<String> warnings = new ArrayList<>();
        int skipped = 0;
        Map<FolderRecord, List<TabRecord>> plan = new LinkedHashMap<>();
        for (FolderRecord folder : store.foldersOf(collectionId)) {
            List<TabRecord> keep = new ArrayList<>();
            for (TabRecord tab : store.tabsOf(folder.id())) {
                if (UrlPolicy.isCapturable(tab.url())) {
                    keep.add(tab);
                } else {
                    skipped++;
                    warnings.add("Skipped non-restorable tab: " + tab.url());
                    log.log(Level.WARNING, "Skipping non-restorable tab {0} ({1})", new Object[]{tab.id(), tab.url()});
                }
            }
            if (!keep.isEmpty()) {
                plan.put(folder, keep);
            }
        }
        if (plan.isEmpty()) {
            throw new EmptyRestoreException("collection " + collectionId);
        }

        int windowId;
        List<Integer> defaultTabs = List.of();
        // restored tabs go after whatever the window already holds
        int firstIndex = 0;
        if (opts.createNewWindow()) {
            LiveWindow window = Futures.await(browser.createWindow(NewWindow.of(opts.focused(), opts.windowState())));
            windowId = window.id();
            defaultTabs = liveTabIds(windowId, warnings);
        } else {
            windowId = opts.windowId();
            firstIndex = existingTabCount(windowId, warnings);
        }

        List<RestoreResult.RestoredTab> restored = new ArrayList<>();
        Map<String, Integer> liveByTabId = new HashMap<>();
        Map<String, Integer> groupByFolder = new HashMap<>();

        for (Map.Entry<FolderRecord, List<TabRecord>> e : plan.entrySet()) {
            FolderRecord folder = e.getKey();
            List<TabRecord> tabs = e.getValue();

            List<NewTab> requests = new ArrayList<>(tabs.size());
            for (TabRecord tab : tabs) {
                requests.add(NewTab.in(windowId, tab.url(), tab.pinned(), false));
            }
            List<BatchedTabCreator.Outcome> outcomes = creator.createAll(requests);

            for (int i = 0; i < tabs.size(); i++) {
                TabRecord tab = tabs.get(i);
                BatchedTabCreator.Outcome outcome = outcomes.get(i);
                if (!outcome.ok()) {
                    warnings.add("Failed to create tab " + tab.url() + ": " + outcome.error());
                    continue;
                }
                LiveTab live = outcome.tab();
                liveByTabId.put(tab.id(), live.id());
                restored.add(new RestoreResult.RestoredTab(tab.id(), live.id(), tab.url()));

                try {
                    remapper.assign(tab.id(), live.id());
                } catch (RuntimeException ex) {
                    warnings.add("Failed to record live id for tab " + tab.id() + ": " + Futures.describe(ex));
                    log.log(Level.WARNING, "Remap failed for tab " + tab.id(), ex);
                }

                if (!folder.ungrouped()) {
                    addToGroup(folder, live.id(), groupByFolder, warnings);
                }
            }
        }

        reorder(plan, liveByTabId, windowId, firstIndex, warnings);

        if (!defaultTabs.isEmpty() && !restored.isEmpty()) {
            removeDefaultTabs(defaultTabs);
        }
        if (!opts.createNewWindow() && opts.focused()) {
            try {
                Futures.await(browser.updateWindow(windowId, WindowUpdate.focus()));
            } catch (RuntimeException ex) {
                log.log(Level.FINE, "Could not focus window {0}: {1}", new Object[]{windowId, Futures.describe(ex)});
            }
        }

        bindings.bind(collectionId, windowId);

        var stats = new RestoreResult.RestoreStats(restored.size(), skipped, groupByFolder.size(), warnings);
        log.log(Level.INFO, "Restored {0} ({1}) into window {2}: tabs={3}, skipped={4}, groups={5}, warnings={6}",
                new Object[]{collectionId, collection.name(), windowId, restored.size(), skipped,
                        groupByFolder.size(), warnings.size()});
        return new RestoreResult(collectionId, windowId, List.copyOf(restored), stats);
    }

    // ---------- internals ----------

    private void addToGroup(FolderRecord folder, int liveTabId, Map<String, Integer> groupByFolder, List<String> warnings) {
        Integer groupId = groupByFolder.get(folder.id());
        try {
            if (groupId != null) {
                Futures.await(browser.groupTabs(List.of(liveTabId), groupId));
                return;
            }
            int created = Futures.await(browser.groupTabs(List.of(liveTabId), null));
            groupByFolder.put(folder.id(), created);
            Futures.await(browser.updateGroup(created,
                    new GroupUpdate(folder.name(), UrlPolicy.normalizeGroupColor(folder.color()), folder.collapsed())));
        } catch (RuntimeException ex) {
            warnings.add("Failed to group tab " + liveTabId + " into " + folder.name() + ": " + Futures.describe(ex));
            log.log(Level.WARNING, "Grouping failed for tab {0} in folder {1}: {2}",
                    new Object[]{liveTabId, folder.id(), Futures.describe(ex)});
        }
    }

    /** Final pass so live order follows (folder position, tab position), not creation order. */
    private void reorder(Map<FolderRecord, List<TabRecord>> plan, Map<String, Integer> liveByTabId,
                         int windowId, int firstIndex, List<String> warnings) {
        int index = firstIndex;
        for (List<TabRecord> tabs : plan.values()) {
            for (TabRecord tab : tabs) {
                Integer liveId = liveByTabId.get(tab.id());
                if (liveId == null) {
                    continue;
                }
                try {
                    Futures.await(browser.moveTab(liveId, windowId, index));
                } catch (RuntimeException ex) {
                    warnings.add("Failed to move tab " + liveId + " to index " + index + ": " + Futures.describe(ex));
                    log.log(Level.WARNING, "Move failed for tab {0}: {1}", new Object[]{liveId, Futures.describe(ex)});
                }
                index++;
            }
        }
    }

    private List<Integer> liveTabIds(int windowId, List<String> warnings) {
        try {
            List<Integer> ids = new ArrayList<>();
            for (LiveTab t : Futures.await(browser.queryTabs(windowId))) {
                ids.add(t.id());
            }
            return ids;
        } catch (RuntimeException ex) {
            warnings.add("Could not list default tabs of window " + windowId + ": " + Futures.describe(ex));
            return List.of();
        }
    }

    /** Unknown counts as empty, which moves restored tabs to the front. */
    private int existingTabCount(int windowId, List<String> warnings) {
        try {
            return Futures.await(browser.queryTabs(windowId)).size();
        } catch (RuntimeException ex) {
            warnings.add("Could not list tabs of window " + windowId + ": " + Futures.describe(ex));
            return 0;
        }
    }

    /** Best effort: the default tabs may already be gone. */
    private void removeDefaultTabs(List<Integer> tabIds) {
        try {
            Futures.await(browser.removeTabs(tabIds));
        } catch (RuntimeException ex) {
            log.log(Level.FINE, "Default tabs {0} already removed: {1}", new Object[]{tabIds, Futures.describe(ex)});
        }
    }
}
