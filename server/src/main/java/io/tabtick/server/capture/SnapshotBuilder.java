package io.tabtick.server.capture;

import io.tabtick.core.CollectionMetadata;
import io.tabtick.core.CollectionRecord;
import io.tabtick.core.EmptyCaptureException;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.Ids;
import io.tabtick.core.NameSuggester;
import io.tabtick.core.TabRecord;
import io.tabtick.core.UrlPolicy;
import io.tabtick.core.ValidationException;
import io.tabtick.core.browser.BrowserControl;
import io.tabtick.core.browser.LiveGroup;
import io.tabtick.core.browser.LiveTab;
import io.tabtick.server.binding.BindingCache;
import io.tabtick.server.binding.IdentityRemapper;
import io.tabtick.server.browser.Futures;
import io.tabtick.storage.RecordStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts a live window into a durable Collection -> Folders -> Tabs tree.
 * <p>
 * Responsibilities:
 *  - Validate the window and metadata before touching anything.
 *  - Skip tabs whose URL cannot be reopened later (internal browser pages).
 *  - One folder per live group that kept at least one tab, in group order,
 *    plus a lazily created "Ungrouped" folder for the rest.
 *  - Persist collection, folders, then tabs.
 *  - Optionally bind the collection to the window and record live tab ids.
 */
public final class SnapshotBuilder {
    private static final Logger log = Logger.getLogger(SnapshotBuilder.class.getName());

    static final String UNTITLED_GROUP = "Untitled";

    private final RecordStore store;
    private final BrowserControl browser;
    private final BindingCache bindings;
    private final IdentityRemapper remapper;
    private final Clock clock;

    public SnapshotBuilder(
            RecordStore store,
            BrowserControl browser,
            BindingCache bindings,
            IdentityRemapper remapper,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.browser = Objects.requireNonNull(browser, "browser");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.remapper = Objects.requireNonNull(remapper, "remapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CaptureResult capture(CaptureRequest request) {
        Objects.requireNonNull(request, "request");
        CollectionMetadata metadata = request.metadata();
        if (metadata == null || metadata.name() == null || metadata.name().isBlank()) {
            throw new ValidationException("metadata.name is required");
        }
        int windowId = request.windowId();
        Futures.await(browser.getWindow(windowId));

        List<String> warnings = new ArrayList<>();
        List<LiveTab> liveTabs = Futures.await(browser.queryTabs(windowId));

        List<LiveGroup> groups;
        try {
            groups = Futures.await(browser.queryGroups(windowId));
        } catch (RuntimeException e) {
            warnings.add("Could not read tab groups, capturing without them: " + Futures.describe(e));
            log.log(Level.WARNING, "Group query failed for window {0}: {1}",
                    new Object[]{windowId, Futures.describe(e)});
            groups = List.of();
        }

        List<LiveTab> capturable = new ArrayList<>();
        int skipped = 0;
        for (LiveTab t : liveTabs) {
            if (UrlPolicy.isCapturable(t.url())) {
                capturable.add(t);
            } else {
                skipped++;
                warnings.add("Skipped non-capturable tab: " + t.url());
                log.log(Level.WARNING, "Skipping non-capturable tab {0} ({1})", new Object[]{t.id(), t.url()});
            }
        }
        if (capturable.isEmpty()) {
            throw new EmptyCaptureException(windowId, skipped);
        }

        long now = clock.millis();
        CollectionRecord collection = CollectionRecord.create(metadata, now);

        // live group id -> folder, only for groups that kept at least one tab
        Map<Integer, FolderRecord> folderByGroup = new LinkedHashMap<>();
        for (LiveGroup g : groups) {
            boolean used = capturable.stream().anyMatch(t -> t.groupId() == g.id());
            if (!used) {
                warnings.add("Skipped empty group: " + titleOf(g));
                log.log(Level.WARNING, "Skipping group {0} with no capturable tabs", g.id());
                continue;
            }
            folderByGroup.put(g.id(), FolderRecord.group(
                    collection.id(),
                    titleOf(g),
                    UrlPolicy.normalizeGroupColor(g.color()),
                    g.collapsed(),
                    folderByGroup.size()
            ));
        }

        FolderRecord ungrouped = null;
        Map<String, Integer> nextPosition = new LinkedHashMap<>();
        List<TabRecord> tabs = new ArrayList<>(capturable.size());
        List<Integer> liveIds = new ArrayList<>(capturable.size());
        for (LiveTab t : capturable) {
            FolderRecord folder = folderByGroup.get(t.groupId());
            if (folder == null) {
                if (ungrouped == null) {
                    ungrouped = FolderRecord.ungrouped(collection.id(), folderByGroup.size());
                }
                folder = ungrouped;
            }
            int position = nextPosition.merge(folder.id(), 1, Integer::sum) - 1;
            String title = t.title() == null || t.title().isBlank() ? t.url() : t.title();
            tabs.add(new TabRecord(Ids.newId(Ids.TAB), folder.id(), t.url(), title, t.favIconUrl(),
                    position, t.pinned(), null));
            liveIds.add(t.id());
        }

        List<FolderRecord> folders = new ArrayList<>(folderByGroup.values());
        if (ungrouped != null) {
            folders.add(ungrouped);
        }

        store.saveCollection(collection);
        folders.forEach(store::saveFolder);
        tabs.forEach(store::saveTab);

        if (request.keepActive()) {
            collection = bindings.bind(collection.id(), windowId);
            List<TabRecord> live = new ArrayList<>(tabs.size());
            for (int i = 0; i < tabs.size(); i++) {
                live.add(remapper.assign(tabs.get(i).id(), liveIds.get(i)));
            }
            tabs = live;
        }

        tabs.sort((a, b) -> {
            int fa = folderIndex(folders, a.folderId());
            int fb = folderIndex(folders, b.folderId());
            return fa != fb ? Integer.compare(fa, fb) : Integer.compare(a.position(), b.position());
        });

        var stats = new CaptureStats(capturable.size(), skipped, folders.size(), warnings);
        log.log(Level.INFO, "Captured window {0} as {1}: tabs={2}, skipped={3}, folders={4}",
                new Object[]{windowId, collection.id(), stats.tabsCaptured(), skipped, folders.size()});
        return new CaptureResult(collection, List.copyOf(folders), List.copyOf(tabs), stats);
    }

    /** Suggested collection name for a live window, from the hostnames of its tabs. */
    public String suggestName(int windowId) {
        List<String> urls = new ArrayList<>();
        for (LiveTab t : Futures.await(browser.queryTabs(windowId))) {
            urls.add(t.url());
        }
        return NameSuggester.suggestName(urls);
    }

    private static String titleOf(LiveGroup g) {
        return g.title() == null || g.title().isBlank() ? UNTITLED_GROUP : g.title();
    }

    private static int folderIndex(List<FolderRecord> folders, String folderId) {
        for (int i = 0; i < folders.size(); i++) {
            if (folders.get(i).id().equals(folderId)) {
                return i;
            }
        }
        return folders.size();
    }
}
