package io.tabtick.server.snooze;

import io.tabtick.core.Ids;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.SnoozedItem;
import io.tabtick.core.TabRecord;
import io.tabtick.core.ValidationException;
import io.tabtick.core.WindowMetadata;
import io.tabtick.core.browser.BrowserControl;
import io.tabtick.core.browser.LiveGroup;
import io.tabtick.core.browser.LiveTab;
import io.tabtick.core.browser.LiveWindow;
import io.tabtick.core.browser.NewTab;
import io.tabtick.core.timer.TimerService;
import io.tabtick.server.binding.IdentityRemapper;
import io.tabtick.server.browser.Futures;
import io.tabtick.storage.RecordStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the snooze/wake state machine of individual tabs.
 * <p>
 * Item lifecycle:
 *   ACTIVE tab -> SNOOZED (record stored, one-shot timer armed)
 *   SNOOZED    -> WOKEN    (tab recreated, record removed)
 *              -> DELETED  (record removed, tab not recreated)
 *              -> SNOOZED  (rescheduled, timer re-armed)
 * <p>
 * Timers can be lost (restart, missed delivery), so a periodic sweep wakes
 * every overdue item and cleans up window metadata no item refers to.
 * <p>
 * Snoozing a tab that stands in for a durable tab clears that tab's live id;
 * waking it records the new one.
 * <p>
 * A window restore claims its items first. Claimed items are invisible to
 * timers, the sweep, wake, delete and reschedule until the claim is released.
 * <p>
 * State is rehydrated from the store on first use; all public methods are
 * synchronized so timer deliveries and API calls never interleave.
 */
public final class SnoozeScheduler {
    private static final Logger log = Logger.getLogger(SnoozeScheduler.class.getName());

    public static final String WAKE_TIMER_PREFIX = "snooze_wake_";
    public static final String PERIODIC_TIMER = "snooze_periodic_check";

    private final RecordStore store;
    private final BrowserControl browser;
    private final IdentityRemapper remapper;
    private final TimerService timers;
    private final Clock clock;
    private final Duration sweepInterval;

    // id -> item, in snooze order
    private final Map<String, SnoozedItem> items = new LinkedHashMap<>();
    // id -> item, held by an in-flight window restore
    private final Map<String, SnoozedItem> claimed = new HashMap<>();
    private boolean loaded;

    public SnoozeScheduler(
            RecordStore store,
            BrowserControl browser,
            IdentityRemapper remapper,
            TimerService timers,
            Clock clock,
            Duration sweepInterval
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.browser = Objects.requireNonNull(browser, "browser");
        this.remapper = Objects.requireNonNull(remapper, "remapper");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
    }

    /** Rehydrate now instead of on first use. */
    public synchronized void initialize() {
        ensureLoaded();
    }

    public static String wakeTimerName(String itemId) {
        return WAKE_TIMER_PREFIX + itemId;
    }

    // ---------- snooze ----------

    /**
     * Snooze live tabs until {@code wakeAt}.
     * Ids that no longer resolve to a tab are logged and skipped.
     *
     * @return the created items, in input order.
     */
    public synchronized List<SnoozedItem> snoozeTabs(List<Integer> liveTabIds, long wakeAt, SnoozeOptions options) {
        if (liveTabIds == null || liveTabIds.isEmpty()) {
            throw new ValidationException("tabIds must not be empty");
        }
        if (wakeAt <= 0) {
            throw new ValidationException("wakeAt must be > 0");
        }
        SnoozeOptions opts = options == null ? SnoozeOptions.defaults() : options;
        ensureLoaded();

        long now = clock.millis();
        List<SnoozedItem> created = new ArrayList<>();
        List<Integer> toClose = new ArrayList<>();
        for (Integer liveId : liveTabIds) {
            LiveTab tab;
            try {
                tab = Futures.await(browser.getTab(liveId));
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Cannot snooze tab {0}: {1}", new Object[]{liveId, Futures.describe(e)});
                continue;
            }
            Optional<TabRecord> stoodFor = remapper.findByLiveId(tab.id());
            SnoozedItem item = new SnoozedItem(
                    Ids.newId(Ids.SNOOZED),
                    tab.url(),
                    tab.title(),
                    tab.favIconUrl(),
                    tab.pinned(),
                    wakeAt,
                    opts.sourceWindowId() != null ? opts.sourceWindowId() : tab.windowId(),
                    opts.windowSnoozeId(),
                    tab.grouped() ? tab.groupId() : null,
                    opts.restorationMode(),
                    opts.reason(),
                    now,
                    tab.id(),
                    stoodFor.map(TabRecord::id).orElse(null)
            );
            store.saveSnoozed(item);
            items.put(item.id(), item);
            timers.arm(wakeTimerName(item.id()), wakeAt);
            stoodFor.ifPresent(t -> remapper.clear(t.id()));
            created.add(item);
            toClose.add(tab.id());
        }

        if (!toClose.isEmpty()) {
            try {
                Futures.await(browser.removeTabs(toClose));
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Snoozed tabs {0} could not be closed: {1}",
                        new Object[]{toClose, Futures.describe(e)});
            }
        }
        log.log(Level.INFO, "Snoozed {0} of {1} tabs until {2}",
                new Object[]{created.size(), liveTabIds.size(), wakeAt});
        return created;
    }

    // ---------- wake ----------

    /**
     * Recreate the given items as live tabs and drop them from the list.
     * <p>
     * An item is removed even when its tab cannot be recreated; the failure is
     * logged. Unknown ids are ignored.
     *
     * @return live ids of the recreated tabs.
     */
    public synchronized List<Integer> wakeTabs(List<String> ids, WakeOptions options) {
        WakeOptions opts = options == null ? WakeOptions.defaults() : options;
        ensureLoaded();
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }

        Set<String> wanted = new HashSet<>(ids);
        List<SnoozedItem> toWake = new ArrayList<>();
        for (SnoozedItem item : items.values()) {
            if (wanted.contains(item.id())) {
                toWake.add(item);
            }
        }

        LastFocused lastFocused = new LastFocused();
        List<Integer> woken = new ArrayList<>();
        for (int i = 0; i < toWake.size(); i++) {
            SnoozedItem item = toWake.get(i);
            try {
                Integer dest = opts.targetWindowId() != null
                        ? opts.targetWindowId()
                        : destinationOf(item, lastFocused);
                boolean active = opts.makeActive() && i == 0;
                LiveTab tab = Futures.await(browser.createTab(NewTab.in(dest, item.url(), item.pinned(), active)));
                regroup(item, tab);
                relink(item, tab.id());
                woken.add(tab.id());
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Failed to wake " + item.id() + " (" + item.url() + ")", e);
            } finally {
                forget(item.id());
            }
        }

        if (!toWake.isEmpty()) {
            log.log(Level.INFO, "Woke {0} of {1} snoozed tabs", new Object[]{woken.size(), toWake.size()});
        }
        return woken;
    }

    // ---------- timers ----------

    /** Timer delivery: wake one item, or run the sweep. Unknown names are ignored. */
    public synchronized void handleTimer(String name) {
        if (name == null) {
            return;
        }
        if (PERIODIC_TIMER.equals(name)) {
            sweep();
        } else if (name.startsWith(WAKE_TIMER_PREFIX)) {
            String id = name.substring(WAKE_TIMER_PREFIX.length());
            ensureLoaded();
            if (items.containsKey(id)) {
                wakeTabs(List.of(id), WakeOptions.defaults());
            } else {
                log.log(Level.FINE, "Timer for unknown snoozed item {0}", id);
            }
        } else {
            log.log(Level.FINE, "Ignoring unrelated timer {0}", name);
        }
    }

    /**
     * Wake every overdue item, then remove window metadata that no item refers to.
     *
     * @return number of items that were due.
     */
    public synchronized int sweep() {
        ensureLoaded();
        long now = clock.millis();
        List<String> due = new ArrayList<>();
        for (SnoozedItem item : items.values()) {
            if (item.isDue(now)) {
                due.add(item.id());
            }
        }
        if (!due.isEmpty()) {
            log.log(Level.INFO, "Sweep found {0} overdue snoozed tabs", due.size());
            wakeTabs(due, WakeOptions.defaults());
        }

        try {
            cleanupOrphanedMetadata();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Orphaned window metadata cleanup failed", e);
        }
        return due.size();
    }

    /**
     * Remove window metadata that no snoozed item refers to.
     *
     * @return number of metadata records removed.
     */
    public synchronized int cleanupOrphanedMetadata() {
        ensureLoaded();
        Set<String> referenced = new HashSet<>();
        for (SnoozedItem item : items.values()) {
            if (item.windowSnoozeId() != null) {
                referenced.add(item.windowSnoozeId());
            }
        }
        for (SnoozedItem item : claimed.values()) {
            referenced.add(item.windowSnoozeId());
        }
        int removed = 0;
        for (WindowMetadata meta : store.listWindowMetadata()) {
            if (!referenced.contains(meta.snoozeId())) {
                store.deleteWindowMetadata(meta.snoozeId());
                removed++;
            }
        }
        if (removed > 0) {
            log.log(Level.INFO, "Removed {0} orphaned window metadata records", removed);
        }
        return removed;
    }

    // ---------- edits & reads ----------

    public synchronized SnoozedItem reschedule(String id, long newWakeAt) {
        if (newWakeAt <= 0) {
            throw new ValidationException("wakeAt must be > 0");
        }
        ensureLoaded();
        SnoozedItem item = items.get(id);
        if (item == null) {
            throw new NotFoundException("Snoozed item not found: " + id);
        }
        SnoozedItem updated = item.rescheduled(newWakeAt);
        store.saveSnoozed(updated);
        items.put(id, updated);
        timers.arm(wakeTimerName(id), newWakeAt);
        return updated;
    }

    /** Remove an item without waking it. Unknown ids are a no-op. */
    public synchronized boolean delete(String id) {
        ensureLoaded();
        if (!items.containsKey(id)) {
            return false;
        }
        forget(id);
        return true;
    }

    public synchronized List<SnoozedItem> list() {
        ensureLoaded();
        return List.copyOf(items.values());
    }

    public synchronized Optional<SnoozedItem> get(String id) {
        ensureLoaded();
        return Optional.ofNullable(items.get(id));
    }

    public synchronized List<SnoozedItem> itemsForWindowSnooze(String snoozeId) {
        ensureLoaded();
        List<SnoozedItem> out = new ArrayList<>();
        for (SnoozedItem item : items.values()) {
            if (Objects.equals(snoozeId, item.windowSnoozeId())) {
                out.add(item);
            }
        }
        return out;
    }

    /**
     * Take every item of a window snooze away from timers and the sweep. The
     * items stay in the store until {@link #releaseWindowSnooze} settles them.
     *
     * @return the claimed items in snooze order; empty if none are available.
     */
    synchronized List<SnoozedItem> claimWindowSnooze(String snoozeId) {
        ensureLoaded();
        List<SnoozedItem> out = new ArrayList<>();
        for (SnoozedItem item : items.values()) {
            if (Objects.equals(snoozeId, item.windowSnoozeId())) {
                out.add(item);
            }
        }
        for (SnoozedItem item : out) {
            items.remove(item.id());
            timers.cancel(wakeTimerName(item.id()));
            claimed.put(item.id(), item);
        }
        return out;
    }

    /**
     * Settle a claim. Items with a live id in {@code restored} are removed and
     * their new live id recorded; the rest go back to the list with their
     * timers re-armed.
     */
    synchronized void releaseWindowSnooze(List<SnoozedItem> claimedItems, Map<String, Integer> restored) {
        for (SnoozedItem item : claimedItems) {
            if (claimed.remove(item.id()) == null) {
                continue;
            }
            Integer liveId = restored.get(item.id());
            if (liveId != null) {
                store.deleteSnoozed(item.id());
                relink(item, liveId);
            } else {
                items.put(item.id(), item);
                timers.arm(wakeTimerName(item.id()), item.wakeAt());
            }
        }
    }

    // ---------- internals ----------

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        timers.setListener(this::handleTimer);
        items.clear();
        for (SnoozedItem item : store.listSnoozed()) {
            items.put(item.id(), item);
            timers.arm(wakeTimerName(item.id()), item.wakeAt());
        }
        if (timers.get(PERIODIC_TIMER).isEmpty()) {
            timers.armPeriodic(PERIODIC_TIMER, sweepInterval);
        }
        loaded = true;
        log.log(Level.INFO, "Snooze scheduler loaded {0} items", items.size());
    }

    private void forget(String id) {
        timers.cancel(wakeTimerName(id));
        items.remove(id);
        store.deleteSnoozed(id);
    }

    /** Best effort: the group may be gone or live in another window. */
    private void regroup(SnoozedItem item, LiveTab tab) {
        Integer groupId = item.originalGroupId();
        if (groupId == null) {
            return;
        }
        try {
            LiveGroup group = Futures.await(browser.getGroup(groupId));
            if (group.windowId() != tab.windowId()) {
                log.log(Level.FINE, "Group {0} is in another window, leaving tab {1} ungrouped",
                        new Object[]{groupId, tab.id()});
                return;
            }
            Futures.await(browser.groupTabs(List.of(tab.id()), groupId));
        } catch (RuntimeException e) {
            log.log(Level.FINE, "Could not regroup tab {0} into {1}: {2}",
                    new Object[]{tab.id(), groupId, Futures.describe(e)});
        }
    }

    /** Point the durable tab this item stood in for at its new live tab. */
    private void relink(SnoozedItem item, int liveTabId) {
        if (item.tabRecordId() == null) {
            return;
        }
        try {
            remapper.assign(item.tabRecordId(), liveTabId);
        } catch (NotFoundException e) {
            log.log(Level.FINE, "Tab record {0} is gone, live tab {1} stays unlinked",
                    new Object[]{item.tabRecordId(), liveTabId});
        }
    }

    /** Null means "let the browser open a new window". */
    private Integer destinationOf(SnoozedItem item, LastFocused lastFocused) {
        return switch (item.restorationMode()) {
            case ORIGINAL -> windowExists(item.sourceWindowId()) ? item.sourceWindowId() : lastFocused.get();
            case CURRENT -> lastFocused.get();
            case NEW -> null;
        };
    }

    /** Last-focused window, looked up at most once per wake. */
    private final class LastFocused {
        private boolean resolved;
        private Integer windowId;

        Integer get() {
            if (!resolved) {
                resolved = true;
                try {
                    windowId = Futures.await(browser.lastFocusedWindow()).id();
                } catch (RuntimeException e) {
                    log.log(Level.FINE, "No focused window: {0}", Futures.describe(e));
                }
            }
            return windowId;
        }
    }

    private boolean windowExists(Integer windowId) {
        if (windowId == null) {
            return false;
        }
        try {
            LiveWindow w = Futures.await(browser.getWindow(windowId));
            return w != null;
        } catch (RuntimeException e) {
            if (!Futures.isNotFound(e)) {
                log.log(Level.FINE, "Window {0} lookup failed: {1}", new Object[]{windowId, Futures.describe(e)});
            }
            return false;
        }
    }
}
