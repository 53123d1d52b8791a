package io.tabtick.server.snooze;

import io.tabtick.core.Ids;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.SnoozedItem;
import io.tabtick.core.ValidationException;
import io.tabtick.core.WindowMetadata;
import io.tabtick.core.WindowState;
import io.tabtick.core.browser.BrowserControl;
import io.tabtick.core.browser.LiveTab;
import io.tabtick.core.browser.LiveWindow;
import io.tabtick.core.browser.NewTab;
import io.tabtick.core.browser.NewWindow;
import io.tabtick.server.browser.Futures;
import io.tabtick.server.restore.BatchedTabCreator;
import io.tabtick.storage.RecordStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Snoozes and restores whole windows.
 * <p>
 * A window snooze stores the window's geometry as {@link WindowMetadata} under a
 * generated snooze id, then snoozes every tab with that id and one shared wakeAt.
 * {@link #restoreWindow} recreates the window from the metadata and the items
 * through the same batched creation path a collection restore uses.
 */
public final class WindowSnoozeService {
    private static final Logger log = Logger.getLogger(WindowSnoozeService.class.getName());

    private final SnoozeScheduler scheduler;
    private final RecordStore store;
    private final BrowserControl browser;
    private final BatchedTabCreator creator;
    private final Clock clock;

    public WindowSnoozeService(
            SnoozeScheduler scheduler,
            RecordStore store,
            BrowserControl browser,
            BatchedTabCreator creator,
            Clock clock
    ) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.store = Objects.requireNonNull(store, "store");
        this.browser = Objects.requireNonNull(browser, "browser");
        this.creator = Objects.requireNonNull(creator, "creator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public WindowSnoozeResult snoozeWindow(int windowId, Duration duration, SnoozeOptions options) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new ValidationException("duration must be > 0");
        }
        SnoozeOptions opts = options == null ? SnoozeOptions.defaults() : options;

        LiveWindow window = Futures.await(browser.getWindow(windowId));
        List<Integer> tabIds = new ArrayList<>();
        for (LiveTab t : Futures.await(browser.queryTabs(windowId))) {
            tabIds.add(t.id());
        }
        if (tabIds.isEmpty()) {
            throw new ValidationException("Window " + windowId + " has no tabs to snooze");
        }

        long now = clock.millis();
        long wakeAt = now + duration.toMillis();
        String snoozeId = Ids.newId(Ids.WINDOW_SNOOZE);

        // Metadata first: once the window closes its geometry is gone.
        WindowMetadata metadata = new WindowMetadata(
                snoozeId,
                windowId,
                window.left(),
                window.top(),
                window.width(),
                window.height(),
                window.state(),
                wakeAt,
                now
        );
        store.saveWindowMetadata(metadata);

        List<SnoozedItem> items = scheduler.snoozeTabs(tabIds, wakeAt, opts.forWindow(snoozeId, windowId));

        try {
            Futures.await(browser.removeWindow(windowId));
        } catch (RuntimeException e) {
            if (Futures.isNotFound(e)) {
                // Closing its last tab already closed the window.
                log.log(Level.FINE, "Window {0} already closed", windowId);
            } else {
                log.log(Level.WARNING, "Could not close snoozed window {0}: {1}",
                        new Object[]{windowId, Futures.describe(e)});
            }
        }

        log.log(Level.INFO, "Snoozed window {0} as {1} with {2} tabs until {3}",
                new Object[]{windowId, snoozeId, items.size(), wakeAt});
        return new WindowSnoozeResult(snoozeId, wakeAt, metadata, items.size(), items);
    }

    /**
     * Recreate a snoozed window. Its items are claimed for the duration so their
     * own wake timers cannot restore them a second time; items that fail to
     * open go back to the snooze list with their timers re-armed.
     */
    public WindowRestoreResult restoreWindow(String snoozeId) {
        if (snoozeId == null || snoozeId.isBlank()) {
            throw new ValidationException("snoozeId is required");
        }
        List<SnoozedItem> items = scheduler.claimWindowSnooze(snoozeId);
        if (items.isEmpty()) {
            store.deleteWindowMetadata(snoozeId);
            dropOrphanedMetadata();
            throw new NotFoundException("No snoozed tabs for window snooze: " + snoozeId);
        }

        Map<String, Integer> restored = new HashMap<>();
        try {
            List<String> warnings = new ArrayList<>();
            WindowMetadata metadata = store.getWindowMetadata(snoozeId).orElse(null);
            if (metadata == null) {
                SnoozedItem first = items.get(0);
                int sourceWindow = first.sourceWindowId() != null ? first.sourceWindowId() : -1;
                metadata = WindowMetadata.fallback(snoozeId, sourceWindow, first.wakeAt(), clock.millis());
                warnings.add("Window metadata missing, restoring with default geometry");
                log.log(Level.WARNING, "No window metadata for {0}, using defaults", snoozeId);
                dropOrphanedMetadata();
            }

            LiveWindow window = Futures.await(browser.createWindow(newWindowFrom(metadata)));
            List<Integer> defaultTabs = new ArrayList<>();
            try {
                for (LiveTab t : Futures.await(browser.queryTabs(window.id()))) {
                    defaultTabs.add(t.id());
                }
            } catch (RuntimeException e) {
                warnings.add("Could not list default tabs of window " + window.id() + ": " + Futures.describe(e));
            }

            List<NewTab> requests = new ArrayList<>(items.size());
            for (SnoozedItem item : items) {
                requests.add(NewTab.in(window.id(), item.url(), item.pinned(), false));
            }
            List<BatchedTabCreator.Outcome> outcomes = creator.createAll(requests);

            for (int i = 0; i < items.size(); i++) {
                BatchedTabCreator.Outcome outcome = outcomes.get(i);
                if (outcome.ok()) {
                    restored.put(items.get(i).id(), outcome.tab().id());
                } else {
                    warnings.add("Failed to restore " + items.get(i).url() + ": " + outcome.error());
                }
            }

            if (!restored.isEmpty() && !defaultTabs.isEmpty()) {
                try {
                    Futures.await(browser.removeTabs(defaultTabs));
                } catch (RuntimeException e) {
                    log.log(Level.FINE, "Default tabs {0} already removed: {1}",
                            new Object[]{defaultTabs, Futures.describe(e)});
                }
            }

            if (restored.size() == items.size()) {
                store.deleteWindowMetadata(snoozeId);
            }

            log.log(Level.INFO, "Restored window snooze {0} into window {1}: tabs={2}/{3}",
                    new Object[]{snoozeId, window.id(), restored.size(), items.size()});
            return new WindowRestoreResult(snoozeId, window.id(), restored.size(), metadata, warnings);
        } finally {
            scheduler.releaseWindowSnooze(items, restored);
        }
    }

    private void dropOrphanedMetadata() {
        try {
            scheduler.cleanupOrphanedMetadata();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Orphaned window metadata cleanup failed", e);
        }
    }

    /** Explicit bounds only apply to a normal window. */
    private static NewWindow newWindowFrom(WindowMetadata m) {
        if (m.state() != WindowState.NORMAL) {
            return NewWindow.of(true, m.state());
        }
        return new NewWindow(true, WindowState.NORMAL, m.left(), m.top(), m.width(), m.height());
    }
}
