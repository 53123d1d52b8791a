package io.tabtick.server.snooze;

import io.tabtick.core.NotFoundException;
import io.tabtick.core.SnoozedItem;
import io.tabtick.core.ValidationException;
import io.tabtick.core.WindowMetadata;
import io.tabtick.core.WindowState;
import io.tabtick.core.browser.NewWindow;
import io.tabtick.server.FakeBrowser;
import io.tabtick.server.ManualTimerService;
import io.tabtick.server.MutableClock;
import io.tabtick.server.TestStores;
import io.tabtick.server.binding.IdentityRemapper;
import io.tabtick.server.restore.BatchedTabCreator;
import io.tabtick.storage.DurableRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for WindowSnoozeService: whole-window snooze and restore.
 */
class WindowSnoozeServiceTest {

    private static final long T0 = 1_700_000_000_000L;

    @TempDir
    Path dir;

    private DurableRecordStore store;
    private FakeBrowser browser;
    private MutableClock clock;
    private ManualTimerService timers;
    private SnoozeScheduler scheduler;
    private WindowSnoozeService service;

    @BeforeEach
    void setUp() {
        store = TestStores.open(dir);
        browser = new FakeBrowser();
        clock = new MutableClock(T0);
        timers = new ManualTimerService(clock);
        scheduler = new SnoozeScheduler(store, browser, new IdentityRemapper(store), timers, clock, Duration.ofMinutes(1));
        service = new WindowSnoozeService(scheduler, store, browser,
                new BatchedTabCreator(browser, 5, Duration.ZERO), clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    private int windowWithTabs(String... urls) {
        int w = browser.openWindow(WindowState.NORMAL, 100, 50, 1280, 800);
        for (String url : urls) {
            browser.openTab(w, url);
        }
        return w;
    }

    @Test
    void snooze_window_closes_it_and_tags_every_item() {
        int w = windowWithTabs("https://a.com", "https://b.com", "https://c.com");

        WindowSnoozeResult result = service.snoozeWindow(w, Duration.ofHours(2), SnoozeOptions.defaults());

        assertFalse(browser.hasWindow(w));
        assertEquals(3, result.tabCount());
        assertEquals(T0 + Duration.ofHours(2).toMillis(), result.wakeAt());
        for (SnoozedItem item : scheduler.list()) {
            assertEquals(result.snoozeId(), item.windowSnoozeId());
            assertEquals(w, item.sourceWindowId());
            assertEquals(result.wakeAt(), item.wakeAt());
        }
        WindowMetadata meta = store.getWindowMetadata(result.snoozeId()).orElseThrow();
        assertEquals(w, meta.windowId());
        assertEquals(100, meta.left());
        assertEquals(1280, meta.width());
    }

    @Test
    void snooze_window_validates_input() {
        int empty = browser.openWindow();

        assertThrows(ValidationException.class, () -> service.snoozeWindow(empty, Duration.ZERO, null));
        assertThrows(ValidationException.class, () -> service.snoozeWindow(empty, Duration.ofMinutes(5), null));
        assertThrows(NotFoundException.class, () -> service.snoozeWindow(404, Duration.ofMinutes(5), null));
        assertTrue(store.listWindowMetadata().isEmpty());
    }

    @Test
    void restore_window_recreates_geometry_and_tabs_then_forgets_the_snooze() {
        int w = windowWithTabs("https://a.com", "https://b.com");
        WindowSnoozeResult snoozed = service.snoozeWindow(w, Duration.ofHours(1), null);

        WindowRestoreResult restored = service.restoreWindow(snoozed.snoozeId());

        assertEquals(2, restored.tabCount());
        assertEquals(List.of("https://a.com", "https://b.com"), browser.urlsIn(restored.windowId()));
        NewWindow props = browser.createdWindows.get(0);
        assertEquals(100, props.left());
        assertEquals(800, props.height());
        assertTrue(scheduler.itemsForWindowSnooze(snoozed.snoozeId()).isEmpty());
        assertTrue(store.getWindowMetadata(snoozed.snoozeId()).isEmpty());
        assertTrue(restored.warnings().isEmpty());
    }

    @Test
    void maximized_window_is_restored_without_explicit_bounds() {
        int w = browser.openWindow(WindowState.MAXIMIZED, 0, 0, 1920, 1080);
        browser.openTab(w, "https://a.com");
        WindowSnoozeResult snoozed = service.snoozeWindow(w, Duration.ofHours(1), null);

        service.restoreWindow(snoozed.snoozeId());

        NewWindow props = browser.createdWindows.get(0);
        assertEquals(WindowState.MAXIMIZED, props.state());
        assertNull(props.width());
    }

    @Test
    void failed_items_stay_snoozed_after_restore() {
        int w = windowWithTabs("https://a.com", "https://broken.com");
        WindowSnoozeResult snoozed = service.snoozeWindow(w, Duration.ofHours(1), null);
        browser.failingUrls.add("https://broken.com");

        WindowRestoreResult restored = service.restoreWindow(snoozed.snoozeId());

        assertEquals(1, restored.tabCount());
        assertEquals(1, restored.warnings().size());
        List<SnoozedItem> left = scheduler.itemsForWindowSnooze(snoozed.snoozeId());
        assertEquals(1, left.size());
        assertEquals("https://broken.com", left.get(0).url());
    }

    @Test
    void missing_metadata_falls_back_to_default_geometry() {
        int w = windowWithTabs("https://a.com");
        WindowSnoozeResult snoozed = service.snoozeWindow(w, Duration.ofHours(1), null);
        store.deleteWindowMetadata(snoozed.snoozeId());

        WindowRestoreResult restored = service.restoreWindow(snoozed.snoozeId());

        assertEquals(1, restored.tabCount());
        assertEquals(WindowState.NORMAL, restored.metadata().state());
        assertNull(browser.createdWindows.get(0).left());
        assertFalse(restored.warnings().isEmpty());
    }

    @Test
    void restore_without_items_is_not_found_and_drops_metadata() {
        store.saveWindowMetadata(WindowMetadata.fallback("wsnz_stale", 7, T0, T0));

        assertThrows(NotFoundException.class, () -> service.restoreWindow("wsnz_stale"));
        assertTrue(store.getWindowMetadata("wsnz_stale").isEmpty());
        assertEquals(0, browser.windowCount());
    }

    @Test
    void wake_timer_delivered_mid_restore_does_not_open_the_tab_twice() {
        int w = windowWithTabs("https://a.com", "https://b.com");
        WindowSnoozeResult snoozed = service.snoozeWindow(w, Duration.ofHours(1), null);
        String second = scheduler.itemsForWindowSnooze(snoozed.snoozeId()).get(1).id();
        clock.advance(Duration.ofHours(1));
        browser.beforeCreateTab = props -> {
            browser.beforeCreateTab = null;
            scheduler.handleTimer(SnoozeScheduler.wakeTimerName(second));
        };

        WindowRestoreResult restored = service.restoreWindow(snoozed.snoozeId());

        assertEquals(2, restored.tabCount());
        assertEquals(2, browser.createdTabs.size());
        assertEquals(List.of("https://a.com", "https://b.com"), browser.urlsIn(restored.windowId()));
        assertEquals(1, browser.windowCount());
        assertTrue(scheduler.list().isEmpty());
        assertTrue(store.listSnoozed().isEmpty());
    }

    @Test
    void restore_in_progress_hides_its_items_from_wake_timers() {
        int w = windowWithTabs("https://a.com", "https://b.com");
        WindowSnoozeResult snoozed = service.snoozeWindow(w, Duration.ofHours(1), null);
        List<SnoozedItem> items = scheduler.itemsForWindowSnooze(snoozed.snoozeId());
        browser.beforeCreateTab = props -> {
            browser.beforeCreateTab = null;
            for (SnoozedItem item : items) {
                assertTrue(timers.get(SnoozeScheduler.wakeTimerName(item.id())).isEmpty());
                assertTrue(scheduler.get(item.id()).isEmpty());
            }
        };

        service.restoreWindow(snoozed.snoozeId());

        assertNull(browser.beforeCreateTab);
    }

    @Test
    void failed_items_get_their_wake_timer_back() {
        int w = windowWithTabs("https://a.com", "https://broken.com");
        WindowSnoozeResult snoozed = service.snoozeWindow(w, Duration.ofHours(1), null);
        browser.failingUrls.add("https://broken.com");

        service.restoreWindow(snoozed.snoozeId());

        SnoozedItem left = scheduler.itemsForWindowSnooze(snoozed.snoozeId()).get(0);
        assertEquals(snoozed.wakeAt(),
                timers.get(SnoozeScheduler.wakeTimerName(left.id())).orElseThrow().whenMillis());
        assertTrue(store.getSnoozed(left.id()).isPresent());
        assertTrue(store.getWindowMetadata(snoozed.snoozeId()).isPresent());

        browser.failingUrls.clear();
        clock.advance(Duration.ofHours(1));
        timers.fire(SnoozeScheduler.wakeTimerName(left.id()));

        assertTrue(scheduler.list().isEmpty());
    }

    @Test
    void missing_metadata_restore_also_drops_other_orphaned_metadata() {
        int w = windowWithTabs("https://a.com");
        WindowSnoozeResult snoozed = service.snoozeWindow(w, Duration.ofHours(1), null);
        store.deleteWindowMetadata(snoozed.snoozeId());
        store.saveWindowMetadata(WindowMetadata.fallback("wsnz_orphan", 9, T0, T0));

        service.restoreWindow(snoozed.snoozeId());

        assertTrue(store.getWindowMetadata("wsnz_orphan").isEmpty());
    }

    @Test
    void restore_without_items_also_drops_other_orphaned_metadata() {
        int w = windowWithTabs("https://a.com");
        WindowSnoozeResult live = service.snoozeWindow(w, Duration.ofHours(1), null);
        store.saveWindowMetadata(WindowMetadata.fallback("wsnz_orphan", 9, T0, T0));

        assertThrows(NotFoundException.class, () -> service.restoreWindow("wsnz_gone"));

        assertTrue(store.getWindowMetadata("wsnz_orphan").isEmpty());
        assertTrue(store.getWindowMetadata(live.snoozeId()).isPresent());
    }
}
