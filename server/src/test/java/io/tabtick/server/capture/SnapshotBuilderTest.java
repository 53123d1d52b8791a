package io.tabtick.server.capture;

import io.tabtick.core.CollectionMetadata;
import io.tabtick.core.EmptyCaptureException;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.TabRecord;
import io.tabtick.core.ValidationException;
import io.tabtick.server.FakeBrowser;
import io.tabtick.server.MutableClock;
import io.tabtick.server.TestStores;
import io.tabtick.server.binding.BindingCache;
import io.tabtick.server.binding.IdentityRemapper;
import io.tabtick.storage.DurableRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for SnapshotBuilder: live window to durable record tree.
 */
class SnapshotBuilderTest {

    @TempDir
    Path dir;

    private DurableRecordStore store;
    private FakeBrowser browser;
    private BindingCache bindings;
    private SnapshotBuilder builder;

    @BeforeEach
    void setUp() {
        store = TestStores.open(dir);
        browser = new FakeBrowser();
        MutableClock clock = new MutableClock(1_000L);
        IdentityRemapper remapper = new IdentityRemapper(store);
        bindings = new BindingCache(store, browser, remapper, clock);
        builder = new SnapshotBuilder(store, browser, bindings, remapper, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    @Test
    void internal_pages_are_skipped_and_counted() {
        int w = browser.openWindow();
        browser.openTab(w, "https://a.com");
        browser.openTab(w, "chrome://settings");
        browser.openTab(w, "https://b.com");
        browser.openTab(w, "about:blank");
        browser.openTab(w, "https://c.com");

        CaptureResult result = builder.capture(CaptureRequest.of(w, "Mixed"));

        assertEquals(3, result.stats().tabsCaptured());
        assertEquals(2, result.stats().tabsSkipped());
        assertEquals(3, result.tabs().size());
        assertEquals(3, store.tabsOf(result.folders().get(0).id()).size());
    }

    @Test
    void groups_become_folders_in_order_and_ungrouped_tabs_go_last() {
        int w = browser.openWindow();
        int a = browser.openTab(w, "https://a.com");
        int b = browser.openTab(w, "https://b.com");
        browser.openTab(w, "https://loose.com");
        int c = browser.openTab(w, "https://c.com");
        browser.openGroup(w, "Research", "blue", false, a, b);
        browser.openGroup(w, "", "not-a-color", true, c);

        CaptureResult result = builder.capture(CaptureRequest.of(w, "Grouped"));

        List<FolderRecord> folders = store.foldersOf(result.collection().id());
        assertEquals(3, folders.size());
        assertEquals("Research", folders.get(0).name());
        assertEquals("blue", folders.get(0).color());
        assertEquals(SnapshotBuilder.UNTITLED_GROUP, folders.get(1).name());
        assertEquals("grey", folders.get(1).color());
        assertTrue(folders.get(1).collapsed());
        assertTrue(folders.get(2).ungrouped());
        assertEquals(2, folders.get(2).position());

        List<TabRecord> research = store.tabsOf(folders.get(0).id());
        assertEquals(List.of("https://a.com", "https://b.com"), List.of(research.get(0).url(), research.get(1).url()));
        assertEquals(0, research.get(0).position());
        assertEquals(1, research.get(1).position());
    }

    @Test
    void group_without_capturable_tabs_is_not_a_folder() {
        int w = browser.openWindow();
        int sys = browser.openTab(w, "chrome://extensions");
        browser.openTab(w, "https://a.com");
        browser.openGroup(w, "System", "red", false, sys);

        CaptureResult result = builder.capture(CaptureRequest.of(w, "Only loose"));

        assertEquals(1, result.folders().size());
        assertTrue(result.folders().get(0).ungrouped());
        assertEquals(0, result.folders().get(0).position());
    }

    @Test
    void keepActive_binds_window_and_records_live_ids() {
        int w = browser.openWindow();
        int live = browser.openTab(w, "https://a.com");

        CaptureResult result = builder.capture(CaptureRequest.of(w, "Bound"));

        assertTrue(result.collection().active());
        assertEquals(w, result.collection().windowId());
        assertEquals(live, result.tabs().get(0).liveTabId());
        assertEquals(result.collection().id(), bindings.getForWindow(w).orElseThrow().id());
    }

    @Test
    void keepActive_false_leaves_collection_unbound() {
        int w = browser.openWindow();
        browser.openTab(w, "https://a.com");

        CaptureResult result = builder.capture(new CaptureRequest(w, CollectionMetadata.named("Loose"), false));

        assertFalse(result.collection().active());
        assertNull(result.tabs().get(0).liveTabId());
        assertTrue(bindings.getForWindow(w).isEmpty());
    }

    @Test
    void window_of_only_internal_pages_is_an_empty_capture() {
        int w = browser.openWindow();
        browser.openTab(w, "chrome://newtab/");

        assertThrows(EmptyCaptureException.class, () -> builder.capture(CaptureRequest.of(w, "Nothing")));
        assertTrue(store.listCollections().isEmpty());
    }

    @Test
    void blank_name_is_rejected_before_any_write() {
        int w = browser.openWindow();
        browser.openTab(w, "https://a.com");

        assertThrows(ValidationException.class, () -> builder.capture(CaptureRequest.of(w, "  ")));
        assertTrue(store.listCollections().isEmpty());
    }

    @Test
    void unknown_window_is_not_found() {
        assertThrows(NotFoundException.class, () -> builder.capture(CaptureRequest.of(999, "Ghost")));
    }

    @Test
    void failing_group_query_degrades_to_ungrouped_capture_with_warning() {
        int w = browser.openWindow();
        int a = browser.openTab(w, "https://a.com");
        browser.openGroup(w, "G", "green", false, a);
        browser.failGroupQuery = true;

        CaptureResult result = builder.capture(CaptureRequest.of(w, "No groups"));

        assertEquals(1, result.folders().size());
        assertTrue(result.folders().get(0).ungrouped());
        assertFalse(result.stats().warnings().isEmpty());
    }

    @Test
    void blank_title_falls_back_to_url() {
        int w = browser.openWindow();
        browser.openTab(w, "https://a.com/x", "", false);

        CaptureResult result = builder.capture(CaptureRequest.of(w, "Titles"));

        assertEquals("https://a.com/x", result.tabs().get(0).title());
    }

    @Test
    void suggested_name_comes_from_dominant_host() {
        int w = browser.openWindow();
        browser.openTab(w, "https://github.com/a");
        browser.openTab(w, "https://github.com/b");
        browser.openTab(w, "https://news.ycombinator.com");

        assertEquals("github.com", builder.suggestName(w));
    }
}
