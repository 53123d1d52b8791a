package io.tabtick.server.binding;

import io.tabtick.core.CollectionMetadata;
import io.tabtick.core.CollectionRecord;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.Ids;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.TabRecord;
import io.tabtick.server.FakeBrowser;
import io.tabtick.server.MutableClock;
import io.tabtick.server.TestStores;
import io.tabtick.storage.DurableRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for BindingCache: window to collection lookups, displacement and cold-start rebuild.
 */
class BindingCacheTest {

    @TempDir
    Path dir;

    private DurableRecordStore store;
    private FakeBrowser browser;
    private IdentityRemapper remapper;
    private BindingCache cache;

    @BeforeEach
    void setUp() {
        store = TestStores.open(dir);
        browser = new FakeBrowser();
        remapper = new IdentityRemapper(store);
        cache = new BindingCache(store, browser, remapper, new MutableClock(5_000L));
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    private CollectionRecord collection(String name) {
        CollectionRecord c = CollectionRecord.create(CollectionMetadata.named(name), 1_000L);
        store.saveCollection(c);
        return c;
    }

    @Test
    void bind_persists_and_lookup_finds_collection() {
        int w = browser.openWindow();
        CollectionRecord c = collection("A");

        CollectionRecord bound = cache.bind(c.id(), w);

        assertTrue(bound.active());
        assertEquals(w, bound.windowId());
        assertEquals(c.id(), cache.getForWindow(w).orElseThrow().id());
        assertTrue(store.getCollection(c.id()).orElseThrow().active());
    }

    @Test
    void binding_a_window_displaces_its_previous_collection() {
        int w = browser.openWindow();
        CollectionRecord a = collection("A");
        CollectionRecord b = collection("B");
        cache.bind(a.id(), w);

        cache.bind(b.id(), w);

        assertFalse(store.getCollection(a.id()).orElseThrow().active());
        assertEquals(b.id(), cache.getForWindow(w).orElseThrow().id());
    }

    @Test
    void rebinding_to_another_window_evicts_the_old_window() {
        int w1 = browser.openWindow();
        int w2 = browser.openWindow();
        CollectionRecord a = collection("A");
        cache.bind(a.id(), w1);

        cache.bind(a.id(), w2);

        assertTrue(cache.getForWindow(w1).isEmpty());
        assertEquals(a.id(), cache.getForWindow(w2).orElseThrow().id());
    }

    @Test
    void lookup_reads_through_to_the_store_when_cache_is_cold() {
        int w = browser.openWindow();
        CollectionRecord a = collection("A");
        store.saveCollection(a.bound(w, 2_000L));

        assertEquals(0, cache.size());
        assertEquals(a.id(), cache.getForWindow(w).orElseThrow().id());
        assertEquals(1, cache.size());
    }

    @Test
    void unbind_is_idempotent_and_clears_live_ids() {
        int w = browser.openWindow();
        CollectionRecord a = collection("A");
        FolderRecord f = FolderRecord.ungrouped(a.id(), 0);
        store.saveFolder(f);
        TabRecord t = new TabRecord(Ids.newId(Ids.TAB), f.id(), "https://a.com", "a", null, 0, false, null);
        store.saveTab(t);
        cache.bind(a.id(), w);
        remapper.assign(t.id(), 42);

        cache.unbind(a.id());
        CollectionRecord again = cache.unbind(a.id());

        assertFalse(again.active());
        assertNull(again.windowId());
        assertTrue(cache.getForWindow(w).isEmpty());
        assertNull(store.getTab(t.id()).orElseThrow().liveTabId());
    }

    @Test
    void unbind_unknown_collection_is_not_found() {
        assertThrows(NotFoundException.class, () -> cache.unbind("col_missing"));
    }

    @Test
    void rebuild_unbinds_collections_whose_window_closed_out_of_band() {
        int kept = browser.openWindow();
        int closed = browser.openWindow();
        CollectionRecord a = collection("A");
        CollectionRecord b = collection("B");
        cache.bind(a.id(), kept);
        cache.bind(b.id(), closed);

        browser.closeWindowOutOfBand(closed);
        cache.clear();
        BindingCache.RebuildReport report = cache.rebuild();

        assertEquals(1, report.bound());
        assertEquals(1, report.orphaned());
        assertEquals(a.id(), cache.getForWindow(kept).orElseThrow().id());
        assertTrue(cache.getForWindow(closed).isEmpty());
        assertFalse(store.getCollection(b.id()).orElseThrow().active());
    }
}
