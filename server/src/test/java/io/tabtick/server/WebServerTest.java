package io.tabtick.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabtick.server.binding.BindingCache;
import io.tabtick.server.binding.IdentityRemapper;
import io.tabtick.server.capture.SnapshotBuilder;
import io.tabtick.server.restore.BatchedTabCreator;
import io.tabtick.server.restore.RestorationEngine;
import io.tabtick.server.snooze.SnoozeScheduler;
import io.tabtick.server.snooze.WindowSnoozeService;
import io.tabtick.storage.DurableRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for WebServer routing, JSON mapping and error semantics.
 *
 * Focus:
 *  - Happy paths for capture, restore, snooze, wake and delete.
 *  - Unknown ids -> 404, bad input -> 400, nothing to capture -> 422.
 *  - Invalid JSON -> 400 "invalid JSON", too-large body -> 413, wrong method -> 405.
 */
class WebServerTest {

    private static final int PORT = 18080; // test-only port
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path dir;

    private DurableRecordStore store;
    private FakeBrowser browser;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        store = TestStores.open(dir);
        browser = new FakeBrowser();
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        IdentityRemapper remapper = new IdentityRemapper(store);
        BindingCache bindings = new BindingCache(store, browser, remapper, clock);
        BatchedTabCreator creator = new BatchedTabCreator(browser, 10, Duration.ZERO);
        SnoozeScheduler snoozer = new SnoozeScheduler(store, browser, remapper, new ManualTimerService(clock), clock,
                Duration.ofMinutes(5));

        server = new WebServer(
                PORT,
                new SnapshotBuilder(store, browser, bindings, remapper, clock),
                new RestorationEngine(store, browser, creator, bindings, remapper),
                bindings,
                snoozer,
                new WindowSnoozeService(snoozer, store, browser, creator, clock)
        );
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() throws Exception {
        if (server != null) {
            server.stop();
        }
        store.close();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + PORT + path))
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> resp) throws Exception {
        return JSON.readTree(resp.body());
    }

    @Test
    void health_is_ok() throws Exception {
        HttpResponse<String> resp = send("GET", "/admin/health", null);

        assertEquals(200, resp.statusCode());
        assertEquals("ok", json(resp).get("status").asText());
    }

    @Test
    void capture_then_restore_over_http() throws Exception {
        int w = browser.openWindow();
        browser.openTab(w, "https://a.com");
        browser.openTab(w, "https://b.com");

        HttpResponse<String> captured = send("POST", "/collections/capture",
                "{\"windowId\":" + w + ",\"metadata\":{\"name\":\"Work\",\"tags\":[\"x\"]}}");
        assertEquals(200, captured.statusCode(), captured.body());
        JsonNode body = json(captured);
        String id = body.get("collection").get("id").asText();
        assertEquals("Work", body.get("collection").get("name").asText());
        assertEquals(2, body.get("stats").get("tabsCaptured").asInt());

        HttpResponse<String> bound = send("GET", "/windows/" + w + "/collection", null);
        assertEquals(200, bound.statusCode());
        assertEquals(id, json(bound).get("id").asText());

        HttpResponse<String> restored = send("POST", "/collections/" + id + "/restore", "");
        assertEquals(200, restored.statusCode(), restored.body());
        int newWindow = json(restored).get("windowId").asInt();
        assertEquals(2, browser.tabsIn(newWindow).size());
    }

    @Test
    void capture_of_only_internal_pages_is_422() throws Exception {
        int w = browser.openWindow();
        browser.openTab(w, "chrome://settings");

        HttpResponse<String> resp = send("POST", "/collections/capture",
                "{\"windowId\":" + w + ",\"metadata\":{\"name\":\"Nothing\"}}");

        assertEquals(422, resp.statusCode());
        assertTrue(json(resp).has("error"));
    }

    @Test
    void capture_without_name_is_400() throws Exception {
        int w = browser.openWindow();
        browser.openTab(w, "https://a.com");

        HttpResponse<String> resp = send("POST", "/collections/capture", "{\"windowId\":" + w + "}");

        assertEquals(400, resp.statusCode());
    }

    @Test
    void unknown_ids_are_404() throws Exception {
        assertEquals(404, send("POST", "/collections/col_missing/restore", "").statusCode());
        assertEquals(404, send("POST", "/collections/col_missing/unbind", "").statusCode());
        assertEquals(404, send("GET", "/windows/77/collection", null).statusCode());
        assertEquals(404, send("PUT", "/snoozed/snz_missing", "{\"wakeAt\": 5}").statusCode());
        assertEquals(404, send("GET", "/nope", null).statusCode());
    }

    @Test
    void invalid_json_is_400() throws Exception {
        HttpResponse<String> resp = send("POST", "/collections/capture", "{not json");

        assertEquals(400, resp.statusCode());
        assertEquals("invalid JSON", json(resp).get("error").asText());
    }

    @Test
    void unknown_restoration_mode_is_400() throws Exception {
        int w = browser.openWindow();
        int t = browser.openTab(w, "https://a.com");

        HttpResponse<String> resp = send("POST", "/snoozed",
                "{\"tabIds\":[" + t + "],\"wakeAt\":1700000100000,\"restorationMode\":\"sideways\"}");

        assertEquals(400, resp.statusCode());
    }

    @Test
    void body_over_one_mebibyte_is_413() throws Exception {
        String big = "{\"x\":\"" + "a".repeat(1024 * 1024 + 10) + "\"}";

        HttpResponse<String> resp = send("POST", "/collections/capture", big);

        assertEquals(413, resp.statusCode());
    }

    @Test
    void wrong_method_is_405() throws Exception {
        assertEquals(405, send("GET", "/collections/capture", null).statusCode());
    }

    @Test
    void snooze_list_wake_and_delete_over_http() throws Exception {
        int w = browser.openWindow();
        browser.openTab(w, "https://keep.com");
        int a = browser.openTab(w, "https://a.com");
        int b = browser.openTab(w, "https://b.com");

        HttpResponse<String> snoozed = send("POST", "/snoozed",
                "{\"tabIds\":[" + a + "," + b + "],\"wakeAt\":1700000100000}");
        assertEquals(200, snoozed.statusCode(), snoozed.body());
        JsonNode items = json(snoozed).get("items");
        assertEquals(2, items.size());
        String first = items.get(0).get("id").asText();
        String second = items.get(1).get("id").asText();
        assertEquals("original", items.get(0).get("restorationMode").asText());

        assertEquals(2, json(send("GET", "/snoozed", null)).get("items").size());

        HttpResponse<String> woken = send("POST", "/snoozed/wake", "{\"ids\":[\"" + first + "\"]}");
        assertEquals(200, woken.statusCode());
        assertEquals(1, json(woken).get("tabIds").size());
        assertTrue(browser.urlsIn(w).contains("https://a.com"));

        HttpResponse<String> deleted = send("DELETE", "/snoozed/" + second, null);
        assertTrue(json(deleted).get("deleted").asBoolean());
        assertFalse(json(send("DELETE", "/snoozed/" + second, null)).get("deleted").asBoolean());
        assertEquals(0, json(send("GET", "/snoozed", null)).get("items").size());
    }

    @Test
    void window_snooze_and_restore_over_http() throws Exception {
        int w = browser.openWindow();
        browser.openTab(w, "https://a.com");
        browser.openTab(w, "https://b.com");

        HttpResponse<String> snoozed = send("POST", "/windows/" + w + "/snooze", "{\"durationMillis\":60000}");
        assertEquals(200, snoozed.statusCode(), snoozed.body());
        String snoozeId = json(snoozed).get("snoozeId").asText();
        assertFalse(browser.hasWindow(w));

        HttpResponse<String> restored = send("POST", "/window-snoozes/" + snoozeId + "/restore", "");
        assertEquals(200, restored.statusCode(), restored.body());
        assertEquals(2, json(restored).get("tabCount").asInt());

        assertEquals(404, send("POST", "/window-snoozes/" + snoozeId + "/restore", "").statusCode());
    }

    @Test
    void non_numeric_window_id_is_400() throws Exception {
        assertEquals(400, send("GET", "/windows/abc/suggested-name", null).statusCode());
    }
}
