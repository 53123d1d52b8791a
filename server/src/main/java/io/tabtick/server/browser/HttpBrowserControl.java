package io.tabtick.server.browser;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabtick.core.BrowserApiException;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.browser.BrowserControl;
import io.tabtick.core.browser.GroupUpdate;
import io.tabtick.core.browser.LiveGroup;
import io.tabtick.core.browser.LiveTab;
import io.tabtick.core.browser.LiveWindow;
import io.tabtick.core.browser.NewTab;
import io.tabtick.core.browser.NewWindow;
import io.tabtick.core.browser.WindowUpdate;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP-based BrowserControl.
 *
 * Talks to a browser bridge (an extension or devtools shim that owns the real
 * browser APIs) with one JSON-RPC style endpoint per method:
 *
 *   POST {base}/rpc/{method}
 *   body: JSON object of named parameters
 *
 * Responses:
 *   - 200: the JSON result (empty body for void methods),
 *   - 404: the window/tab/group does not exist -> NotFoundException,
 *   - anything else, or a transport failure -> BrowserApiException.
 *
 * Error bodies are expected as {"error": "..."}; the message is surfaced as-is.
 */
public final class HttpBrowserControl implements BrowserControl {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final JavaType TAB = MAPPER.constructType(LiveTab.class);
    private static final JavaType TABS = MAPPER.getTypeFactory().constructCollectionType(List.class, LiveTab.class);
    private static final JavaType GROUP = MAPPER.constructType(LiveGroup.class);
    private static final JavaType GROUPS = MAPPER.getTypeFactory().constructCollectionType(List.class, LiveGroup.class);
    private static final JavaType WINDOW = MAPPER.constructType(LiveWindow.class);
    private static final JavaType WINDOWS = MAPPER.getTypeFactory().constructCollectionType(List.class, LiveWindow.class);
    private static final JavaType INT = MAPPER.constructType(Integer.class);
    private static final JavaType VOID = MAPPER.constructType(Void.class);

    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient client;

    public HttpBrowserControl(URI baseUri, Duration timeout) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public CompletableFuture<List<LiveTab>> queryTabs(Integer windowId) {
        return call("queryTabs", params("windowId", windowId), TABS);
    }

    @Override
    public CompletableFuture<LiveTab> getTab(int tabId) {
        return call("getTab", params("tabId", tabId), TAB);
    }

    @Override
    public CompletableFuture<List<LiveGroup>> queryGroups(int windowId) {
        return call("queryGroups", params("windowId", windowId), GROUPS);
    }

    @Override
    public CompletableFuture<LiveGroup> getGroup(int groupId) {
        return call("getGroup", params("groupId", groupId), GROUP);
    }

    @Override
    public CompletableFuture<LiveWindow> getWindow(int windowId) {
        return call("getWindow", params("windowId", windowId), WINDOW);
    }

    @Override
    public CompletableFuture<List<LiveWindow>> listWindows() {
        return call("listWindows", Map.of(), WINDOWS);
    }

    @Override
    public CompletableFuture<LiveWindow> lastFocusedWindow() {
        return call("lastFocusedWindow", Map.of(), WINDOW);
    }

    @Override
    public CompletableFuture<LiveWindow> createWindow(NewWindow props) {
        return call("createWindow", props, WINDOW);
    }

    @Override
    public CompletableFuture<Void> removeWindow(int windowId) {
        return call("removeWindow", params("windowId", windowId), VOID);
    }

    @Override
    public CompletableFuture<LiveTab> createTab(NewTab props) {
        return call("createTab", props, TAB);
    }

    @Override
    public CompletableFuture<Void> removeTabs(List<Integer> tabIds) {
        return call("removeTabs", params("tabIds", tabIds), VOID);
    }

    @Override
    public CompletableFuture<LiveTab> moveTab(int tabId, int windowId, int index) {
        Map<String, Object> p = params("tabId", tabId);
        p.put("windowId", windowId);
        p.put("index", index);
        return call("moveTab", p, TAB);
    }

    @Override
    public CompletableFuture<Integer> groupTabs(List<Integer> tabIds, Integer groupId) {
        Map<String, Object> p = params("tabIds", tabIds);
        if (groupId != null) {
            p.put("groupId", groupId);
        }
        return call("groupTabs", p, INT);
    }

    @Override
    public CompletableFuture<LiveGroup> updateGroup(int groupId, GroupUpdate props) {
        Map<String, Object> p = params("groupId", groupId);
        p.put("props", props);
        return call("updateGroup", p, GROUP);
    }

    @Override
    public CompletableFuture<LiveWindow> updateWindow(int windowId, WindowUpdate props) {
        Map<String, Object> p = params("windowId", windowId);
        p.put("props", props);
        return call("updateWindow", p, WINDOW);
    }

    // ---------- internals ----------

    private static Map<String, Object> params(String name, Object value) {
        Map<String, Object> p = new LinkedHashMap<>();
        if (value != null) {
            p.put(name, value);
        }
        return p;
    }

    private <T> CompletableFuture<T> call(String method, Object params, JavaType resultType) {
        byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(params);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new BrowserApiException("Cannot encode params for " + method, e));
        }

        HttpRequest req = HttpRequest.newBuilder(baseUri.resolve("/rpc/" + method))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .<T>handle((resp, err) -> {
                    if (err != null) {
                        throw new BrowserApiException(
                                "Browser bridge unreachable for " + method + ": " + Futures.describe(err),
                                Futures.unwrap(err));
                    }
                    return decode(method, resp, resultType);
                });
    }

    private static <T> T decode(String method, HttpResponse<String> resp, JavaType resultType) {
        int status = resp.statusCode();
        String body = resp.body();
        if (status == 404) {
            throw new NotFoundException(errorMessage(body, method + " target not found"));
        }
        if (status != 200) {
            throw new BrowserApiException(
                    "Browser bridge returned HTTP " + status + " for " + method + ": "
                            + errorMessage(body, "no details"));
        }
        if (resultType.hasRawClass(Void.class) || body == null || body.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(body, resultType);
        } catch (IOException e) {
            throw new BrowserApiException("Malformed " + method + " response from browser bridge", e);
        }
    }

    private static String errorMessage(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            JsonNode error = node.get("error");
            return error != null && error.isTextual() ? error.asText() : fallback;
        } catch (IOException e) {
            return fallback;
        }
    }
}
