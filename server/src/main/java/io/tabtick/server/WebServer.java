package io.tabtick.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabtick.core.BrowserApiException;
import io.tabtick.core.EmptyCaptureException;
import io.tabtick.core.EmptyRestoreException;
import io.tabtick.core.NotFoundException;
import io.tabtick.core.RestorationMode;
import io.tabtick.core.TabTickException;
import io.tabtick.core.ValidationException;
import io.tabtick.server.binding.BindingCache;
import io.tabtick.server.capture.CaptureRequest;
import io.tabtick.server.capture.SnapshotBuilder;
import io.tabtick.server.dto.RescheduleRequest;
import io.tabtick.server.dto.SnoozeTabsRequest;
import io.tabtick.server.dto.SnoozeWindowRequest;
import io.tabtick.server.dto.WakeRequest;
import io.tabtick.server.restore.RestorationEngine;
import io.tabtick.server.restore.RestoreOptions;
import io.tabtick.server.snooze.SnoozeOptions;
import io.tabtick.server.snooze.SnoozeScheduler;
import io.tabtick.server.snooze.WakeOptions;
import io.tabtick.server.snooze.WindowSnoozeService;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thin HTTP adapter over the engine services.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map engine exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST   /collections/capture
 *   - POST   /collections/{id}/restore
 *   - POST   /collections/{id}/unbind
 *   - GET    /windows/{windowId}/collection
 *   - GET    /windows/{windowId}/suggested-name
 *   - POST   /windows/{windowId}/snooze
 *   - POST   /bindings/rebuild
 *   - GET    /snoozed
 *   - POST   /snoozed
 *   - POST   /snoozed/wake
 *   - PUT    /snoozed/{id}
 *   - DELETE /snoozed/{id}
 *   - POST   /window-snoozes/{snoozeId}/restore
 *   - GET    /admin/health
 *
 * Engine calls block on the browser, so requests are moved off the IO thread.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    /** Routing-level failure with a fixed status. */
    private static final class HttpError extends RuntimeException {
        private final int status;

        HttpError(int status, String message) {
            super(message);
            this.status = status;
        }
    }

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final SnapshotBuilder snapshots;
    private final RestorationEngine restorer;
    private final BindingCache bindings;
    private final SnoozeScheduler snoozer;
    private final WindowSnoozeService windowSnoozer;

    public WebServer(
            int port,
            SnapshotBuilder snapshots,
            RestorationEngine restorer,
            BindingCache bindings,
            SnoozeScheduler snoozer,
            WindowSnoozeService windowSnoozer
    ) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.restorer = Objects.requireNonNull(restorer, "restorer");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.snoozer = Objects.requireNonNull(snoozer, "snoozer");
        this.windowSnoozer = Objects.requireNonNull(windowSnoozer, "windowSnoozer");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::handle)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- request handling ----------

    private void handle(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::handle);
            return;
        }

        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        long start = System.nanoTime();
        int status = 200;
        long engineMs = -1L;
        Throwable error = null;
        try {
            byte[] body = readBody(exchange);
            long eStart = System.nanoTime();
            Object result = dispatch(method, segments(path), body);
            engineMs = (System.nanoTime() - eStart) / 1_000_000L;
            send(exchange, status, result);
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            send(exchange, status, Map.of("error", messageFor(e, status)));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, status, totalMs, engineMs, error);
        }
    }

    private Object dispatch(String method, List<String> seg, byte[] body) throws IOException {
        String root = seg.isEmpty() ? "" : seg.get(0);
        switch (root) {
            case "admin" -> {
                if (seg.size() == 2 && "health".equals(seg.get(1))) {
                    expect(method, "GET");
                    return Map.of("status", "ok");
                }
            }
            case "collections" -> {
                if (seg.size() == 2 && "capture".equals(seg.get(1))) {
                    expect(method, "POST");
                    return snapshots.capture(required(body, CaptureRequest.class));
                }
                if (seg.size() == 3 && "restore".equals(seg.get(2))) {
                    expect(method, "POST");
                    RestoreOptions opts = body.length == 0 ? RestoreOptions.defaults() : parse(body, RestoreOptions.class);
                    return restorer.restore(seg.get(1), opts);
                }
                if (seg.size() == 3 && "unbind".equals(seg.get(2))) {
                    expect(method, "POST");
                    return bindings.unbind(seg.get(1));
                }
            }
            case "windows" -> {
                if (seg.size() == 3) {
                    int windowId = windowId(seg.get(1));
                    switch (seg.get(2)) {
                        case "collection" -> {
                            expect(method, "GET");
                            return bindings.getForWindow(windowId)
                                    .orElseThrow(() -> new NotFoundException("No collection bound to window " + windowId));
                        }
                        case "suggested-name" -> {
                            expect(method, "GET");
                            return Map.of("name", snapshots.suggestName(windowId));
                        }
                        case "snooze" -> {
                            expect(method, "POST");
                            SnoozeWindowRequest req = required(body, SnoozeWindowRequest.class);
                            var opts = new SnoozeOptions(RestorationMode.fromWire(req.restorationMode), req.reason, null, null);
                            return windowSnoozer.snoozeWindow(windowId, Duration.ofMillis(req.durationMillis), opts);
                        }
                        default -> {
                            // fall through to 404
                        }
                    }
                }
            }
            case "bindings" -> {
                if (seg.size() == 2 && "rebuild".equals(seg.get(1))) {
                    expect(method, "POST");
                    return bindings.rebuild();
                }
            }
            case "snoozed" -> {
                if (seg.size() == 1) {
                    if ("GET".equals(method)) {
                        return Map.of("items", snoozer.list());
                    }
                    expect(method, "POST");
                    SnoozeTabsRequest req = required(body, SnoozeTabsRequest.class);
                    var opts = new SnoozeOptions(RestorationMode.fromWire(req.restorationMode), req.reason, null, null);
                    return Map.of("items", snoozer.snoozeTabs(req.tabIds, req.wakeAt, opts));
                }
                if (seg.size() == 2 && "wake".equals(seg.get(1))) {
                    expect(method, "POST");
                    WakeRequest req = required(body, WakeRequest.class);
                    return Map.of("tabIds", snoozer.wakeTabs(req.ids, new WakeOptions(req.makeActive, req.targetWindowId)));
                }
                if (seg.size() == 2) {
                    String id = seg.get(1);
                    if ("DELETE".equals(method)) {
                        return Map.of("deleted", snoozer.delete(id));
                    }
                    expect(method, "PUT");
                    return snoozer.reschedule(id, required(body, RescheduleRequest.class).wakeAt);
                }
            }
            case "window-snoozes" -> {
                if (seg.size() == 3 && "restore".equals(seg.get(2))) {
                    expect(method, "POST");
                    return windowSnoozer.restoreWindow(seg.get(1));
                }
            }
            default -> {
                // fall through to 404
            }
        }
        throw new HttpError(404, "not found");
    }

    // ---------- helpers ----------

    private static List<String> segments(String path) {
        List<String> out = new ArrayList<>();
        for (String s : path.split("/")) {
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return out;
    }

    private static void expect(String method, String allowed) {
        if (!allowed.equals(method)) {
            throw new HttpError(405, "method not allowed");
        }
    }

    private static int windowId(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException("windowId must be an integer: " + raw);
        }
    }

    private static byte[] readBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] data = exchange.getInputStream().readAllBytes();
        if (data.length > MAX_BODY_BYTES) {
            throw new HttpError(413, "request body too large");
        }
        return data;
    }

    private <T> T required(byte[] body, Class<T> type) throws IOException {
        if (body.length == 0) {
            throw new ValidationException("request body is required");
        }
        return parse(body, type);
    }

    private <T> T parse(byte[] body, Class<T> type) throws IOException {
        T value = json.readValue(body, type);
        if (value == null) {
            throw new ValidationException("request body is required");
        }
        return value;
    }

    private static int statusFor(Throwable e) {
        if (e instanceof HttpError he) {
            return he.status;
        }
        TabTickException engine = engineCause(e);
        if (engine instanceof NotFoundException) {
            return 404;
        }
        if (engine instanceof ValidationException) {
            return 400;
        }
        if (engine instanceof EmptyCaptureException || engine instanceof EmptyRestoreException) {
            return 422;
        }
        if (engine instanceof BrowserApiException) {
            return 502;
        }
        if (e instanceof JsonProcessingException || e instanceof IllegalArgumentException) {
            return 400;
        }
        return 500;
    }

    private static String messageFor(Throwable e, int status) {
        TabTickException engine = engineCause(e);
        if (engine != null) {
            return engine.getMessage();
        }
        if (e instanceof JsonProcessingException) {
            return "invalid JSON";
        }
        if (status == 500) {
            return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
        }
        return e.getMessage();
    }

    /** Engine exceptions can arrive wrapped, e.g. thrown from a Jackson creator. */
    private static TabTickException engineCause(Throwable e) {
        for (Throwable cur = e; cur != null; cur = cur.getCause()) {
            if (cur instanceof TabTickException tte) {
                return tte;
            }
            if (cur.getCause() == cur) {
                break;
            }
        }
        return null;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
