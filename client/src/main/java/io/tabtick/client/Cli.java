package io.tabtick.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * Simple CLI for a running TabTick server.
 *
 * Usage:
 *   tabtick-cli [--base-url http://host:port] capture <windowId> <name>
 *   tabtick-cli [--base-url http://host:port] restore <collectionId> [<windowId>]
 *   tabtick-cli [--base-url http://host:port] snooze-window <windowId> <minutes>
 *   tabtick-cli [--base-url http://host:port] restore-window <snoozeId>
 *   tabtick-cli [--base-url http://host:port] snoozed
 *   tabtick-cli [--base-url http://host:port] wake <snoozedId>...
 *   tabtick-cli [--base-url http://host:port] delete <snoozedId>
 *
 * Responses are printed as the server's JSON.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    /** One HTTP call derived from the command line. Body is null for GET/DELETE. */
    record Call(String method, String path, String body) {}

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            new Cli(parsed.getKey()).execute(plan(rest));
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /** Translate a command and its arguments into an HTTP call. */
    static Call plan(String[] rest) {
        String cmd = rest[0];
        return switch (cmd) {
            case "capture" -> {
                requireArgs(rest, 3, "capture requires <windowId> <name>");
                yield new Call("POST", "/collections/capture",
                        "{\"windowId\":" + number(rest[1]) + ",\"metadata\":{\"name\":" + quote(rest[2]) + "}}");
            }
            case "restore" -> {
                if (rest.length != 2 && rest.length != 3) {
                    throw new CliException("restore requires <collectionId> [<windowId>]");
                }
                String body = rest.length == 2
                        ? "{\"createNewWindow\":true}"
                        : "{\"createNewWindow\":false,\"windowId\":" + number(rest[2]) + "}";
                yield new Call("POST", "/collections/" + rest[1] + "/restore", body);
            }
            case "snooze-window" -> {
                requireArgs(rest, 3, "snooze-window requires <windowId> <minutes>");
                long millis = number(rest[2]) * 60_000L;
                yield new Call("POST", "/windows/" + number(rest[1]) + "/snooze",
                        "{\"durationMillis\":" + millis + "}");
            }
            case "restore-window" -> {
                requireArgs(rest, 2, "restore-window requires <snoozeId>");
                yield new Call("POST", "/window-snoozes/" + rest[1] + "/restore", "");
            }
            case "snoozed" -> {
                requireArgs(rest, 1, "snoozed takes no arguments");
                yield new Call("GET", "/snoozed", null);
            }
            case "wake" -> {
                if (rest.length < 2) {
                    throw new CliException("wake requires at least one <snoozedId>");
                }
                StringBuilder ids = new StringBuilder();
                for (int i = 1; i < rest.length; i++) {
                    if (i > 1) {
                        ids.append(',');
                    }
                    ids.append(quote(rest[i]));
                }
                yield new Call("POST", "/snoozed/wake", "{\"ids\":[" + ids + "]}");
            }
            case "delete" -> {
                requireArgs(rest, 2, "delete requires <snoozedId>");
                yield new Call("DELETE", "/snoozed/" + rest[1], null);
            }
            default -> throw new CliException("unknown command: " + cmd);
        };
    }

    private void execute(Call call) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(baseUrl + call.path()));
        if (call.body() == null) {
            b.method(call.method(), HttpRequest.BodyPublishers.noBody());
        } else {
            b.header("Content-Type", "application/json")
                    .method(call.method(), HttpRequest.BodyPublishers.ofString(call.body()));
        }

        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException(call.method() + " " + call.path() + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value and a command");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void requireArgs(String[] rest, int count, String message) {
        if (rest.length != count) {
            throw new CliException(message);
        }
    }

    private static long number(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CliException("not a number: " + raw);
        }
    }

    /** Minimal JSON string literal; the client stays dependency-free. */
    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  tabtick-cli [--base-url http://host:port] capture <windowId> <name>
                  tabtick-cli [--base-url http://host:port] restore <collectionId> [<windowId>]
                  tabtick-cli [--base-url http://host:port] snooze-window <windowId> <minutes>
                  tabtick-cli [--base-url http://host:port] restore-window <snoozeId>
                  tabtick-cli [--base-url http://host:port] snoozed
                  tabtick-cli [--base-url http://host:port] wake <snoozedId>...
                  tabtick-cli [--base-url http://host:port] delete <snoozedId>
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
