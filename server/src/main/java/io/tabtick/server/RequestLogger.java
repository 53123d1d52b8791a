package io.tabtick.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the HTTP API.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - 5xx responses go out at WARNING with the failure attached.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method       HTTP method (GET, POST, PUT, DELETE)
     * @param path         request path
     * @param status       HTTP status code
     * @param totalMillis  wall-clock latency for the whole request
     * @param engineMillis time spent inside the engine call, or -1 if not reached
     * @param error        optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long engineMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                engineMillis >= 0 ? ", engine=" + engineMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
