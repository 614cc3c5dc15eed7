package io.cachetx.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log method, path, status and latency of each request.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param storeMillis latency of the store call, or -1 if it was not reached
     * @param error       exception behind a 4xx/5xx answer, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long storeMillis,
            Throwable error
    ) {
        String msg = String.format(
                "%s %s -> %d in %dms%s",
                method,
                path,
                status,
                totalMillis,
                storeMillis >= 0 ? " (store " + storeMillis + "ms)" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
