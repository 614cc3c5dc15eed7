package io.cachetx.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cachetx.core.KeyValueStore;
import io.cachetx.server.dto.CacheRequest;
import io.cachetx.server.dto.CacheResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Thin HTTP adapter that exposes a {@link KeyValueStore} as a remote cache.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /cache/{op}     op is one of {@link CacheOp}; body is a {@link CacheRequest}
 *   - GET  /admin/health   Basic health check
 *
 * Status codes: 200 for every answered operation (including ok=false),
 * 400 for malformed input, 404 for unknown paths/operations, 405 for a
 * wrong method, 413 for bodies over 10 MiB and 500 for store failures.
 */
public final class CacheServer {
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final String CACHE_PREFIX = "/cache/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final CacheService service;

    public CacheServer(int port, KeyValueStore store) {
        this(port, new CacheService(store));
    }

    public CacheServer(int port, CacheService service) {
        this.service = service;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if (path.startsWith(CACHE_PREFIX)) {
                        Optional<CacheOp> op = CacheOp.fromPath(path.substring(CACHE_PREFIX.length()));
                        if (op.isEmpty()) {
                            send(exchange, 404, Map.of("error", "unknown operation"));
                            RequestLogger.logRequest(method, path, 404, 0, -1, null);
                        } else if (!"POST".equals(method)) {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            RequestLogger.logRequest(method, path, 405, 0, -1, null);
                        } else {
                            handleOperation(exchange, op.get());
                        }
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, -1, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** POST /cache/{op} */
    private void handleOperation(HttpServerExchange ex, CacheOp op) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long storeMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = data.length == 0 ? new CacheRequest() : json.readValue(data, CacheRequest.class);
                            long sStart = System.nanoTime();
                            CacheResponse resp = service.execute(op, req);
                            storeMs = (System.nanoTime() - sStart) / 1_000_000L;
                            status = 200;
                            send(exchange, status, resp);
                        }
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(),
                                "message", String.valueOf(e.getMessage())));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("POST", path, exchange.getStatusCode(), totalMs, storeMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
