package io.cachetx.client;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cachetx.core.CacheAccessException;
import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import io.cachetx.core.KeyValueStore;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * {@link KeyValueStore} backed by a remote cache server.
 *
 * Talks to the server's operation endpoint:
 *
 *   POST /cache/{op}
 *
 * Request JSON carries key/keys, Base64 values, expire, token, offset and initial
 * as the operation needs; the response carries ok plus valueBase64/token,
 * values, results or number.
 *
 * "Not found" and failed preconditions come back as null/false/empty like any
 * other store. Anything else (unreachable server, non-200 status, unreadable
 * body) is raised as {@link CacheAccessException}.
 */
public final class HttpStore implements KeyValueStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI baseUri;
    private final HttpClient client;

    /**
     * @param baseUri server root; may carry a path prefix, e.g. http://host/cache-proxy
     */
    public HttpStore(URI baseUri) {
        this.baseUri = withTrailingSlash(Objects.requireNonNull(baseUri, "baseUri"));
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @Override
    public CachedValue get(String key) {
        ResponseDto r = call("get", body(key));
        if (!r.ok() || r.valueBase64() == null) {
            return null;
        }
        return new CachedValue(decode(r.valueBase64()), CasToken.of(r.token()));
    }

    @Override
    public Map<String, CachedValue> getMulti(Collection<String> keys) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("keys", List.copyOf(keys));
        ResponseDto r = call("getMulti", body);

        Map<String, CachedValue> out = new LinkedHashMap<>();
        r.values().forEach((k, v) -> out.put(k, new CachedValue(decode(v.valueBase64()), CasToken.of(v.token()))));
        return out;
    }

    @Override
    public boolean set(String key, byte[] value, long expire) {
        return call("set", body(key, value, expire)).ok();
    }

    @Override
    public Map<String, Boolean> setMulti(Map<String, byte[]> items, long expire) {
        Map<String, String> encoded = new LinkedHashMap<>();
        items.forEach((k, v) -> encoded.put(k, encode(v)));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("items", encoded);
        body.put("expire", expire);
        return call("setMulti", body).results();
    }

    @Override
    public boolean delete(String key) {
        return call("delete", body(key)).ok();
    }

    @Override
    public Map<String, Boolean> deleteMulti(Collection<String> keys) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("keys", List.copyOf(keys));
        return call("deleteMulti", body).results();
    }

    @Override
    public boolean add(String key, byte[] value, long expire) {
        return call("add", body(key, value, expire)).ok();
    }

    @Override
    public boolean replace(String key, byte[] value, long expire) {
        return call("replace", body(key, value, expire)).ok();
    }

    @Override
    public boolean cas(CasToken token, String key, byte[] value, long expire) {
        Map<String, Object> body = body(key, value, expire);
        body.put("token", token.id());
        return call("cas", body).ok();
    }

    @Override
    public OptionalLong increment(String key, long offset, long initial, long expire) {
        return number(call("increment", counterBody(key, offset, initial, expire)));
    }

    @Override
    public OptionalLong decrement(String key, long offset, long initial, long expire) {
        return number(call("decrement", counterBody(key, offset, initial, expire)));
    }

    @Override
    public boolean touch(String key, long expire) {
        Map<String, Object> body = body(key);
        body.put("expire", expire);
        return call("touch", body).ok();
    }

    @Override
    public boolean flush() {
        return call("flush", Map.of()).ok();
    }

    // ---------- transport ----------

    private ResponseDto call(String op, Map<String, Object> body) {
        URI uri = endpoint(baseUri, op);
        try {
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(MAPPER.writeValueAsBytes(body)))
                    .build();

            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new CacheAccessException(
                        "Cache server " + baseUri + " returned HTTP " + resp.statusCode() + " for " + op + ": " + resp.body());
            }
            return MAPPER.readValue(resp.body(), ResponseDto.class);
        } catch (IOException e) {
            throw new CacheAccessException("Failed to call " + op + " on cache server " + baseUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheAccessException("Interrupted while calling " + op + " on cache server " + baseUri, e);
        }
    }

    /** Resolve the operation endpoint below {@code base}, keeping any path prefix. */
    static URI endpoint(URI base, String op) {
        return withTrailingSlash(base).resolve("cache/" + op);
    }

    private static URI withTrailingSlash(URI uri) {
        String s = uri.toString();
        return s.endsWith("/") ? uri : URI.create(s + "/");
    }

    private static Map<String, Object> body(String key) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("key", key);
        return body;
    }

    private static Map<String, Object> body(String key, byte[] value, long expire) {
        Map<String, Object> body = body(key);
        body.put("valueBase64", encode(value));
        body.put("expire", expire);
        return body;
    }

    private static Map<String, Object> counterBody(String key, long offset, long initial, long expire) {
        Map<String, Object> body = body(key);
        body.put("offset", offset);
        body.put("initial", initial);
        body.put("expire", expire);
        return body;
    }

    private static OptionalLong number(ResponseDto r) {
        return r.ok() && r.number() != null ? OptionalLong.of(r.number()) : OptionalLong.empty();
    }

    private static String encode(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    private static byte[] decode(String base64) {
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new CacheAccessException("Cache server sent an invalid Base64 value", e);
        }
    }

    // ---------- JSON DTOs ----------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ResponseDto {
        private final boolean ok;
        private final String valueBase64;
        private final String token;
        private final Map<String, ValueDto> values;
        private final Map<String, Boolean> results;
        private final Long number;

        @JsonCreator
        public ResponseDto(
                @JsonProperty("ok") boolean ok,
                @JsonProperty("valueBase64") String valueBase64,
                @JsonProperty("token") String token,
                @JsonProperty("values") Map<String, ValueDto> values,
                @JsonProperty("results") Map<String, Boolean> results,
                @JsonProperty("number") Long number
        ) {
            this.ok = ok;
            this.valueBase64 = valueBase64;
            this.token = token;
            this.values = values != null ? values : Map.of();
            this.results = results != null ? results : Map.of();
            this.number = number;
        }

        public boolean ok() {
            return ok;
        }

        public String valueBase64() {
            return valueBase64;
        }

        public String token() {
            return token;
        }

        public Map<String, ValueDto> values() {
            return values;
        }

        public Map<String, Boolean> results() {
            return results;
        }

        public Long number() {
            return number;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ValueDto {
        private final String valueBase64;
        private final String token;

        @JsonCreator
        public ValueDto(
                @JsonProperty("valueBase64") String valueBase64,
                @JsonProperty("token") String token
        ) {
            this.valueBase64 = valueBase64;
            this.token = token;
        }

        public String valueBase64() {
            return valueBase64;
        }

        public String token() {
            return token;
        }
    }
}
