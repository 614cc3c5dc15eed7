package io.cachetx.server;

import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import io.cachetx.core.KeyValueStore;
import io.cachetx.server.dto.CacheRequest;
import io.cachetx.server.dto.CacheResponse;
import io.cachetx.server.dto.ValueDto;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Application service behind POST /cache/{op}.
 *
 * Responsibilities:
 *  - Validate that the request carries the fields the operation needs.
 *  - Encode/decode Base64 payloads expected by the API.
 *  - Translate results of the {@link KeyValueStore} into response DTOs.
 *
 * Malformed input raises {@link IllegalArgumentException}; the HTTP layer maps it to 400.
 * "Not found" and failed preconditions are ordinary responses with ok=false.
 */
public class CacheService {

    private final KeyValueStore store;

    public CacheService(KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public CacheResponse execute(CacheOp op, CacheRequest req) {
        Objects.requireNonNull(op, "op");
        if (req == null) {
            req = new CacheRequest();
        }
        return switch (op) {
            case GET -> get(requireKey(req));
            case GET_MULTI -> getMulti(requireKeys(req));
            case SET -> CacheResponse.of(store.set(requireKey(req), requireValue(req), req.expire));
            case SET_MULTI -> setMulti(req);
            case DELETE -> CacheResponse.of(store.delete(requireKey(req)));
            case DELETE_MULTI -> results(store.deleteMulti(requireKeys(req)));
            case ADD -> CacheResponse.of(store.add(requireKey(req), requireValue(req), req.expire));
            case REPLACE -> CacheResponse.of(store.replace(requireKey(req), requireValue(req), req.expire));
            case CAS -> CacheResponse.of(store.cas(requireToken(req), requireKey(req), requireValue(req), req.expire));
            case INCREMENT -> number(store.increment(requireKey(req), offset(req), initial(req), req.expire));
            case DECREMENT -> number(store.decrement(requireKey(req), offset(req), initial(req), req.expire));
            case TOUCH -> CacheResponse.of(store.touch(requireKey(req), req.expire));
            case FLUSH -> CacheResponse.of(store.flush());
        };
    }

    private CacheResponse get(String key) {
        CachedValue v = store.get(key);
        if (v == null) {
            return CacheResponse.of(false);
        }
        var r = CacheResponse.of(true);
        r.valueBase64 = encode(v.value());
        r.token = v.token().id();
        return r;
    }

    private CacheResponse getMulti(List<String> keys) {
        Map<String, ValueDto> values = new LinkedHashMap<>();
        store.getMulti(keys).forEach((k, v) -> values.put(k, new ValueDto(encode(v.value()), v.token().id())));
        var r = CacheResponse.of(true);
        r.values = values;
        return r;
    }

    private CacheResponse setMulti(CacheRequest req) {
        if (req.items == null) {
            throw new IllegalArgumentException("items must be provided");
        }
        Map<String, byte[]> items = new LinkedHashMap<>();
        for (var e : req.items.entrySet()) {
            items.put(checkKey(e.getKey()), decode(e.getValue()));
        }
        return results(store.setMulti(items, req.expire));
    }

    private static CacheResponse results(Map<String, Boolean> results) {
        var r = CacheResponse.of(true);
        r.results = new LinkedHashMap<>(results);
        return r;
    }

    private static CacheResponse number(OptionalLong n) {
        var r = CacheResponse.of(n.isPresent());
        if (n.isPresent()) {
            r.number = n.getAsLong();
        }
        return r;
    }

    // ---------- validation ----------

    private static String requireKey(CacheRequest req) {
        return checkKey(req.key);
    }

    private static String checkKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        return key;
    }

    private static List<String> requireKeys(CacheRequest req) {
        if (req.keys == null) {
            throw new IllegalArgumentException("keys must be provided");
        }
        req.keys.forEach(CacheService::checkKey);
        return req.keys;
    }

    private static byte[] requireValue(CacheRequest req) {
        return decode(req.valueBase64);
    }

    private static CasToken requireToken(CacheRequest req) {
        if (req.token == null || req.token.isBlank()) {
            throw new IllegalArgumentException("token must be provided");
        }
        return CasToken.of(req.token);
    }

    private static long offset(CacheRequest req) {
        return req.offset == null ? 1L : req.offset;
    }

    private static long initial(CacheRequest req) {
        return req.initial == null ? 0L : req.initial;
    }

    static byte[] decode(String base64) {
        if (base64 == null) {
            throw new IllegalArgumentException("valueBase64 must be provided");
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("valueBase64 is not valid Base64", e);
        }
    }

    static String encode(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
