package io.cachetx.transaction;

import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import io.cachetx.core.KeyValueStore;
import io.cachetx.storage.MemoryStore;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Backend double: a MemoryStore that counts calls per operation and can be told
 * to fail writes to given keys, or to throw.
 */
final class RecordingStore implements KeyValueStore {

    final MemoryStore inner = new MemoryStore();

    private final Map<String, Integer> calls = new HashMap<>();
    private final Set<String> failingKeys = new HashSet<>();
    final List<List<String>> getMultiCalls = new ArrayList<>();
    final List<List<String>> deleteMultiCalls = new ArrayList<>();

    private RuntimeException writeFailure;
    private RuntimeException deleteMultiFailure;

    // ------------ test controls ------------

    void failWritesTo(String key) {
        failingKeys.add(key);
    }

    void throwOnWrites(RuntimeException e) {
        writeFailure = e;
    }

    void throwOnDeleteMulti(RuntimeException e) {
        deleteMultiFailure = e;
    }

    int calls(String op) {
        return calls.getOrDefault(op, 0);
    }

    int totalCalls() {
        return calls.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Seed a value without counting it as a call. */
    void seed(String key, String value) {
        inner.set(key, value.getBytes(StandardCharsets.UTF_8), 0);
    }

    /** Current value as a string, or null; not counted. */
    String peek(String key) {
        CachedValue v = inner.get(key);
        return v == null ? null : v.asString();
    }

    // ------------ KeyValueStore ------------

    @Override
    public CachedValue get(String key) {
        record("get");
        return inner.get(key);
    }

    @Override
    public Map<String, CachedValue> getMulti(Collection<String> keys) {
        record("getMulti");
        getMultiCalls.add(List.copyOf(keys));
        return inner.getMulti(keys);
    }

    @Override
    public boolean set(String key, byte[] value, long expire) {
        record("set");
        return writable(key) && inner.set(key, value, expire);
    }

    @Override
    public Map<String, Boolean> setMulti(Map<String, byte[]> items, long expire) {
        record("setMulti");
        maybeThrow();
        Map<String, Boolean> results = new LinkedHashMap<>();
        items.forEach((key, value) -> results.put(key,
                !failingKeys.contains(key) && inner.set(key, value, expire)));
        return results;
    }

    @Override
    public boolean delete(String key) {
        record("delete");
        return inner.delete(key);
    }

    @Override
    public Map<String, Boolean> deleteMulti(Collection<String> keys) {
        record("deleteMulti");
        deleteMultiCalls.add(List.copyOf(keys));
        if (deleteMultiFailure != null) {
            throw deleteMultiFailure;
        }
        return inner.deleteMulti(keys);
    }

    @Override
    public boolean add(String key, byte[] value, long expire) {
        record("add");
        return writable(key) && inner.add(key, value, expire);
    }

    @Override
    public boolean replace(String key, byte[] value, long expire) {
        record("replace");
        return writable(key) && inner.replace(key, value, expire);
    }

    @Override
    public boolean cas(CasToken token, String key, byte[] value, long expire) {
        record("cas");
        return writable(key) && inner.cas(token, key, value, expire);
    }

    @Override
    public OptionalLong increment(String key, long offset, long initial, long expire) {
        record("increment");
        return writable(key) ? inner.increment(key, offset, initial, expire) : OptionalLong.empty();
    }

    @Override
    public OptionalLong decrement(String key, long offset, long initial, long expire) {
        record("decrement");
        return writable(key) ? inner.decrement(key, offset, initial, expire) : OptionalLong.empty();
    }

    @Override
    public boolean touch(String key, long expire) {
        record("touch");
        return writable(key) && inner.touch(key, expire);
    }

    @Override
    public boolean flush() {
        record("flush");
        maybeThrow();
        return inner.flush();
    }

    private void record(String op) {
        calls.merge(op, 1, Integer::sum);
    }

    private boolean writable(String key) {
        maybeThrow();
        return !failingKeys.contains(key);
    }

    private void maybeThrow() {
        if (writeFailure != null) {
            throw writeFailure;
        }
    }
}
