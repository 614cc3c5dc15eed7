package io.cachetx.transaction;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One write recorded by a {@link Transaction}, to be replayed against the backend
 * on commit.
 * <p>
 * Fields:
 *  - kind:      which backend operation to issue.
 *  - keys:      every key the replay writes to; these are invalidated on rollback.
 *  - value:     payload for single-key writes (SET, ADD, REPLACE, CAS).
 *  - items:     payload for SET_MULTI.
 *  - expire:    expiration argument passed through unchanged.
 *  - offset, initial: counter arguments for INCREMENT / DECREMENT.
 *  - snapshot:  for CAS, the value the transaction originally read.
 * <p>
 * Instances are immutable; byte arrays are copied on the way in and out.
 */
public final class DeferredAction {
    private final DeferredKind kind;
    private final List<String> keys;
    private final byte[] value;
    private final Map<String, byte[]> items;
    private final long expire;
    private final long offset;
    private final long initial;
    private final ValueSnapshot snapshot;

    private DeferredAction(DeferredKind kind,
                           List<String> keys,
                           byte[] value,
                           Map<String, byte[]> items,
                           long expire,
                           long offset,
                           long initial,
                           ValueSnapshot snapshot) {
        this.kind = kind;
        this.keys = keys;
        this.value = value;
        this.items = items;
        this.expire = expire;
        this.offset = offset;
        this.initial = initial;
        this.snapshot = snapshot;
    }

    // ------------ factories ------------

    public static DeferredAction set(String key, byte[] value, long expire) {
        return write(DeferredKind.SET, key, value, expire);
    }

    public static DeferredAction add(String key, byte[] value, long expire) {
        return write(DeferredKind.ADD, key, value, expire);
    }

    public static DeferredAction replace(String key, byte[] value, long expire) {
        return write(DeferredKind.REPLACE, key, value, expire);
    }

    public static DeferredAction setMulti(Map<String, byte[]> items, long expire) {
        Map<String, byte[]> copy = new LinkedHashMap<>();
        items.forEach((k, v) -> copy.put(k, Arrays.copyOf(v, v.length)));
        return new DeferredAction(DeferredKind.SET_MULTI, List.copyOf(copy.keySet()), null,
                Collections.unmodifiableMap(copy), expire, 0, 0, null);
    }

    public static DeferredAction delete(String key) {
        return new DeferredAction(DeferredKind.DELETE, List.of(key), null, null, 0, 0, 0, null);
    }

    public static DeferredAction deleteMulti(Collection<String> keys) {
        return new DeferredAction(DeferredKind.DELETE_MULTI, List.copyOf(keys), null, null, 0, 0, 0, null);
    }

    public static DeferredAction cas(ValueSnapshot original, String key, byte[] value, long expire) {
        Objects.requireNonNull(original, "original");
        return new DeferredAction(DeferredKind.CAS, List.of(key), Arrays.copyOf(value, value.length), null,
                expire, 0, 0, original);
    }

    public static DeferredAction increment(String key, long offset, long initial, long expire) {
        return new DeferredAction(DeferredKind.INCREMENT, List.of(key), null, null, expire, offset, initial, null);
    }

    public static DeferredAction decrement(String key, long offset, long initial, long expire) {
        return new DeferredAction(DeferredKind.DECREMENT, List.of(key), null, null, expire, offset, initial, null);
    }

    public static DeferredAction touch(String key, long expire) {
        return new DeferredAction(DeferredKind.TOUCH, List.of(key), null, null, expire, 0, 0, null);
    }

    /** Flush writes to every key, but there is nothing worth invalidating afterwards. */
    public static DeferredAction flush() {
        return new DeferredAction(DeferredKind.FLUSH, List.of(), null, null, 0, 0, 0, null);
    }

    private static DeferredAction write(DeferredKind kind, String key, byte[] value, long expire) {
        return new DeferredAction(kind, List.of(key), Arrays.copyOf(value, value.length), null, expire, 0, 0, null);
    }

    // ------------ accessors ------------

    public DeferredKind kind() { return kind; }

    public List<String> keys() { return keys; }

    /**
     * The single key of a one-key action.
     */
    public String key() {
        if (keys.size() != 1) {
            throw new IllegalStateException(kind + " does not target exactly one key");
        }
        return keys.get(0);
    }

    public byte[] value() { return value == null ? null : Arrays.copyOf(value, value.length); }

    public Map<String, byte[]> items() {
        if (items == null) {
            return Map.of();
        }
        Map<String, byte[]> copy = new LinkedHashMap<>();
        items.forEach((k, v) -> copy.put(k, Arrays.copyOf(v, v.length)));
        return copy;
    }

    public long expire() { return expire; }

    public long offset() { return offset; }

    public long initial() { return initial; }

    public ValueSnapshot snapshot() { return snapshot; }

    @Override
    public String toString() {
        return kind + keys.toString();
    }
}
