package io.cachetx.storage;

import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import io.cachetx.core.Expiry;
import io.cachetx.core.KeyValueStore;
import io.cachetx.core.NumericValues;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory key-value store.
 * <p>
 * Responsibilities:
 *  - Keep key -> Entry(value, deadline, token) in an access-ordered map.
 *  - Mint a fresh CasToken on every write; cas() succeeds only when the caller
 *    presents the token of the current version (optimistic concurrency).
 *  - Drop expired entries lazily, when they are next looked at.
 *  - Optionally bound the number of entries, evicting the least recently used.
 * <p>
 * All public operations are synchronized on the store, so one instance can back
 * many concurrent callers (e.g. the HTTP server).
 * <p>
 * Subclasses observe state changes through the protected on* hooks, which are
 * always invoked while holding the store's monitor.
 */
public class MemoryStore implements KeyValueStore {

    private static final AtomicLong TOKEN_SEQ = new AtomicLong();

    private final int maxEntries;
    private final LinkedHashMap<String, Entry> items;
    protected final Clock clock;

    public MemoryStore() {
        this(0, Clock.systemUTC());
    }

    public MemoryStore(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    /**
     * @param maxEntries upper bound on stored keys, 0 for unbounded
     * @param clock      time source for expirations
     */
    public MemoryStore(int maxEntries, Clock clock) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.items = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return MemoryStore.this.maxEntries > 0 && size() > MemoryStore.this.maxEntries;
            }
        };
    }

    @Override
    public synchronized CachedValue get(String key) {
        Objects.requireNonNull(key, "key");
        Entry e = live(key);
        return e == null ? null : new CachedValue(e.value, e.token);
    }

    @Override
    public synchronized Map<String, CachedValue> getMulti(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        Map<String, CachedValue> found = new LinkedHashMap<>();
        for (String key : keys) {
            CachedValue v = get(key);
            if (v != null) {
                found.put(key, v);
            }
        }
        return found;
    }

    @Override
    public synchronized boolean set(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return write(key, value, expire);
    }

    @Override
    public synchronized Map<String, Boolean> setMulti(Map<String, byte[]> items, long expire) {
        Objects.requireNonNull(items, "items");
        items.forEach((key, value) -> {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        });
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> item : items.entrySet()) {
            results.put(item.getKey(), set(item.getKey(), item.getValue(), expire));
        }
        return results;
    }

    @Override
    public synchronized boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        if (live(key) == null) {
            return false;
        }
        items.remove(key);
        onRemoved(key);
        return true;
    }

    @Override
    public synchronized Map<String, Boolean> deleteMulti(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String key : keys) {
            results.put(key, delete(key));
        }
        return results;
    }

    @Override
    public synchronized boolean add(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (live(key) != null) {
            return false;
        }
        return write(key, value, expire);
    }

    @Override
    public synchronized boolean replace(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (live(key) == null) {
            return false;
        }
        return write(key, value, expire);
    }

    @Override
    public synchronized boolean cas(CasToken token, String key, byte[] value, long expire) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Entry current = live(key);
        if (current == null || !current.token.equals(token)) {
            return false;
        }
        return write(key, value, expire);
    }

    @Override
    public synchronized OptionalLong increment(String key, long offset, long initial, long expire) {
        return adjust(key, offset, initial, expire, true);
    }

    @Override
    public synchronized OptionalLong decrement(String key, long offset, long initial, long expire) {
        return adjust(key, offset, initial, expire, false);
    }

    @Override
    public synchronized boolean touch(String key, long expire) {
        Objects.requireNonNull(key, "key");
        Entry current = live(key);
        if (current == null) {
            return false;
        }
        return write(key, current.value, expire);
    }

    @Override
    public synchronized boolean flush() {
        items.clear();
        onFlushed();
        return true;
    }

    /**
     * Replace the value of a key, keeping its expiration. A key the store does not
     * hold is stored without expiration.
     */
    public synchronized boolean overwrite(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Entry current = live(key);
        put(key, value, current == null ? Expiry.NEVER : current.deadline);
        return true;
    }

    /**
     * Number of entries currently held, including expired ones not yet collected.
     */
    public synchronized int size() {
        return items.size();
    }

    // ------------ hooks ------------

    /** A live value was written for key. */
    protected void onStored(String key) {
    }

    /** key was deleted, or written with an already-expired expiration. */
    protected void onRemoved(String key) {
    }

    /** key was found expired and dropped. */
    protected void onExpired(String key) {
    }

    /** Every key was dropped. */
    protected void onFlushed() {
    }

    /**
     * Drop key without reporting it through onRemoved.
     */
    protected synchronized void forget(String key) {
        items.remove(key);
    }

    /**
     * True if key holds a value that has not expired.
     */
    protected synchronized boolean containsLive(String key) {
        return live(key) != null;
    }

    // ------------ helpers ------------

    private Entry live(String key) {
        Entry e = items.get(key);
        if (e == null) {
            return null;
        }
        if (Expiry.isExpired(e.deadline, clock.millis())) {
            items.remove(key);
            onExpired(key);
            return null;
        }
        return e;
    }

    private boolean write(String key, byte[] value, long expire) {
        long now = clock.millis();
        long deadline = Expiry.deadline(expire, now);
        if (Expiry.isExpired(deadline, now)) {
            // Already expired: the write is equivalent to a delete.
            items.remove(key);
            onRemoved(key);
            return true;
        }
        put(key, value, deadline);
        return true;
    }

    private void put(String key, byte[] value, long deadline) {
        items.put(key, new Entry(Arrays.copyOf(value, value.length), deadline, nextToken()));
        onStored(key);
    }

    private OptionalLong adjust(String key, long offset, long initial, long expire, boolean up) {
        Objects.requireNonNull(key, "key");
        if (offset <= 0 || initial < 0) {
            return OptionalLong.empty();
        }
        Entry current = live(key);
        if (current == null) {
            write(key, NumericValues.encode(initial), expire);
            return OptionalLong.of(initial);
        }
        OptionalLong number = NumericValues.parse(current.value);
        if (number.isEmpty()) {
            return OptionalLong.empty();
        }
        long next = NumericValues.applyClamped(number.getAsLong(), up ? offset : -offset);
        // Counters keep their existing expiration, like memcached.
        put(key, NumericValues.encode(next), current.deadline);
        return OptionalLong.of(next);
    }

    private static CasToken nextToken() {
        return CasToken.of("mem-" + TOKEN_SEQ.incrementAndGet());
    }

    private static final class Entry {
        private final byte[] value;
        private final long deadline;
        private final CasToken token;

        private Entry(byte[] value, long deadline, CasToken token) {
            this.value = value;
            this.deadline = deadline;
            this.token = token;
        }
    }
}
