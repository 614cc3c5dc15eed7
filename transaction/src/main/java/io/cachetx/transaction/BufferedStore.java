package io.cachetx.transaction;

import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import io.cachetx.core.KeyValueStore;
import io.cachetx.storage.Buffer;
import io.cachetx.storage.Presence;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Read-caching front for a backend store.
 * <p>
 * Everything read or written is kept in a local {@link Buffer}, so repeated reads
 * of the same key within one unit of work hit the backend once. Writes are not
 * deferred: each one is committed to the backend before the call returns, and a
 * write whose commit fails reports failure.
 * <p>
 * CAS tokens come from the underlying transaction and are invalidated by the next
 * write, like any committed transaction's tokens.
 */
public class BufferedStore implements KeyValueStore {

    private final Buffer local;
    private final Transaction transaction;

    public BufferedStore(KeyValueStore cache) {
        this.local = new Buffer();
        this.transaction = new Transaction(local, cache);
    }

    @Override
    public CachedValue get(String key) {
        CachedValue value = transaction.get(key);
        if (value != null) {
            remember(key, value);
        }
        return value;
    }

    @Override
    public Map<String, CachedValue> getMulti(Collection<String> keys) {
        Map<String, CachedValue> values = transaction.getMulti(keys);
        values.forEach(this::remember);
        return values;
    }

    @Override
    public boolean set(String key, byte[] value, long expire) {
        return committed(transaction.set(key, value, expire));
    }

    @Override
    public Map<String, Boolean> setMulti(Map<String, byte[]> items, long expire) {
        return committed(transaction.setMulti(items, expire));
    }

    @Override
    public boolean delete(String key) {
        return committed(transaction.delete(key));
    }

    @Override
    public Map<String, Boolean> deleteMulti(Collection<String> keys) {
        return committed(transaction.deleteMulti(keys));
    }

    @Override
    public boolean add(String key, byte[] value, long expire) {
        return committed(transaction.add(key, value, expire));
    }

    @Override
    public boolean replace(String key, byte[] value, long expire) {
        return committed(transaction.replace(key, value, expire));
    }

    @Override
    public boolean cas(CasToken token, String key, byte[] value, long expire) {
        return committed(transaction.cas(token, key, value, expire));
    }

    @Override
    public OptionalLong increment(String key, long offset, long initial, long expire) {
        return committed(transaction.increment(key, offset, initial, expire));
    }

    @Override
    public OptionalLong decrement(String key, long offset, long initial, long expire) {
        return committed(transaction.decrement(key, offset, initial, expire));
    }

    @Override
    public boolean touch(String key, long expire) {
        return committed(transaction.touch(key, expire));
    }

    @Override
    public boolean flush() {
        return committed(transaction.flush());
    }

    // ------------ helpers ------------

    /**
     * Keep a value fetched from the backend so the next read is served locally.
     * The buffer is written directly: a read is not something to replay.
     */
    private void remember(String key, CachedValue value) {
        if (local.presence(key) == Presence.UNKNOWN) {
            local.set(key, value.value(), 0);
        }
    }

    private boolean committed(boolean localResult) {
        return transaction.commit() && localResult;
    }

    private OptionalLong committed(OptionalLong localResult) {
        return transaction.commit() ? localResult : OptionalLong.empty();
    }

    private Map<String, Boolean> committed(Map<String, Boolean> localResults) {
        if (transaction.commit()) {
            return localResults;
        }
        Map<String, Boolean> failed = new LinkedHashMap<>();
        localResults.keySet().forEach(key -> failed.put(key, false));
        return failed;
    }
}
