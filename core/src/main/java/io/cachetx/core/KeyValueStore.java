package io.cachetx.core;

import java.util.Collection;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Key/value capability set shared by backends, the local buffer and transactions.
 * <p>
 * Semantics:
 *  - Values are opaque byte arrays. Implementations copy them on the way in and out.
 *  - "Not found", "precondition not met" and "invalid argument" are ordinary results
 *    (null, false, empty), never exceptions.
 *  - expire follows {@link Expiry}: 0 = never, negative = already expired,
 *    up to 30 days = relative seconds, larger = absolute Unix timestamp.
 *  - A {@link CasToken} is only meaningful to the store that issued it.
 */
public interface KeyValueStore {

    /**
     * Read a key.
     *
     * @return the value with a CAS token, or null if the key does not exist
     */
    CachedValue get(String key);

    /**
     * Read several keys at once. The result only contains keys that exist.
     */
    Map<String, CachedValue> getMulti(Collection<String> keys);

    boolean set(String key, byte[] value, long expire);

    /**
     * Store several values with one expiration.
     *
     * @return per-key success
     */
    Map<String, Boolean> setMulti(Map<String, byte[]> items, long expire);

    /**
     * @return true if the key existed and is now gone
     */
    boolean delete(String key);

    Map<String, Boolean> deleteMulti(Collection<String> keys);

    /**
     * Store a value only if the key does not exist yet.
     */
    boolean add(String key, byte[] value, long expire);

    /**
     * Store a value only if the key already exists.
     */
    boolean replace(String key, byte[] value, long expire);

    /**
     * Store a value only if the key still holds the version identified by token.
     */
    boolean cas(CasToken token, String key, byte[] value, long expire);

    /**
     * Add offset to a numeric value. An absent key is initialised to initial.
     *
     * @return the new value, or empty if offset is not positive, initial is
     *         negative or the current value is not numeric
     */
    OptionalLong increment(String key, long offset, long initial, long expire);

    /**
     * Subtract offset from a numeric value, never going below zero. An absent key
     * is initialised to initial.
     */
    OptionalLong decrement(String key, long offset, long initial, long expire);

    /**
     * Change the expiration of an existing key.
     */
    boolean touch(String key, long expire);

    /**
     * Remove every key.
     */
    boolean flush();
}
