package io.cachetx.storage;

import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Local, never-evicting store that holds uncommitted writes.
 * <p>
 * Unlike a plain {@link MemoryStore}, a Buffer remembers keys that are gone:
 *  - delete(), markTombstoned() and writes with an already-expired expiration
 *    leave the key TOMBSTONED instead of UNKNOWN;
 *  - an entry whose own expiration passes also becomes TOMBSTONED.
 * A later live write to the key clears the tombstone. flush() forgets
 * everything, tombstones included.
 * <p>
 * Entries are never evicted, whatever their number: dropping an uncommitted
 * write would make later reads fall back to stale backend values.
 */
public class Buffer extends MemoryStore {

    /** Guarded by this. */
    private final Set<String> tombstones = new HashSet<>();

    public Buffer() {
        this(Clock.systemUTC());
    }

    public Buffer(Clock clock) {
        super(0, clock);
    }

    public synchronized Presence presence(String key) {
        Objects.requireNonNull(key, "key");
        if (containsLive(key)) {
            return Presence.PRESENT;
        }
        // containsLive() may just have turned an expired entry into a tombstone.
        return tombstones.contains(key) ? Presence.TOMBSTONED : Presence.UNKNOWN;
    }

    /**
     * True if the key was deleted (or expired) in this buffer and has not been
     * written since.
     */
    public synchronized boolean isTombstoned(String key) {
        return presence(key) == Presence.TOMBSTONED;
    }

    /**
     * Record that key is gone, whether or not the buffer held a value for it.
     */
    public synchronized void markTombstoned(String key) {
        Objects.requireNonNull(key, "key");
        forget(key);
        tombstones.add(key);
    }

    public synchronized void markTombstoned(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        for (String key : keys) {
            markTombstoned(key);
        }
    }

    @Override
    protected void onStored(String key) {
        tombstones.remove(key);
    }

    @Override
    protected void onRemoved(String key) {
        tombstones.add(key);
    }

    @Override
    protected void onExpired(String key) {
        tombstones.add(key);
    }

    @Override
    protected void onFlushed() {
        tombstones.clear();
    }
}
