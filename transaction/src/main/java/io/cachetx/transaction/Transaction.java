package io.cachetx.transaction;

import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import io.cachetx.core.KeyValueStore;
import io.cachetx.core.NumericValues;
import io.cachetx.core.UncommittedTransactionException;
import io.cachetx.storage.Buffer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Write-buffering transaction over a backend cache.
 * <p>
 * Responsibilities:
 *  - Apply every write to a local {@link Buffer} right away, so later reads in the
 *    same transaction see it, and record a {@link DeferredAction} describing how to
 *    replay it against the backend.
 *  - Serve reads from the buffer; fall back to the backend only for keys the buffer
 *    knows nothing about, and never while an uncommitted flush is pending.
 *  - Hand out transaction-local CAS tokens bound to a snapshot of the value read.
 *    Backend tokens go stale once the real write is deferred, so they are never
 *    passed across the deferred boundary.
 *  - On commit, replay the deferred actions in order. The first failure stops the
 *    replay and rolls back: every key written during the attempt is deleted from
 *    the backend.
 * <p>
 * Lifecycle:
 *  - A transaction ends with commit() or rollback(); both reset the log, the token
 *    table, the touched-key set and the read suspension, after which the instance
 *    may be reused.
 *  - close() with deferred work still pending throws
 *    {@link UncommittedTransactionException}. Use try-with-resources.
 * <p>
 * Not thread-safe: one transaction belongs to one caller for one unit of work.
 */
public class Transaction implements KeyValueStore, AutoCloseable {

    private static final Logger log = Logger.getLogger(Transaction.class.getName());

    /** Shared across instances so tokens are never reused between transactions. */
    private static final AtomicLong TOKEN_SEQ = new AtomicLong();

    public enum State {
        ACTIVE,
        COMMITTING,
        COMMITTED,
        ROLLED_BACK
    }

    private final Buffer local;
    private final KeyValueStore cache;

    private final List<DeferredAction> deferred = new ArrayList<>();
    private final Map<CasToken, ValueSnapshot> tokens = new HashMap<>();
    private final Set<String> touched = new LinkedHashSet<>();

    /** Set by an uncommitted flush: the backend is about to be emptied, don't read it. */
    private boolean suspendReads;

    private State state = State.ACTIVE;

    /**
     * @param local buffer for uncommitted writes; must not evict
     * @param cache the real store that commit() writes to
     */
    public Transaction(Buffer local, KeyValueStore cache) {
        this.local = Objects.requireNonNull(local, "local");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    // ------------ reads ------------

    @Override
    public CachedValue get(String key) {
        Objects.requireNonNull(key, "key");
        activate();

        CachedValue buffered = local.get(key);
        byte[] value;
        if (buffered != null) {
            value = buffered.value();
        } else if (suspendReads || local.isTombstoned(key)) {
            // Pending flush, or deleted in this transaction: the backend value is stale.
            return null;
        } else {
            CachedValue remote = cache.get(key);
            if (remote == null) {
                return null;
            }
            value = remote.value();
        }
        return issueToken(value);
    }

    @Override
    public Map<String, CachedValue> getMulti(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        activate();

        Set<String> requested = new LinkedHashSet<>(keys);
        Map<String, CachedValue> buffered = local.getMulti(requested);

        Map<String, byte[]> values = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (String key : requested) {
            CachedValue v = buffered.get(key);
            if (v != null) {
                values.put(key, v.value());
            } else if (!suspendReads && !local.isTombstoned(key)) {
                missing.add(key);
            }
        }

        if (!missing.isEmpty()) {
            cache.getMulti(missing).forEach((key, v) -> values.put(key, v.value()));
        }

        Map<String, CachedValue> result = new LinkedHashMap<>();
        for (String key : requested) {
            byte[] value = values.get(key);
            if (value != null) {
                result.put(key, issueToken(value));
            }
        }
        return result;
    }

    // ------------ writes ------------

    @Override
    public boolean set(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        activate();

        if (!local.set(key, value, expire)) {
            return false;
        }
        defer(DeferredAction.set(key, value, expire));
        return true;
    }

    /**
     * Buffered multi-set. The returned map reflects what the buffer accepted;
     * backend outcomes only surface at commit.
     */
    @Override
    public Map<String, Boolean> setMulti(Map<String, byte[]> items, long expire) {
        Objects.requireNonNull(items, "items");
        items.forEach((key, value) -> {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        });
        activate();

        Map<String, Boolean> results = local.setMulti(items, expire);

        Map<String, byte[]> accepted = new LinkedHashMap<>();
        items.forEach((key, value) -> {
            if (Boolean.TRUE.equals(results.get(key))) {
                accepted.put(key, value);
            }
        });
        if (!accepted.isEmpty()) {
            defer(DeferredAction.setMulti(accepted, expire));
        }
        return results;
    }

    /**
     * Delete a key, reporting whether it existed as seen by this transaction.
     * <p>
     * The key is tombstoned in the buffer rather than removed from it, so later
     * reads don't fall through to the backend value that is about to be deleted.
     */
    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        activate();

        if (get(key) == null) {
            return false;
        }
        local.markTombstoned(key);
        defer(DeferredAction.delete(key));
        return true;
    }

    @Override
    public Map<String, Boolean> deleteMulti(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        activate();

        Map<String, CachedValue> existing = getMulti(keys);

        Map<String, Boolean> results = new LinkedHashMap<>();
        List<String> gone = new ArrayList<>();
        for (String key : keys) {
            boolean exists = existing.containsKey(key);
            results.put(key, exists);
            if (exists && !gone.contains(key)) {
                gone.add(key);
            }
        }

        if (!gone.isEmpty()) {
            local.markTombstoned(gone);
            defer(DeferredAction.deleteMulti(gone));
        }
        return results;
    }

    @Override
    public boolean add(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        activate();

        if (get(key) != null) {
            return false;
        }
        if (!local.set(key, value, expire)) {
            return false;
        }
        defer(DeferredAction.add(key, value, expire));
        return true;
    }

    @Override
    public boolean replace(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        activate();

        if (get(key) == null) {
            return false;
        }
        if (!local.set(key, value, expire)) {
            return false;
        }
        defer(DeferredAction.replace(key, value, expire));
        return true;
    }

    /**
     * Compare-and-swap against a token issued by this transaction's get/getMulti.
     * <p>
     * Locally the swap succeeds if the value currently visible to this transaction
     * still equals the snapshot bound to the token. At commit time the backend is
     * read again for a live backend token, and the real CAS is issued only if the
     * backend value still equals that same snapshot; otherwise the commit fails
     * and rolls back.
     */
    @Override
    public boolean cas(CasToken token, String key, byte[] value, long expire) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        activate();

        ValueSnapshot original = tokens.get(token);
        if (original == null) {
            return false;
        }

        CachedValue current = get(key);
        if (current == null || !original.matches(current.value())) {
            return false;
        }

        if (!local.set(key, value, expire)) {
            return false;
        }
        defer(DeferredAction.cas(original, key, value, expire));
        return true;
    }

    @Override
    public OptionalLong increment(String key, long offset, long initial, long expire) {
        return adjust(key, offset, initial, expire, true);
    }

    @Override
    public OptionalLong decrement(String key, long offset, long initial, long expire) {
        return adjust(key, offset, initial, expire, false);
    }

    @Override
    public boolean touch(String key, long expire) {
        Objects.requireNonNull(key, "key");
        activate();

        CachedValue current = get(key);
        if (current == null) {
            return false;
        }
        if (!local.set(key, current.value(), expire)) {
            return false;
        }
        defer(DeferredAction.touch(key, expire));
        return true;
    }

    /**
     * Wipe the buffer and every pending write, and suspend backend reads until the
     * flush is committed.
     */
    @Override
    public boolean flush() {
        activate();

        if (!local.flush()) {
            return false;
        }
        reset();
        suspendReads = true;
        defer(DeferredAction.flush());
        return true;
    }

    // ------------ commit / rollback ------------

    /**
     * Replay every deferred action against the backend, in the order recorded.
     *
     * @return true if all actions succeeded; false if one failed, in which case
     *         the transaction has been rolled back
     */
    public boolean commit() {
        ensureNotCommitting();
        state = State.COMMITTING;
        touched.clear();

        List<DeferredAction> actions = List.copyOf(deferred);
        for (DeferredAction action : actions) {
            // Record before evaluating: a failed action may still have written.
            touched.addAll(action.keys());
            if (!replay(action)) {
                log.warning(() -> "Deferred " + action + " failed, rolling back and invalidating "
                        + touched.size() + " key(s): " + touched);
                rollback();
                return false;
            }
        }

        reset();
        state = State.COMMITTED;
        if (!actions.isEmpty()) {
            log.fine(() -> "Committed " + actions.size() + " deferred action(s)");
        }
        return true;
    }

    /**
     * Drop all pending work and invalidate every key written during a failed commit.
     * <p>
     * Invalidation is best-effort: if the backend refuses or fails the delete, the
     * failure is logged and rollback still completes. The local buffer is flushed,
     * since it holds values that never reached the backend.
     *
     * @return always true
     */
    public boolean rollback() {
        if (!touched.isEmpty()) {
            List<String> keys = List.copyOf(touched);
            try {
                cache.deleteMulti(keys);
                log.info(() -> "Rolled back, invalidated " + keys.size() + " key(s): " + keys);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Rollback could not invalidate keys " + keys, e);
            }
        }

        local.flush();
        reset();
        state = State.ROLLED_BACK;
        return true;
    }

    /**
     * @throws UncommittedTransactionException if deferred writes are still pending
     */
    @Override
    public void close() {
        if (!deferred.isEmpty()) {
            throw new UncommittedTransactionException(
                    "Transaction is being closed without having been committed or rolled back ("
                            + deferred.size() + " deferred action(s) pending)"
            );
        }
    }

    // ------------ introspection ------------

    public State state() {
        return state;
    }

    /** Snapshot of the deferred log, in replay order. */
    public List<DeferredAction> pendingActions() {
        return List.copyOf(deferred);
    }

    public boolean readsSuspended() {
        return suspendReads;
    }

    // ------------ helpers ------------

    private OptionalLong adjust(String key, long offset, long initial, long expire, boolean up) {
        Objects.requireNonNull(key, "key");
        activate();

        if (offset <= 0 || initial < 0) {
            return OptionalLong.empty();
        }

        CachedValue current = get(key);
        long next;
        if (current == null) {
            // The backend will initialise the key to initial; mirror that locally.
            next = initial;
        } else {
            OptionalLong number = NumericValues.parse(current.value());
            if (number.isEmpty()) {
                return OptionalLong.empty();
            }
            next = NumericValues.applyClamped(number.getAsLong(), up ? offset : -offset);
        }

        // An existing counter keeps its expiration, like the backend's.
        boolean stored = current == null
                ? local.set(key, NumericValues.encode(next), expire)
                : local.overwrite(key, NumericValues.encode(next));
        if (!stored) {
            return OptionalLong.empty();
        }
        defer(up
                ? DeferredAction.increment(key, offset, initial, expire)
                : DeferredAction.decrement(key, offset, initial, expire));
        return OptionalLong.of(next);
    }

    /**
     * Issue one deferred action against the backend.
     * A runtime failure of the backend counts as a failed action.
     */
    private boolean replay(DeferredAction action) {
        try {
            return switch (action.kind()) {
                case SET -> cache.set(action.key(), action.value(), action.expire());
                case SET_MULTI -> allSucceeded(cache.setMulti(action.items(), action.expire()), action.keys());
                case DELETE -> {
                    // Deleting an already missing key is not corruption: the key is gone.
                    cache.delete(action.key());
                    yield true;
                }
                case DELETE_MULTI -> {
                    cache.deleteMulti(action.keys());
                    yield true;
                }
                case ADD -> cache.add(action.key(), action.value(), action.expire());
                case REPLACE -> cache.replace(action.key(), action.value(), action.expire());
                case CAS -> replayCas(action);
                case INCREMENT -> cache.increment(
                        action.key(), action.offset(), action.initial(), action.expire()).isPresent();
                case DECREMENT -> cache.decrement(
                        action.key(), action.offset(), action.initial(), action.expire()).isPresent();
                case TOUCH -> cache.touch(action.key(), action.expire());
                case FLUSH -> cache.flush();
            };
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Backend failed while replaying " + action, e);
            return false;
        }
    }

    /**
     * Re-read the backend for a live token and swap only if the value is still
     * the one this transaction originally read.
     */
    private boolean replayCas(DeferredAction action) {
        String key = action.key();
        CachedValue current = cache.get(key);
        if (current == null || !action.snapshot().matches(current.value())) {
            return false;
        }
        return cache.cas(current.token(), key, action.value(), action.expire());
    }

    private static boolean allSucceeded(Map<String, Boolean> results, List<String> keys) {
        for (String key : keys) {
            if (!Boolean.TRUE.equals(results.get(key))) {
                return false;
            }
        }
        return true;
    }

    private CachedValue issueToken(byte[] value) {
        CasToken token = CasToken.of("tx-" + TOKEN_SEQ.incrementAndGet());
        tokens.put(token, ValueSnapshot.of(value));
        return new CachedValue(value, token);
    }

    private void defer(DeferredAction action) {
        deferred.add(action);
    }

    private void activate() {
        ensureNotCommitting();
        state = State.ACTIVE;
    }

    private void ensureNotCommitting() {
        if (state == State.COMMITTING) {
            throw new IllegalStateException("Transaction is committing; no operations may be issued");
        }
    }

    private void reset() {
        deferred.clear();
        tokens.clear();
        touched.clear();
        suspendReads = false;
    }
}
