package io.cachetx.transaction;

import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import io.cachetx.core.KeyValueStore;
import io.cachetx.core.UnbegunTransactionException;
import io.cachetx.storage.Buffer;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Key-value store with explicit, nestable transactions.
 * <p>
 * Semantics:
 *  - begin() opens a transaction on top of the innermost open one (or the real
 *    store when none is open). A nested transaction commits into its parent,
 *    not into the real store.
 *  - commit() / rollback() close the innermost transaction.
 *  - Every operation goes to the innermost open transaction, or straight to the
 *    real store when no transaction is open.
 */
public class TransactionalStore implements KeyValueStore {

    private final KeyValueStore cache;

    /** Innermost transaction at the head. */
    private final Deque<Transaction> transactions = new ArrayDeque<>();

    public TransactionalStore(KeyValueStore cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public void begin() {
        transactions.push(new Transaction(new Buffer(), current()));
    }

    /**
     * Commit the innermost transaction into its parent.
     *
     * @return false if a deferred write failed and the transaction was rolled back
     * @throws UnbegunTransactionException if no transaction is open
     */
    public boolean commit() {
        return pop("commit").commit();
    }

    /**
     * @throws UnbegunTransactionException if no transaction is open
     */
    public boolean rollback() {
        return pop("roll back").rollback();
    }

    /** Number of open transactions. */
    public int depth() {
        return transactions.size();
    }

    @Override
    public CachedValue get(String key) {
        return current().get(key);
    }

    @Override
    public Map<String, CachedValue> getMulti(Collection<String> keys) {
        return current().getMulti(keys);
    }

    @Override
    public boolean set(String key, byte[] value, long expire) {
        return current().set(key, value, expire);
    }

    @Override
    public Map<String, Boolean> setMulti(Map<String, byte[]> items, long expire) {
        return current().setMulti(items, expire);
    }

    @Override
    public boolean delete(String key) {
        return current().delete(key);
    }

    @Override
    public Map<String, Boolean> deleteMulti(Collection<String> keys) {
        return current().deleteMulti(keys);
    }

    @Override
    public boolean add(String key, byte[] value, long expire) {
        return current().add(key, value, expire);
    }

    @Override
    public boolean replace(String key, byte[] value, long expire) {
        return current().replace(key, value, expire);
    }

    @Override
    public boolean cas(CasToken token, String key, byte[] value, long expire) {
        return current().cas(token, key, value, expire);
    }

    @Override
    public OptionalLong increment(String key, long offset, long initial, long expire) {
        return current().increment(key, offset, initial, expire);
    }

    @Override
    public OptionalLong decrement(String key, long offset, long initial, long expire) {
        return current().decrement(key, offset, initial, expire);
    }

    @Override
    public boolean touch(String key, long expire) {
        return current().touch(key, expire);
    }

    @Override
    public boolean flush() {
        return current().flush();
    }

    private KeyValueStore current() {
        Transaction innermost = transactions.peek();
        return innermost == null ? cache : innermost;
    }

    private Transaction pop(String what) {
        if (transactions.isEmpty()) {
            throw new UnbegunTransactionException(
                    "Attempted to " + what + " without having begun a transaction"
            );
        }
        return transactions.pop();
    }
}
