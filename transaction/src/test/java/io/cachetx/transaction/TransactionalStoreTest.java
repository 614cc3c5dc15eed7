package io.cachetx.transaction;

import io.cachetx.core.CachedValue;
import io.cachetx.core.UnbegunTransactionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TransactionalStoreTest {

    private RecordingStore backend;
    private TransactionalStore store;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @BeforeEach
    void setUp() {
        backend = new RecordingStore();
        store = new TransactionalStore(backend);
    }

    @Test
    void without_transaction_operations_go_straight_to_backend() {
        assertTrue(store.set("a", b("1"), 0));
        assertEquals("1", backend.peek("a"));
        assertEquals(0, store.depth());
    }

    @Test
    void writes_inside_transaction_reach_backend_on_commit() {
        store.begin();
        store.set("a", b("1"), 0);
        assertNull(backend.peek("a"));
        assertEquals("1", store.get("a").asString());

        assertTrue(store.commit());
        assertEquals("1", backend.peek("a"));
        assertEquals(0, store.depth());
    }

    @Test
    void nested_transaction_commits_into_parent() {
        store.begin();
        store.set("a", b("1"), 0);
        store.begin();
        store.set("b", b("2"), 0);
        assertEquals("1", store.get("a").asString(), "child sees parent's writes");

        assertTrue(store.commit());
        assertNull(backend.peek("b"), "inner commit only reaches the parent");
        assertEquals("2", store.get("b").asString());

        assertTrue(store.commit());
        assertEquals("1", backend.peek("a"));
        assertEquals("2", backend.peek("b"));
    }

    @Test
    void nested_rollback_discards_only_child_writes() {
        store.begin();
        store.set("a", b("1"), 0);
        store.begin();
        store.set("b", b("2"), 0);

        assertTrue(store.rollback());
        assertNull(store.get("b"));

        assertTrue(store.commit());
        assertEquals("1", backend.peek("a"));
        assertNull(backend.peek("b"));
    }

    @Test
    void cas_in_child_replays_through_parent() {
        store.begin();
        store.set("k", b("v"), 0);
        store.begin();
        CachedValue read = store.get("k");
        assertTrue(store.cas(read.token(), "k", b("v2"), 0));

        assertTrue(store.commit());
        assertTrue(store.commit());
        assertEquals("v2", backend.peek("k"));
    }

    @Test
    void commit_or_rollback_without_begin_is_rejected() {
        assertThrows(UnbegunTransactionException.class, store::commit);
        assertThrows(UnbegunTransactionException.class, store::rollback);
    }
}
