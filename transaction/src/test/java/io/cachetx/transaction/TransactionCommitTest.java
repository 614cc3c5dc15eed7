package io.cachetx.transaction;

import io.cachetx.core.CacheAccessException;
import io.cachetx.core.CachedValue;
import io.cachetx.core.UncommittedTransactionException;
import io.cachetx.storage.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Commit replay, rollback invalidation and the must-close lifecycle.
 */
class TransactionCommitTest {

    private RecordingStore backend;
    private Transaction tx;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @BeforeEach
    void setUp() {
        backend = new RecordingStore();
        tx = new Transaction(new Buffer(), backend);
    }

    @Test
    void empty_commit_succeeds_without_touching_backend() {
        assertTrue(tx.commit());
        assertEquals(0, backend.totalCalls());
        assertEquals(Transaction.State.COMMITTED, tx.state());
    }

    @Test
    void later_write_to_same_key_wins() {
        tx.set("a", b("1"), 0);
        tx.set("a", b("2"), 0);

        assertTrue(tx.commit());
        assertEquals("2", backend.peek("a"));
    }

    @Test
    void cas_on_own_uncommitted_write_commits() {
        tx.set("a", b("1"), 0);
        CachedValue read = tx.get("a");
        assertTrue(tx.cas(read.token(), "a", b("2"), 0));

        assertTrue(tx.commit());
        assertEquals("2", backend.peek("a"));
    }

    @Test
    void deferred_cas_fails_when_backend_changed_behind_our_back() {
        backend.seed("a", "1");
        CachedValue read = tx.get("a");
        assertTrue(tx.cas(read.token(), "a", b("2"), 0));

        backend.seed("a", "someone-else");

        assertFalse(tx.commit());
        assertNull(backend.peek("a"), "key touched by the failed CAS is invalidated");
        assertEquals(Transaction.State.ROLLED_BACK, tx.state());
    }

    @Test
    void failed_action_invalidates_every_key_touched_so_far() {
        backend.seed("c", "untouched");
        backend.failWritesTo("b");

        tx.set("a", b("1"), 0);
        tx.set("b", b("2"), 0);
        tx.set("c", b("3"), 0);

        assertFalse(tx.commit());

        assertEquals(List.of(List.of("a", "b")), backend.deleteMultiCalls);
        assertNull(backend.peek("a"), "earlier successful write is rolled back");
        assertNull(backend.peek("b"));
        assertEquals("untouched", backend.peek("c"), "replay stops at the first failure");
        assertTrue(tx.pendingActions().isEmpty());
    }

    @Test
    void failed_commit_logs_the_keys_it_invalidates() {
        Logger logger = Logger.getLogger(Transaction.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(capture);
        try {
            backend.failWritesTo("b");
            tx.set("a", b("1"), 0);
            tx.set("a", b("2"), 0);
            tx.set("b", b("3"), 0);

            assertFalse(tx.commit());

            assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.WARNING
                            && r.getMessage().contains("invalidating 2 key(s): [a, b]")),
                    "warning names the touched keys, not the number of actions");
        } finally {
            logger.removeHandler(capture);
        }
    }

    @Test
    void backend_exception_during_replay_counts_as_failure() {
        tx.set("a", b("1"), 0);
        backend.throwOnWrites(new CacheAccessException("connection reset"));

        assertFalse(tx.commit());
        assertEquals(List.of(List.of("a")), backend.deleteMultiCalls);
    }

    @Test
    void rollback_completes_even_if_invalidation_fails() {
        backend.failWritesTo("a");
        backend.throwOnDeleteMulti(new CacheAccessException("backend down"));
        tx.set("a", b("1"), 0);

        assertFalse(tx.commit());
        assertEquals(Transaction.State.ROLLED_BACK, tx.state());
        assertTrue(tx.pendingActions().isEmpty());
        assertDoesNotThrow(tx::close);
    }

    @Test
    void explicit_rollback_discards_pending_writes() {
        tx.set("a", b("1"), 0);

        assertTrue(tx.rollback());

        assertTrue(tx.pendingActions().isEmpty());
        assertEquals(0, backend.totalCalls(), "nothing was written, nothing to invalidate");
        assertNull(tx.get("a"), "buffer is emptied by rollback");
    }

    @Test
    void committed_delete_removes_backend_value() {
        backend.seed("a", "1");
        tx.delete("a");
        tx.deleteMulti(List.of("missing"));

        assertTrue(tx.commit());
        assertNull(backend.peek("a"));
    }

    @Test
    void deferred_delete_of_already_missing_key_does_not_fail_commit() {
        backend.seed("a", "1");
        tx.delete("a");
        backend.inner.delete("a"); // vanished before commit

        assertTrue(tx.commit());
    }

    @Test
    void counters_replay_against_backend() {
        assertEquals(10L, tx.increment("n", 5, 10, 0).getAsLong());
        assertEquals(15L, tx.increment("n", 5, 10, 0).getAsLong());
        assertEquals(12L, tx.decrement("n", 3, 0, 0).getAsLong());

        assertTrue(tx.commit());
        assertEquals("12", backend.peek("n"));
    }

    @Test
    void add_conflicting_with_external_writer_rolls_back() {
        assertTrue(tx.add("k", b("mine"), 0));
        backend.seed("k", "theirs");

        assertFalse(tx.commit());
        assertNull(backend.peek("k"));
    }

    @Test
    void set_multi_and_touch_replay() {
        backend.seed("t", "v");
        tx.setMulti(Map.of("a", b("1"), "b", b("2")), 0);
        tx.touch("t", 3600);

        assertTrue(tx.commit());
        assertEquals("1", backend.peek("a"));
        assertEquals("2", backend.peek("b"));
        assertEquals(1, backend.calls("touch"));
    }

    @Test
    void committed_flush_empties_backend_and_keeps_later_writes() {
        backend.seed("old", "o");
        tx.set("before", b("x"), 0);
        tx.flush();
        tx.set("after", b("y"), 0);

        assertTrue(tx.commit());

        assertNull(backend.peek("old"));
        assertNull(backend.peek("before"));
        assertEquals("y", backend.peek("after"));
        assertFalse(tx.readsSuspended());
    }

    @Test
    void transaction_is_reusable_after_commit_and_tokens_are_not_reused() {
        backend.seed("k", "v");
        CachedValue first = tx.get("k");
        tx.set("k", b("w"), 0);
        assertTrue(tx.commit());

        CachedValue second = tx.get("k");
        assertEquals(Transaction.State.ACTIVE, tx.state());
        assertNotEquals(first.token(), second.token());
        assertFalse(tx.cas(first.token(), "k", b("z"), 0), "tokens die with their transaction");
        assertTrue(tx.cas(second.token(), "k", b("z"), 0));
        assertTrue(tx.commit());
        assertEquals("z", backend.peek("k"));
    }

    @Test
    void closing_with_pending_writes_is_a_usage_error() {
        tx.set("a", b("1"), 0);

        assertThrows(UncommittedTransactionException.class, tx::close);

        tx.rollback();
        assertDoesNotThrow(tx::close);
    }

    @Test
    void try_with_resources_accepts_committed_transaction() {
        assertDoesNotThrow(() -> {
            try (Transaction t = new Transaction(new Buffer(), backend)) {
                t.set("a", b("1"), 0);
                t.commit();
            }
        });
        assertEquals("1", backend.peek("a"));
    }
}
