package io.cachetx.storage;

import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStoreTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void set_then_get_returns_value_and_token() {
        var store = new MemoryStore();

        assertTrue(store.set("k", b("v"), 0));
        CachedValue read = store.get("k");

        assertNotNull(read);
        assertEquals("v", read.asString());
        assertNotNull(read.token());
        assertNull(store.get("missing"));
    }

    @Test
    void every_write_mints_a_new_token() {
        var store = new MemoryStore();
        store.set("k", b("1"), 0);
        CasToken first = store.get("k").token();

        store.set("k", b("1"), 0);
        CasToken second = store.get("k").token();

        assertNotEquals(first, second, "identical value must still yield a new version");
    }

    @Test
    void cas_succeeds_only_with_current_token() {
        var store = new MemoryStore();
        store.set("k", b("a"), 0);
        CasToken token = store.get("k").token();

        store.set("k", b("b"), 0); // someone else wrote in between

        assertFalse(store.cas(token, "k", b("c"), 0));
        assertEquals("b", store.get("k").asString());

        CasToken fresh = store.get("k").token();
        assertTrue(store.cas(fresh, "k", b("c"), 0));
        assertEquals("c", store.get("k").asString());
        assertFalse(store.cas(fresh, "missing", b("x"), 0));
    }

    @Test
    void add_and_replace_respect_existence() {
        var store = new MemoryStore();

        assertFalse(store.replace("k", b("x"), 0));
        assertTrue(store.add("k", b("a"), 0));
        assertFalse(store.add("k", b("b"), 0));
        assertTrue(store.replace("k", b("c"), 0));
        assertEquals("c", store.get("k").asString());
    }

    @Test
    void delete_reports_whether_key_existed() {
        var store = new MemoryStore();
        store.set("a", b("1"), 0);

        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));

        store.set("b", b("2"), 0);
        Map<String, Boolean> results = store.deleteMulti(List.of("b", "c"));
        assertEquals(Map.of("b", true, "c", false), results);
    }

    @Test
    void multi_operations_only_return_found_keys() {
        var store = new MemoryStore();
        Map<String, Boolean> results = store.setMulti(Map.of("a", b("1"), "b", b("2")), 0);
        assertEquals(Map.of("a", true, "b", true), results);

        Map<String, CachedValue> found = store.getMulti(List.of("a", "b", "c"));
        assertEquals(2, found.size());
        assertEquals("2", found.get("b").asString());
        assertFalse(found.containsKey("c"));
    }

    @Test
    void increment_initialises_absent_keys_and_clamps_decrement() {
        var store = new MemoryStore();

        assertEquals(10L, store.increment("n", 5, 10, 0).getAsLong());
        assertEquals(15L, store.increment("n", 5, 10, 0).getAsLong());
        assertEquals(0L, store.decrement("n", 100, 0, 0).getAsLong());
        assertEquals(3L, store.decrement("m", 1, 3, 0).getAsLong());
    }

    @Test
    void increment_rejects_bad_arguments_and_non_numeric_values() {
        var store = new MemoryStore();
        store.set("s", b("hello"), 0);

        assertTrue(store.increment("n", 0, 1, 0).isEmpty());
        assertTrue(store.increment("n", 1, -1, 0).isEmpty());
        assertTrue(store.increment("s", 1, 0, 0).isEmpty());
        assertNull(store.get("n"), "failed increment must not create the key");
    }

    @Test
    void entries_expire_and_touch_extends_them() {
        var clock = new MutableClock(1_700_000_000_000L);
        var store = new MemoryStore(0, clock);

        store.set("short", b("x"), 5);
        store.set("touched", b("y"), 5);
        assertTrue(store.touch("touched", 60));

        clock.advanceSeconds(10);

        assertNull(store.get("short"));
        assertEquals("y", store.get("touched").asString());
        assertFalse(store.touch("short", 60));
    }

    @Test
    void far_future_absolute_expiration_keeps_the_value() {
        var store = new MemoryStore();
        assertTrue(store.set("k", b("v"), Long.MAX_VALUE / 100));
        assertEquals("v", store.get("k").asString());
    }

    @Test
    void overwrite_keeps_the_existing_deadline() {
        var clock = new MutableClock(1_700_000_000_000L);
        var store = new MemoryStore(0, clock);
        store.set("n", b("5"), 10);

        assertTrue(store.overwrite("n", b("6")));
        assertEquals("6", store.get("n").asString());

        clock.advanceSeconds(10);
        assertNull(store.get("n"));
    }

    @Test
    void set_multi_with_a_null_value_stores_nothing() {
        var store = new MemoryStore();
        Map<String, byte[]> items = new LinkedHashMap<>();
        items.put("a", b("1"));
        items.put("b", null);

        assertThrows(NullPointerException.class, () -> store.setMulti(items, 0));
        assertNull(store.get("a"));
    }

    @Test
    void write_with_negative_expiration_removes_key() {
        var store = new MemoryStore();
        store.set("k", b("v"), 0);

        assertTrue(store.set("k", b("v2"), -1));
        assertNull(store.get("k"));
    }

    @Test
    void bounded_store_evicts_least_recently_used() {
        var store = new MemoryStore(2);
        store.set("a", b("1"), 0);
        store.set("b", b("2"), 0);
        store.get("a");            // a is now more recent than b
        store.set("c", b("3"), 0); // evicts b

        assertEquals(2, store.size());
        assertNotNull(store.get("a"));
        assertNull(store.get("b"));
        assertNotNull(store.get("c"));
    }

    @Test
    void flush_drops_everything() {
        var store = new MemoryStore();
        store.set("a", b("1"), 0);
        store.set("b", b("2"), 0);

        assertTrue(store.flush());
        assertEquals(0, store.size());
        assertNull(store.get("a"));
    }
}
