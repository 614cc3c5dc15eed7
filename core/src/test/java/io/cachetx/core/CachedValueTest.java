package io.cachetx.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CachedValueTest {

    @Test
    void value_bytes_are_copied_in_and_out() {
        byte[] raw = "abc".getBytes();
        var cached = new CachedValue(raw, CasToken.of("t1"));

        raw[0] = 'X';
        assertEquals("abc", cached.asString());

        byte[] out = cached.value();
        out[0] = 'Y';
        assertEquals("abc", cached.asString());
    }

    @Test
    void tokens_compare_by_id() {
        assertEquals(CasToken.of("a"), CasToken.of("a"));
        assertNotEquals(CasToken.of("a"), CasToken.of("b"));
        assertThrows(IllegalArgumentException.class, () -> CasToken.of(" "));
    }
}
