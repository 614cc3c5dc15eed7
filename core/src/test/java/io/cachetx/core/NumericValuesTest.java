package io.cachetx.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class NumericValuesTest {

    @Test
    void parses_decimal_text() {
        assertEquals(42L, NumericValues.parse("42".getBytes(StandardCharsets.US_ASCII)).getAsLong());
        assertEquals("17", new String(NumericValues.encode(17), StandardCharsets.US_ASCII));
    }

    @Test
    void rejects_non_numeric_values() {
        assertTrue(NumericValues.parse("abc".getBytes(StandardCharsets.US_ASCII)).isEmpty());
        assertTrue(NumericValues.parse(new byte[0]).isEmpty());
        assertTrue(NumericValues.parse(null).isEmpty());
        assertTrue(NumericValues.parse("1.5".getBytes(StandardCharsets.US_ASCII)).isEmpty());
    }

    @Test
    void clamps_at_zero_and_saturates_on_overflow() {
        assertEquals(0L, NumericValues.applyClamped(3, -10));
        assertEquals(7L, NumericValues.applyClamped(3, 4));
        assertEquals(Long.MAX_VALUE, NumericValues.applyClamped(Long.MAX_VALUE - 1, 5));
    }
}
