package io.cachetx.core;

import java.nio.charset.StandardCharsets;
import java.util.OptionalLong;

/**
 * Counters are stored as ASCII decimal text, like Redis INCR and memcached incr.
 */
public final class NumericValues {

    private NumericValues() {
        // utility
    }

    /**
     * Parse a stored value as a counter.
     *
     * @return the number, or empty if the bytes are not a decimal long
     */
    public static OptionalLong parse(byte[] value) {
        if (value == null || value.length == 0 || value.length > 20) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(new String(value, StandardCharsets.US_ASCII)));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    public static byte[] encode(long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Apply a signed delta, clamping the result at zero.
     */
    public static long applyClamped(long current, long delta) {
        long next = current + delta;
        // overflow in either direction
        if (((current ^ next) & (delta ^ next)) < 0) {
            return delta > 0 ? Long.MAX_VALUE : 0L;
        }
        return Math.max(0L, next);
    }
}
