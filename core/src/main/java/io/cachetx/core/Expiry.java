package io.cachetx.core;

/**
 * Expiration arithmetic shared by every store.
 * <p>
 * An expire argument is interpreted the way memcached does:
 *  - 0:                     never expires,
 *  - negative:              already expired,
 *  - 1 .. 30 days:          seconds relative to now,
 *  - anything larger:       absolute Unix timestamp in seconds.
 * <p>
 * Deadlines are epoch millis; a key is expired once now >= deadline.
 */
public final class Expiry {

    /** Relative expirations above this many seconds are absolute timestamps. */
    public static final long MAX_RELATIVE_SECONDS = 30L * 24 * 60 * 60;

    public static final long NEVER = Long.MAX_VALUE;
    public static final long EXPIRED = Long.MIN_VALUE;

    private Expiry() {
        // utility
    }

    /**
     * Convert an expire argument to an absolute deadline in epoch millis.
     */
    public static long deadline(long expire, long nowMillis) {
        if (expire == 0) {
            return NEVER;
        }
        if (expire < 0) {
            return EXPIRED;
        }
        if (expire <= MAX_RELATIVE_SECONDS) {
            return nowMillis + expire * 1000L;
        }
        if (expire > NEVER / 1000L) {
            // beyond what epoch millis can hold
            return NEVER;
        }
        return expire * 1000L;
    }

    public static boolean isExpired(long deadlineMillis, long nowMillis) {
        return deadlineMillis != NEVER && nowMillis >= deadlineMillis;
    }

    /**
     * True if a write with this expire argument would be gone immediately.
     */
    public static boolean expiresImmediately(long expire, long nowMillis) {
        return isExpired(deadline(expire, nowMillis), nowMillis);
    }
}
