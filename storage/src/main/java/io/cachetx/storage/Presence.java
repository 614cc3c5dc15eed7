package io.cachetx.storage;

/**
 * What the local buffer knows about a key.
 */
public enum Presence {
    /** Never written or deleted here; the backend is authoritative. */
    UNKNOWN,
    /** Holds a live value. */
    PRESENT,
    /** Deleted (or expired) here; must not fall back to the backend. */
    TOMBSTONED
}
