package io.cachetx.transaction;

import java.util.Arrays;
import java.util.Objects;

/**
 * By-value copy of what a read returned, bound to a transaction-local CAS token.
 * Later mutation of the bytes handed to the caller cannot change the snapshot.
 */
public final class ValueSnapshot {
    private final byte[] bytes;

    private ValueSnapshot(byte[] bytes) {
        this.bytes = bytes;
    }

    public static ValueSnapshot of(byte[] value) {
        Objects.requireNonNull(value, "value");
        return new ValueSnapshot(Arrays.copyOf(value, value.length));
    }

    /**
     * True if value is byte-for-byte what was captured.
     */
    public boolean matches(byte[] value) {
        return Arrays.equals(bytes, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueSnapshot)) return false;
        return Arrays.equals(bytes, ((ValueSnapshot) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
