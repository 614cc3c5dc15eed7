package io.cachetx.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable result of a successful read: the value bytes plus the CAS token
 * that identifies the version that was read.
 * <p>
 * Defensive copies of the value bytes are taken on input and output, so a
 * caller mutating the returned array cannot corrupt the store.
 */
public final class CachedValue {
    private final byte[] value;
    private final CasToken token;

    public CachedValue(byte[] value, CasToken token) {
        Objects.requireNonNull(value, "value");
        this.value = Arrays.copyOf(value, value.length);
        this.token = Objects.requireNonNull(token, "token");
    }

    public byte[] value() { return Arrays.copyOf(value, value.length); }

    public CasToken token() { return token; }

    /** Value decoded as UTF-8, mostly for logs and the CLI. */
    public String asString() {
        return new String(value, StandardCharsets.UTF_8);
    }
}
