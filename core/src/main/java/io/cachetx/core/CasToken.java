package io.cachetx.core;

import java.util.Objects;

/**
 * Opaque compare-and-swap handle returned with every read.
 * <p>
 * Two tokens are equal when their ids are equal. The id carries no meaning
 * outside the store that minted it; it is exposed only so tokens can cross
 * a wire.
 */
public final class CasToken {
    private final String id;

    private CasToken(String id) {
        this.id = id;
    }

    public static CasToken of(String id) {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("token id must not be blank");
        }
        return new CasToken(id);
    }

    public String id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CasToken)) return false;
        return id.equals(((CasToken) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "CasToken[" + id + "]";
    }
}
