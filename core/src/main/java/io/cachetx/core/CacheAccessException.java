package io.cachetx.core;

/**
 * A backend could not be reached or answered with something other than a result.
 * Transport problems are not "not found": they are surfaced as this unchecked
 * exception so callers (and transaction replay) can tell the two apart.
 */
public class CacheAccessException extends RuntimeException {

    public CacheAccessException(String message) {
        super(message);
    }

    public CacheAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
