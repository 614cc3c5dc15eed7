package io.cachetx.core;

/**
 * Thrown when a transaction is closed while it still holds deferred writes
 * that were neither committed nor rolled back.
 */
public class UncommittedTransactionException extends IllegalStateException {

    public UncommittedTransactionException(String message) {
        super(message);
    }
}
