package io.cachetx.core;

/**
 * Thrown when commit or rollback is requested but no transaction was begun.
 */
public class UnbegunTransactionException extends IllegalStateException {

    public UnbegunTransactionException(String message) {
        super(message);
    }
}
