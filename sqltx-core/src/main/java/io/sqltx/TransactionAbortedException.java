package io.sqltx;

/**
 * Thrown on release of a completed ambient scope whose transaction was nevertheless
 * rolled back, either because a nested scope did not complete or because the
 * physical commit failed.
 */
public final class TransactionAbortedException extends SqlTxException {
    public TransactionAbortedException(String message) {
        super(message);
    }

    public TransactionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
