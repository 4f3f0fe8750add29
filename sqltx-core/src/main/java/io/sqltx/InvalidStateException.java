package io.sqltx;

/**
 * Thrown when an operation targets a closed connection or a context that is no longer
 * active (already completed, rolled back, cancelled, or doomed by a nested scope).
 */
public final class InvalidStateException extends SqlTxException {
    public InvalidStateException(String message) {
        super(message);
    }
}
