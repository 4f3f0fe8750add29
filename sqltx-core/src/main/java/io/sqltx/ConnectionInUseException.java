package io.sqltx;

/**
 * Thrown when a connection already owned by one transaction context is used by, or
 * bound to, another.
 */
public final class ConnectionInUseException extends SqlTxException {
    public ConnectionInUseException(String message) {
        super(message);
    }
}
