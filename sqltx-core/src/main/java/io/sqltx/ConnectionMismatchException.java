package io.sqltx;

/**
 * Thrown when a command is bound to a connection that differs from the connection
 * of the transaction context it was given. Raised at construction time, before any
 * statement reaches the database.
 */
public final class ConnectionMismatchException extends SqlTxException {
    public ConnectionMismatchException(String message) {
        super(message);
    }
}
