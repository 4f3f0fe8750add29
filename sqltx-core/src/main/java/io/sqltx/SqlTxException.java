package io.sqltx;

/**
 * Base class of all unchecked errors raised by the transaction and command layer.
 */
public class SqlTxException extends RuntimeException {
    public SqlTxException(String message) {
        super(message);
    }

    public SqlTxException(String message, Throwable cause) {
        super(message, cause);
    }
}
