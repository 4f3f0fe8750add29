package io.sqltx;

/**
 * Unchecked exception wrapping JDBC errors raised while opening connections, executing
 * statements, or finishing transactions.
 */
public final class SqlCommandException extends SqlTxException {
    public SqlCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
