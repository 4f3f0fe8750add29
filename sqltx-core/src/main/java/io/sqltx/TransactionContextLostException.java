package io.sqltx;

/**
 * Thrown when an asynchronous execution resumes on a logical flow that no longer sees
 * the ambient transaction it was started under. Raised instead of silently running
 * the statement outside any transaction.
 */
public final class TransactionContextLostException extends SqlTxException {
    public TransactionContextLostException(String message) {
        super(message);
    }
}
