package io.sqltx;

/**
 * Thrown when an ambient transaction has escalated to distributed mode where the
 * caller requires a local one, either from {@link TransactionContext#requireLocal()}
 * or from an {@link EscalationPolicy#REJECT} scope at enlistment time.
 */
public final class UnexpectedDistributedTransactionException extends SqlTxException {
    public UnexpectedDistributedTransactionException(String message) {
        super(message);
    }
}
