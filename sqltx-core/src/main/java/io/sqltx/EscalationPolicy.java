package io.sqltx;

/**
 * What an ambient transaction does when a second physical connection is enlisted while
 * another one is still open.
 */
public enum EscalationPolicy {
    /** Mark the transaction distributed and carry on. */
    ALLOW,
    /** Fail the enlistment with {@link UnexpectedDistributedTransactionException} and doom the transaction. */
    REJECT
}
