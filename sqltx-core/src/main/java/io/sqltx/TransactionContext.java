package io.sqltx;

/**
 * A unit-of-work boundary that binds command executions to one atomic outcome.
 *
 * <p>Two flavours exist: {@link ExplicitTransaction}, bound to a single
 * {@link ConnectionHandle} and passed to commands by hand, and {@link TransactionScope},
 * discovered by commands from the {@link AmbientScopeManager} of the current logical flow.
 *
 * <p>Always acquire a context with try-with-resources. {@link #close()} rolls back every
 * enlisted change unless {@link #complete()} was called first, so an exception escaping
 * the block never leaves partial work behind:
 * <pre>{@code
 * try (ConnectionHandle conn = factory.open();
 *      ExplicitTransaction tx = conn.beginTransaction(IsolationLevel.SERIALIZABLE)) {
 *     SqlCommand.create(insertRate, conn, tx).execute(params);
 *     tx.complete();
 * }
 * }</pre>
 *
 * @see Transactions
 */
public sealed interface TransactionContext extends AutoCloseable
        permits ExplicitTransaction, TransactionScope {

    /**
     * Returns the transaction identifier (a ULID).
     */
    String id();

    /**
     * Returns the isolation level the transaction runs at.
     */
    IsolationLevel isolationLevel();

    CompletionState state();

    /**
     * Returns {@code true} once two physical connections have been enlisted while
     * simultaneously open. Always {@code false} for explicit transactions.
     */
    boolean isDistributed();

    /**
     * Signals that the unit of work succeeded.
     *
     * @throws InvalidStateException if the context was already completed, rolled back or cancelled
     */
    void complete();

    /**
     * Cooperative cancellation: the context can no longer complete and rolls back on release.
     */
    void cancel();

    boolean isCancelled();

    /**
     * Registers a callback to run after the transaction commits.
     *
     * @throws InvalidStateException if the transaction is no longer active
     */
    void afterCommit(Runnable callback);

    /**
     * Registers a callback to run after the transaction rolls back.
     *
     * @throws InvalidStateException if the transaction is no longer active
     */
    void afterRollback(Runnable callback);

    /**
     * Fails if the transaction escalated to a distributed one. Call right before
     * {@link #complete()} where a local transaction is expected.
     *
     * @throws UnexpectedDistributedTransactionException if {@link #isDistributed()}
     */
    default void requireLocal() {
        if (isDistributed()) {
            throw new UnexpectedDistributedTransactionException(
                    "Unexpected distributed transaction " + id());
        }
    }

    /**
     * Releases the context, rolling back unless {@link #complete()} succeeded.
     */
    @Override
    void close();
}
