package io.sqltx;

import com.github.f4b6a3.ulid.UlidCreator;
import io.sqltx.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A transaction bound to exactly one {@link ConnectionHandle}, passed to commands explicitly.
 *
 * <p>Obtain one from {@link ConnectionHandle#beginTransaction(IsolationLevel)} or
 * {@link Transactions#beginExplicit(ConnectionHandle, IsolationLevel)}. {@link #complete()}
 * commits; {@link #close()} rolls back unless the transaction already finished.
 */
public final class ExplicitTransaction implements TransactionContext {
    private static final Logger logger = Logger.getLogger(ExplicitTransaction.class.getName());

    private final String id = UlidCreator.getMonotonicUlid().toString();
    private final ConnectionHandle connection;
    private final IsolationLevel isolationLevel;
    private final int previousIsolation;
    private final MetricsExporter metrics;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();
    private volatile CompletionState state = CompletionState.ACTIVE;
    private volatile boolean cancelled;

    ExplicitTransaction(ConnectionHandle connection, IsolationLevel isolationLevel, int previousIsolation,
                        MetricsExporter metrics) {
        this.connection = connection;
        this.isolationLevel = isolationLevel;
        this.previousIsolation = previousIsolation;
        this.metrics = metrics;
        metrics.incrementTransactionStarted();
        logger.log(Level.FINE, "Began transaction {0} on connection {1} at {2}",
                new Object[]{id, connection.id(), isolationLevel});
    }

    /**
     * Returns the handle this transaction is bound to.
     */
    public ConnectionHandle connection() {
        return connection;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public IsolationLevel isolationLevel() {
        return isolationLevel;
    }

    @Override
    public CompletionState state() {
        return state;
    }

    @Override
    public boolean isDistributed() {
        return false;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }

    /**
     * Commits the transaction. A failed commit rolls back and rethrows.
     *
     * @throws InvalidStateException if already committed, rolled back, or cancelled
     * @throws SqlCommandException   if the commit fails
     */
    @Override
    public synchronized void complete() {
        requireUsable();
        Connection physical = connection.physical();
        SqlCommandException failure = null;
        boolean committed = false;
        try {
            physical.commit();
            committed = true;
        } catch (SQLException e) {
            failure = new SqlCommandException("Commit failed for transaction " + id, e);
            rollbackQuietly(physical, failure);
        }
        finish(committed, failure);
    }

    /**
     * Rolls back the transaction. No-op if it already finished.
     */
    public synchronized void rollback() {
        if (state != CompletionState.ACTIVE) {
            return;
        }
        SqlCommandException failure = null;
        try {
            connection.physical().rollback();
        } catch (SQLException e) {
            failure = new SqlCommandException("Rollback failed for transaction " + id, e);
        }
        finish(false, failure);
    }

    @Override
    public synchronized void afterCommit(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireActive();
        afterCommit.add(callback);
    }

    @Override
    public synchronized void afterRollback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireActive();
        afterRollback.add(callback);
    }

    /**
     * Rolls back unless the transaction already committed or rolled back.
     */
    @Override
    public void close() {
        if (state == CompletionState.ACTIVE) {
            rollback();
        }
    }

    @Override
    public String toString() {
        return "ExplicitTransaction[" + id + ", " + state + "]";
    }

    void requireUsable() {
        requireActive();
        if (cancelled) {
            throw new InvalidStateException("Transaction " + id + " was cancelled and can only roll back");
        }
    }

    private void requireActive() {
        CompletionState current = state;
        if (current != CompletionState.ACTIVE) {
            throw new InvalidStateException("Transaction " + id + " is already " + current);
        }
    }

    private void finish(boolean committed, RuntimeException failure) {
        state = committed ? CompletionState.COMMITTED : CompletionState.ROLLED_BACK;
        if (committed) {
            metrics.incrementTransactionCommitted();
        } else {
            metrics.incrementTransactionRolledBack();
        }
        logger.log(Level.FINE, "Transaction {0} {1}", new Object[]{id, state});
        try {
            Connection physical = connection.physical();
            physical.setAutoCommit(true);
            IsolationLevel.restore(physical, previousIsolation);
        } catch (SQLException e) {
            logger.log(Level.FINE, "Could not restore connection settings after transaction " + id, e);
        } finally {
            connection.release(this);
        }
        RuntimeException callbackFailure = Callbacks.runAll(committed ? afterCommit : afterRollback);
        if (failure != null) {
            if (callbackFailure != null) failure.addSuppressed(callbackFailure);
            throw failure;
        }
        if (callbackFailure != null) {
            throw callbackFailure;
        }
    }

    private void rollbackQuietly(Connection physical, RuntimeException failure) {
        try {
            physical.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }
}
