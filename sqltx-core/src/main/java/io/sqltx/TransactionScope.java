package io.sqltx;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;

/**
 * An ambient transaction context: while the scope is open it is the current context of
 * the logical flow that created it, and connections opened from enlisting factories join
 * its transaction without being passed around.
 *
 * <pre>{@code
 * try (TransactionScope scope = Transactions.beginAmbient(IsolationLevel.READ_COMMITTED, false)) {
 *     SqlCommand.create(selectEmployee, factory).execute(Params.of("id", 42));
 *     SqlCommand.create(updateJobTitle, factory).execute(params);
 *     scope.requireLocal();
 *     scope.complete();
 * }
 * }</pre>
 *
 * <p>{@link #complete()} only records the vote; the root scope commits when it is closed.
 * A nested {@link Propagation#REQUIRED} scope shares the outer transaction, and closing it
 * without completing dooms that transaction.
 *
 * <p>Scopes must be closed in reverse order of creation, on the flow that created them.
 */
public final class TransactionScope implements TransactionContext {
    private final AmbientScopeManager manager;
    private final AmbientTransaction transaction;
    private final boolean root;
    private final ScopeOptions options;
    private final String suppressedId;
    private volatile boolean completed;
    private volatile boolean cancelled;
    private volatile boolean closed;
    private volatile boolean discarded;

    TransactionScope(AmbientScopeManager manager, AmbientTransaction transaction, boolean root, ScopeOptions options) {
        this.manager = manager;
        this.transaction = transaction;
        this.root = root;
        this.options = options;
        this.suppressedId = transaction == null ? UlidCreator.getMonotonicUlid().toString() : null;
    }

    /**
     * Returns the id of the shared transaction; a suppressing scope has an id of its own.
     */
    @Override
    public String id() {
        return transaction == null ? suppressedId : transaction.id();
    }

    /**
     * Returns the isolation of the shared transaction, or {@code null} for a suppressing scope.
     */
    @Override
    public IsolationLevel isolationLevel() {
        return transaction == null ? null : transaction.isolationLevel();
    }

    @Override
    public CompletionState state() {
        if (transaction != null) {
            return transaction.state();
        }
        if (!closed) {
            return CompletionState.ACTIVE;
        }
        return completed ? CompletionState.COMMITTED : CompletionState.ROLLED_BACK;
    }

    @Override
    public boolean isDistributed() {
        return transaction != null && transaction.isDistributed();
    }

    public ScopeOptions options() {
        return options;
    }

    /**
     * Returns {@code true} if this scope started its transaction rather than joining one.
     */
    public boolean isRoot() {
        return root;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Records that the work inside this scope succeeded.
     *
     * @throws InvalidStateException if the scope was already completed, closed or cancelled
     */
    @Override
    public synchronized void complete() {
        if (completed || closed) {
            throw new InvalidStateException("Scope " + id() + " is already completed");
        }
        if (cancelled) {
            throw new InvalidStateException("Scope " + id() + " was cancelled and can only roll back");
        }
        completed = true;
    }

    @Override
    public void cancel() {
        cancelled = true;
        if (transaction != null) {
            transaction.doom("scope was cancelled");
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void afterCommit(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireTransaction().afterCommit(callback);
    }

    @Override
    public void afterRollback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireTransaction().afterRollback(callback);
    }

    /**
     * Pops the scope from its flow and, for the root scope, commits or rolls back the
     * transaction.
     *
     * @throws TransactionAbortedException if the scope completed but the transaction rolled back
     * @throws UnbalancedScopeException    if scopes were released out of order
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        UnbalancedScopeException unbalanced = null;
        if (!discarded) {
            try {
                manager.pop(this);
            } catch (UnbalancedScopeException e) {
                unbalanced = e;
            }
        }
        if (transaction == null) {
            if (unbalanced != null) throw unbalanced;
            return;
        }
        boolean vote = completed && !cancelled && unbalanced == null && !discarded;
        if (!vote) {
            transaction.doom(cancelled ? "scope was cancelled" : "scope " + id() + " released without complete()");
        }
        if (root) {
            try {
                transaction.finish(vote);
            } catch (RuntimeException e) {
                if (unbalanced == null) throw e;
                unbalanced.addSuppressed(e);
            }
        }
        if (unbalanced != null) {
            throw unbalanced;
        }
    }

    @Override
    public String toString() {
        return "TransactionScope[" + id() + ", " + options.propagation() + (root ? ", root" : "") + "]";
    }

    AmbientTransaction transaction() {
        return transaction;
    }

    void discard() {
        discarded = true;
    }

    void requireUsable() {
        if (closed) {
            throw new InvalidStateException("Scope " + id() + " is closed");
        }
        if (cancelled) {
            throw new InvalidStateException("Scope " + id() + " was cancelled and can only roll back");
        }
        if (transaction != null) {
            transaction.requireUsable();
        }
    }

    private AmbientTransaction requireTransaction() {
        if (transaction == null) {
            throw new InvalidStateException("Scope " + id() + " suppresses ambient transactions");
        }
        return transaction;
    }
}
