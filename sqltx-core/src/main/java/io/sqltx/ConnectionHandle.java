package io.sqltx;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one physical connection to the database.
 *
 * <p>A handle must be {@linkplain #open() opened} before commands run on it. While an
 * {@link ExplicitTransaction} is bound to it, the handle belongs to that transaction:
 * closing it first rolls the transaction back and fails with {@link InvalidStateException},
 * and using it with another context fails with {@link ConnectionInUseException}.
 *
 * <p>Inside an ambient {@link TransactionScope} a handle opened from an enlisting factory
 * joins the scope's transaction. Closing such a handle parks its physical connection in
 * the transaction instead of closing it; the work done on it commits or rolls back with
 * the scope.
 */
public final class ConnectionHandle implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ConnectionHandle.class.getName());
    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final ConnectionFactory factory;

    private volatile Connection physical;
    private volatile boolean open;
    private volatile ExplicitTransaction owner;
    private volatile AmbientTransaction enlistment;

    ConnectionHandle(ConnectionFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Identity used to validate transaction binding; unique within the process.
     */
    public long id() {
        return id;
    }

    public boolean isOpen() {
        return open;
    }

    public ConnectionFactory factory() {
        return factory;
    }

    /**
     * Returns {@code true} while the handle participates in an ambient transaction.
     */
    public boolean isEnlisted() {
        return enlistment != null;
    }

    /**
     * Opens the handle, auto-enlisting in the current ambient transaction when the factory
     * enlists.
     *
     * @return this handle
     * @throws InvalidStateException if already open, or if the ambient transaction can only roll back
     * @throws UnexpectedDistributedTransactionException if enlisting would escalate a
     *         {@link EscalationPolicy#REJECT} scope
     * @throws SqlCommandException if no physical connection can be obtained
     */
    public synchronized ConnectionHandle open() {
        if (open) {
            throw new InvalidStateException("Connection " + id + " is already open");
        }
        AmbientTransaction ambient = factory.isEnlist() ? factory.scopeManager().currentTransaction() : null;
        try {
            if (ambient != null) {
                physical = ambient.attach(this);
                enlistment = ambient;
            } else {
                physical = factory.connectionProvider().getConnection();
            }
        } catch (SQLException e) {
            throw new SqlCommandException("Failed to open connection " + id, e);
        }
        open = true;
        logger.log(Level.FINE, "Opened connection {0}{1}",
                new Object[]{id, ambient == null ? "" : " enlisted in " + ambient.id()});
        return this;
    }

    /**
     * Begins an explicit transaction at {@link IsolationLevel#READ_COMMITTED}.
     */
    public ExplicitTransaction beginTransaction() {
        return beginTransaction(IsolationLevel.READ_COMMITTED);
    }

    /**
     * Begins an explicit transaction bound to this handle.
     *
     * @throws InvalidStateException     if the handle is not open
     * @throws ConnectionInUseException  if another transaction already owns the handle
     */
    public synchronized ExplicitTransaction beginTransaction(IsolationLevel isolationLevel) {
        Objects.requireNonNull(isolationLevel, "isolationLevel");
        requireOpen();
        ExplicitTransaction current = owner;
        if (current != null) {
            throw new ConnectionInUseException(
                    "Connection " + id + " is already bound to transaction " + current.id());
        }
        AmbientTransaction ambient = enlistment;
        if (ambient != null) {
            throw new ConnectionInUseException(
                    "Connection " + id + " is enlisted in ambient transaction " + ambient.id());
        }
        int previousIsolation;
        try {
            physical.setAutoCommit(false);
            previousIsolation = isolationLevel.applyTo(physical);
        } catch (SQLException e) {
            throw new SqlCommandException("Failed to begin transaction on connection " + id, e);
        }
        ExplicitTransaction tx = new ExplicitTransaction(this, isolationLevel, previousIsolation, factory.metrics());
        owner = tx;
        return tx;
    }

    /**
     * Checks that commands may run on this handle under {@code context}. Called when a
     * command is constructed, before any statement is sent.
     *
     * @param context the context the command was given, or {@code null}
     * @throws ConnectionMismatchException if the context is bound to a different connection
     * @throws ConnectionInUseException    if an explicit transaction owns this handle, or the
     *                                     handle is enlisted in another ambient transaction,
     *                                     and an ambient context was supplied
     */
    public void validateBinding(TransactionContext context) {
        if (context == null) {
            return;
        }
        if (context instanceof ExplicitTransaction explicit) {
            if (explicit.connection() != this) {
                throw new ConnectionMismatchException("Transaction " + explicit.id()
                        + " is bound to connection " + explicit.connection().id()
                        + ", not to connection " + id);
            }
        } else if (context instanceof TransactionScope scope) {
            ExplicitTransaction current = owner;
            if (current != null) {
                throw new ConnectionInUseException(
                        "Connection " + id + " is bound to explicit transaction " + current.id());
            }
            AmbientTransaction enlisted = enlistment;
            AmbientTransaction requested = scope.transaction();
            if (enlisted != null && enlisted != requested) {
                throw new ConnectionInUseException("Connection " + id
                        + " is enlisted in ambient transaction " + enlisted.id()
                        + (requested == null ? ", but the scope suppresses ambient transactions"
                        : ", not in " + requested.id()));
            }
        }
    }

    /**
     * Runs {@code callback} against the physical connection after validating state and
     * binding. Enlists the handle in an ambient context on first use.
     *
     * @param context the explicit or ambient context to run under, or {@code null}
     * @throws InvalidStateException    if the handle is closed or the context no longer active
     * @throws ConnectionInUseException if {@code context} is {@code null} but an explicit
     *                                  transaction owns this handle
     * @throws SqlCommandException      if the callback raises {@link SQLException}
     */
    public <T> T execute(TransactionContext context, ConnectionCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        Connection connection = prepare(context);
        try {
            return callback.doInConnection(connection);
        } catch (SQLException e) {
            throw new SqlCommandException("Statement failed on connection " + id, e);
        }
    }

    /**
     * Closes the handle. Idempotent.
     *
     * @throws InvalidStateException if an explicit transaction was still active; it has been
     *                               rolled back before this is thrown
     */
    @Override
    public void close() {
        if (!open) {
            return;
        }
        InvalidStateException failure = null;
        ExplicitTransaction pending = owner;
        if (pending != null) {
            failure = new InvalidStateException("Connection " + id + " closed while transaction "
                    + pending.id() + " was active; the transaction was rolled back");
            try {
                pending.rollback();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
        synchronized (this) {
            if (open) {
                Connection connection = physical;
                AmbientTransaction ambient = enlistment;
                physical = null;
                open = false;
                enlistment = null;
                if (ambient == null || !ambient.park(this, connection)) {
                    try {
                        connection.close();
                    } catch (SQLException e) {
                        if (failure != null) {
                            failure.addSuppressed(e);
                        } else {
                            throw new SqlCommandException("Failed to close connection " + id, e);
                        }
                    }
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "ConnectionHandle[" + id + (open ? ", open" : ", closed") + "]";
    }

    Connection physical() {
        return physical;
    }

    AmbientTransaction enlistment() {
        return enlistment;
    }

    synchronized void release(ExplicitTransaction tx) {
        if (owner == tx) {
            owner = null;
        }
    }

    void detach(AmbientTransaction tx) {
        if (enlistment == tx) {
            enlistment = null;
        }
    }

    private synchronized Connection prepare(TransactionContext context) {
        requireOpen();
        validateBinding(context);
        if (context instanceof ExplicitTransaction explicit) {
            explicit.requireUsable();
            return physical;
        }
        AmbientTransaction requested = null;
        if (context instanceof TransactionScope scope) {
            scope.requireUsable();
            requested = scope.transaction();
        }
        if (requested == null) {
            ExplicitTransaction current = owner;
            if (current != null) {
                throw new ConnectionInUseException("Connection " + id + " has pending transaction "
                        + current.id() + "; pass it to the command");
            }
            AmbientTransaction enlisted = enlistment;
            if (enlisted != null) {
                enlisted.requireUsable();
            }
        } else if (enlistment == null) {
            try {
                requested.enlistOpen(this, physical);
            } catch (SQLException e) {
                throw new SqlCommandException("Failed to enlist connection " + id, e);
            }
            enlistment = requested;
        } else {
            requested.requireUsable();
        }
        return physical;
    }

    private void requireOpen() {
        if (!open) {
            throw new InvalidStateException("Connection " + id + " is not open");
        }
    }
}
