package io.sqltx;

import com.github.f4b6a3.ulid.UlidCreator;
import io.sqltx.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The physical side of an ambient transaction, shared by every {@link TransactionScope}
 * that joins it. Tracks enlisted handles, the physical connections they run on, and the
 * connections parked by handles closed before the transaction finished.
 */
final class AmbientTransaction {
    private static final Logger logger = Logger.getLogger(AmbientTransaction.class.getName());

    private final String id = UlidCreator.getMonotonicUlid().toString();
    private final IsolationLevel isolationLevel;
    private final EscalationPolicy escalationPolicy;
    private final MetricsExporter metrics;

    private final List<ConnectionHandle> enlisted = new ArrayList<>();
    private final List<Connection> physicals = new ArrayList<>();
    private final Map<ConnectionFactory, Deque<Connection>> parked = new IdentityHashMap<>();
    private final Map<Connection, Integer> previousIsolation = new IdentityHashMap<>();
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private CompletionState state = CompletionState.ACTIVE;
    private boolean distributed;
    private String doomReason;

    AmbientTransaction(IsolationLevel isolationLevel, EscalationPolicy escalationPolicy, MetricsExporter metrics) {
        this.isolationLevel = isolationLevel;
        this.escalationPolicy = escalationPolicy;
        this.metrics = metrics;
        metrics.incrementTransactionStarted();
        logger.log(Level.FINE, "Began ambient transaction {0} at {1}", new Object[]{id, isolationLevel});
    }

    String id() {
        return id;
    }

    IsolationLevel isolationLevel() {
        return isolationLevel;
    }

    synchronized CompletionState state() {
        return state;
    }

    synchronized boolean isDistributed() {
        return distributed;
    }

    synchronized boolean isDoomed() {
        return doomReason != null;
    }

    /**
     * Supplies the physical connection for a handle being opened: a connection parked by an
     * earlier handle of the same factory, or a new one.
     */
    synchronized Connection attach(ConnectionHandle handle) throws SQLException {
        requireUsable();
        Connection physical = takeParked(handle.factory());
        if (physical == null) {
            physical = handle.factory().connectionProvider().getConnection();
            try {
                begin(physical);
            } catch (SQLException e) {
                try {
                    physical.close();
                } catch (SQLException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
            physicals.add(physical);
        }
        if (register(handle, physical)) {
            parked.computeIfAbsent(handle.factory(), f -> new ArrayDeque<>()).push(physical);
            reject(handle);
        }
        return physical;
    }

    /**
     * Enlists a handle that was opened outside the transaction.
     */
    synchronized void enlistOpen(ConnectionHandle handle, Connection physical) throws SQLException {
        requireUsable();
        begin(physical);
        if (!containsPhysical(physical)) {
            physicals.add(physical);
        }
        if (register(handle, physical)) {
            reject(handle);
        }
    }

    /**
     * Keeps the physical connection of a closing handle until the transaction finishes.
     *
     * @return {@code false} if the transaction already finished and the caller must close it
     */
    synchronized boolean park(ConnectionHandle handle, Connection physical) {
        if (state != CompletionState.ACTIVE) {
            return false;
        }
        parked.computeIfAbsent(handle.factory(), f -> new ArrayDeque<>()).push(physical);
        return true;
    }

    synchronized void doom(String reason) {
        if (doomReason == null && state == CompletionState.ACTIVE) {
            doomReason = reason;
            logger.log(Level.FINE, "Ambient transaction {0} can only roll back: {1}", new Object[]{id, reason});
        }
    }

    synchronized void requireUsable() {
        if (state != CompletionState.ACTIVE) {
            throw new InvalidStateException("Ambient transaction " + id + " is already " + state);
        }
        if (doomReason != null) {
            throw new InvalidStateException("Ambient transaction " + id + " can only roll back: " + doomReason);
        }
    }

    synchronized void afterCommit(Runnable callback) {
        requireActive();
        afterCommit.add(callback);
    }

    synchronized void afterRollback(Runnable callback) {
        requireActive();
        afterRollback.add(callback);
    }

    /**
     * Commits (when requested and not doomed) or rolls back every physical connection, then
     * closes parked connections and detaches the handles still open.
     *
     * @throws TransactionAbortedException if a commit was requested but the transaction rolled back
     */
    void finish(boolean commitRequested) {
        RuntimeException failure = null;
        boolean committed = false;
        List<Runnable> callbacks;
        synchronized (this) {
            if (state != CompletionState.ACTIVE) {
                return;
            }
            if (commitRequested && doomReason == null) {
                if (distributed) {
                    logger.warning("Committing ambient transaction " + id + " over " + physicals.size()
                            + " physical connections without a distributed coordinator; "
                            + "atomicity across them is not guaranteed");
                }
                try {
                    for (Connection physical : physicals) {
                        physical.commit();
                    }
                    committed = true;
                } catch (SQLException e) {
                    failure = new TransactionAbortedException("Commit failed for ambient transaction " + id, e);
                }
            } else if (commitRequested) {
                failure = new TransactionAbortedException(
                        "Ambient transaction " + id + " was rolled back: " + doomReason);
            }
            if (!committed) {
                rollbackAll(failure);
            }
            state = committed ? CompletionState.COMMITTED : CompletionState.ROLLED_BACK;
            releaseConnections();
            callbacks = List.copyOf(committed ? afterCommit : afterRollback);
        }
        if (committed) {
            metrics.incrementTransactionCommitted();
        } else {
            metrics.incrementTransactionRolledBack();
        }
        logger.log(Level.FINE, "Ambient transaction {0} {1}", new Object[]{id, state()});
        RuntimeException callbackFailure = Callbacks.runAll(callbacks);
        if (failure != null) {
            if (callbackFailure != null) failure.addSuppressed(callbackFailure);
            throw failure;
        }
        if (callbackFailure != null) {
            throw callbackFailure;
        }
    }

    /**
     * Records the enlistment and reports whether it escalates under a rejecting policy.
     */
    private boolean register(ConnectionHandle handle, Connection physical) {
        if (!enlisted.contains(handle)) {
            enlisted.add(handle);
        }
        if (!concurrentlyOpen(handle, physical)) {
            return false;
        }
        if (!distributed) {
            distributed = true;
            metrics.incrementEscalated();
            logger.warning("Ambient transaction " + id + " escalated to distributed: connection "
                    + handle.id() + " enlisted while another enlisted connection is open");
        }
        return escalationPolicy == EscalationPolicy.REJECT;
    }

    private void reject(ConnectionHandle handle) {
        doom("escalation to a distributed transaction was rejected");
        throw new UnexpectedDistributedTransactionException("Ambient transaction " + id
                + " rejected connection " + handle.id() + ": another enlisted connection is open");
    }

    private boolean concurrentlyOpen(ConnectionHandle handle, Connection physical) {
        for (ConnectionHandle other : enlisted) {
            if (other != handle && other.isOpen() && other.enlistment() == this && other.physical() != physical) {
                return true;
            }
        }
        return false;
    }

    private void begin(Connection physical) throws SQLException {
        physical.setAutoCommit(false);
        previousIsolation.putIfAbsent(physical, isolationLevel.applyTo(physical));
    }

    private Connection takeParked(ConnectionFactory factory) {
        Deque<Connection> available = parked.get(factory);
        return available == null ? null : available.poll();
    }

    private boolean containsPhysical(Connection physical) {
        for (Connection candidate : physicals) {
            if (candidate == physical) return true;
        }
        return false;
    }

    private boolean isParked(Connection physical) {
        for (Deque<Connection> available : parked.values()) {
            for (Connection candidate : available) {
                if (candidate == physical) return true;
            }
        }
        return false;
    }

    private void rollbackAll(RuntimeException failure) {
        for (Connection physical : physicals) {
            try {
                physical.rollback();
            } catch (SQLException e) {
                if (failure != null) {
                    failure.addSuppressed(e);
                } else {
                    logger.log(Level.WARNING, "Rollback failed for ambient transaction " + id, e);
                }
            }
        }
    }

    private void releaseConnections() {
        for (Connection physical : physicals) {
            try {
                if (isParked(physical)) {
                    physical.close();
                } else {
                    physical.setAutoCommit(true);
                    Integer previous = previousIsolation.get(physical);
                    if (previous != null) {
                        IsolationLevel.restore(physical, previous);
                    }
                }
            } catch (SQLException e) {
                logger.log(Level.WARNING, "Failed to release connection of ambient transaction " + id, e);
            }
        }
        for (ConnectionHandle handle : enlisted) {
            handle.detach(this);
        }
        parked.clear();
        previousIsolation.clear();
    }

    private void requireActive() {
        if (state != CompletionState.ACTIVE) {
            throw new InvalidStateException("Ambient transaction " + id + " is already " + state);
        }
    }
}
