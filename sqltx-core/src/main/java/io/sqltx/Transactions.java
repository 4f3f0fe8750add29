package io.sqltx;

import java.util.Objects;
import java.util.Optional;

/**
 * Scoped-acquisition entry points for explicit and ambient transaction contexts.
 *
 * <p>Ambient scopes opened here live on {@link AmbientScopeManager#global()}.
 */
public final class Transactions {

    /**
     * Begins a transaction bound to {@code connection}.
     *
     * @throws InvalidStateException    if the connection is not open
     * @throws ConnectionInUseException if the connection already belongs to a transaction
     */
    public static ExplicitTransaction beginExplicit(ConnectionHandle connection, IsolationLevel isolationLevel) {
        Objects.requireNonNull(connection, "connection");
        return connection.beginTransaction(isolationLevel);
    }

    /**
     * Opens an ambient scope that joins the current transaction or starts one.
     */
    public static TransactionScope beginAmbient(IsolationLevel isolationLevel, boolean asyncFlowEnabled) {
        return beginAmbient(ScopeOptions.defaults()
                .withIsolationLevel(isolationLevel)
                .withAsyncFlow(asyncFlowEnabled));
    }

    public static TransactionScope beginAmbient(ScopeOptions options) {
        return AmbientScopeManager.global().begin(options);
    }

    /**
     * Returns the innermost ambient context of the calling flow.
     */
    public static Optional<TransactionContext> current() {
        return AmbientScopeManager.global().current();
    }

    private Transactions() {}
}
