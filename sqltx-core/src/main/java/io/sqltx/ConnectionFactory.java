package io.sqltx;

import io.sqltx.spi.ConnectionProvider;
import io.sqltx.spi.MetricsExporter;
import io.sqltx.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Creates {@link ConnectionHandle}s for one database and carries the settings they share.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ConnectionFactory factory = ConnectionFactory.builder()
 *     .connectionProvider(dataSource::getConnection)
 *     .metrics(new MicrometerMetricsExporter(registry))
 *     .build();
 *
 * try (TransactionScope scope = Transactions.beginAmbient(IsolationLevel.READ_COMMITTED, false);
 *      ConnectionHandle conn = factory.open()) {   // auto-enlisted in the scope
 *     ...
 *     scope.complete();
 * }
 * }</pre>
 *
 * <p>Handles opened from the same factory inside one ambient transaction share a parked
 * physical connection when they are not open at the same time, so they never escalate.
 */
public final class ConnectionFactory {
    private final ConnectionProvider connectionProvider;
    private final boolean enlist;
    private final AmbientScopeManager scopeManager;
    private final MetricsExporter metrics;
    private final Executor asyncExecutor;

    private ConnectionFactory(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.enlist = builder.enlist;
        this.scopeManager = builder.scopeManager == null ? AmbientScopeManager.global() : builder.scopeManager;
        this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
        this.asyncExecutor = builder.asyncExecutor == null ? DefaultAsyncExecutor.INSTANCE : builder.asyncExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a new, not yet opened handle.
     */
    public ConnectionHandle newConnection() {
        return new ConnectionHandle(this);
    }

    /**
     * Returns a new opened handle, auto-enlisted in the current ambient transaction when
     * {@link #isEnlist()} is on.
     */
    public ConnectionHandle open() {
        return newConnection().open();
    }

    public ConnectionProvider connectionProvider() {
        return connectionProvider;
    }

    /**
     * Whether handles from this factory auto-enlist in the ambient transaction on open.
     */
    public boolean isEnlist() {
        return enlist;
    }

    public AmbientScopeManager scopeManager() {
        return scopeManager;
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    public Executor asyncExecutor() {
        return asyncExecutor;
    }

    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private boolean enlist = true;
        private AmbientScopeManager scopeManager;
        private MetricsExporter metrics;
        private Executor asyncExecutor;

        private Builder() {}

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder enlist(boolean enlist) {
            this.enlist = enlist;
            return this;
        }

        /**
         * Scope manager consulted for ambient enlistment; defaults to {@link AmbientScopeManager#global()}.
         */
        public Builder scopeManager(AmbientScopeManager scopeManager) {
            this.scopeManager = scopeManager;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Executor for {@link io.sqltx.command.SqlCommand#executeAsync}; defaults to a shared
         * cached pool of daemon threads.
         */
        public Builder asyncExecutor(Executor asyncExecutor) {
            this.asyncExecutor = asyncExecutor;
            return this;
        }

        public ConnectionFactory build() {
            return new ConnectionFactory(this);
        }
    }

    private static final class DefaultAsyncExecutor {
        static final ExecutorService INSTANCE =
                Executors.newCachedThreadPool(new DaemonThreadFactory("sqltx-async-"));
    }
}
