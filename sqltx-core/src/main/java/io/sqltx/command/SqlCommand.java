package io.sqltx.command;

import io.sqltx.ConnectionFactory;
import io.sqltx.ConnectionHandle;
import io.sqltx.TransactionContext;
import io.sqltx.TransactionContextLostException;
import io.sqltx.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link CommandDefinition} bound to a connection and, optionally, an explicit context.
 *
 * <p>Commands created from a {@link ConnectionHandle} run on that handle. With a context they
 * run inside it; without one they run in the ambient transaction the handle is enlisted in,
 * or in auto-commit mode. The binding is checked when the command is created, so a mismatch
 * fails before any SQL is sent.
 *
 * <p>Commands created from a {@link ConnectionFactory} open a handle per execution, which is
 * auto-enlisted like any other. For row sequences the handle stays open until the sequence
 * is closed.
 *
 * @param <R> the result type
 */
public final class SqlCommand<R> {
    private static final Logger logger = Logger.getLogger(SqlCommand.class.getName());
    private static final Runnable NO_RELEASE = () -> {};

    private final CommandDefinition<R> definition;
    private final ConnectionHandle connection;
    private final ConnectionFactory factory;
    private final TransactionContext context;
    private final Executor executor;

    private SqlCommand(CommandDefinition<R> definition, ConnectionHandle connection,
                       ConnectionFactory factory, TransactionContext context, Executor executor) {
        this.definition = definition;
        this.connection = connection;
        this.factory = factory;
        this.context = context;
        this.executor = executor;
    }

    public static <R> SqlCommand<R> create(CommandDefinition<R> definition, ConnectionHandle connection) {
        return create(definition, connection, null);
    }

    /**
     * @throws io.sqltx.ConnectionMismatchException if {@code context} is bound to another connection
     * @throws io.sqltx.ConnectionInUseException    if an explicit transaction owns
     *                                              {@code connection} but an ambient context was given
     */
    public static <R> SqlCommand<R> create(CommandDefinition<R> definition, ConnectionHandle connection,
                                           TransactionContext context) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(connection, "connection");
        connection.validateBinding(context);
        ConnectionFactory factory = connection.factory();
        return new SqlCommand<>(definition, connection, factory, context, factory.asyncExecutor());
    }

    public static <R> SqlCommand<R> create(CommandDefinition<R> definition, ConnectionFactory factory) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(factory, "factory");
        return new SqlCommand<>(definition, null, factory, null, factory.asyncExecutor());
    }

    /**
     * Returns a copy that runs {@link #executeAsync} on {@code executor}.
     */
    public SqlCommand<R> withExecutor(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return new SqlCommand<>(definition, connection, factory, context, executor);
    }

    public CommandDefinition<R> definition() {
        return definition;
    }

    public R execute() {
        return execute(Params.empty());
    }

    /**
     * Binds {@code params} and runs the command on the calling thread.
     *
     * @throws IllegalArgumentException                  on a missing or undeclared parameter
     * @throws io.sqltx.CardinalityViolationException    if a single-row command matched more rows
     * @throws io.sqltx.InvalidStateException            if the connection is closed or the context finished
     * @throws io.sqltx.SqlCommandException              if the database rejected the statement
     */
    public R execute(Params params) {
        Objects.requireNonNull(params, "params");
        definition.validate(params);
        MetricsExporter metrics = factory.metrics();
        long start = System.nanoTime();
        try {
            R result = connection != null
                    ? connection.execute(context, c -> run(c, params, NO_RELEASE))
                    : executeOnOwnConnection(params);
            metrics.incrementCommandExecuted();
            return result;
        } catch (RuntimeException e) {
            metrics.incrementCommandFailed();
            logger.log(Level.FINE, "Command failed: " + definition.sql(), e);
            throw e;
        } finally {
            metrics.recordCommandDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
    }

    public CompletableFuture<R> executeAsync() {
        return executeAsync(Params.empty());
    }

    /**
     * Runs the command on this command's executor. The ambient stack of the caller flows to
     * the worker only if the innermost scope enabled async flow. A command that relies on the
     * ambient transaction but does not find it on the worker completes exceptionally with
     * {@link TransactionContextLostException}; it never runs outside the transaction.
     */
    public CompletableFuture<R> executeAsync(Params params) {
        Objects.requireNonNull(params, "params");
        var scopes = factory.scopeManager();
        TransactionContext ambient = usesAmbient() ? scopes.current().orElse(null) : null;
        Supplier<R> task = scopes.capture().wrap(() -> {
            if (ambient != null && scopes.current().orElse(null) != ambient) {
                throw new TransactionContextLostException("Ambient transaction " + ambient.id()
                        + " did not flow to thread " + Thread.currentThread().getName()
                        + "; enable async flow on the scope or pass the context explicitly");
            }
            return execute(params);
        });
        return CompletableFuture.supplyAsync(task, executor);
    }

    @Override
    public String toString() {
        return "SqlCommand[" + definition.sql() + "]";
    }

    private boolean usesAmbient() {
        if (context != null) {
            return false;
        }
        return connection == null ? factory.isEnlist() : connection.isEnlisted();
    }

    private R executeOnOwnConnection(Params params) {
        ConnectionHandle owned = factory.open();
        boolean handedOff = false;
        try {
            R result = owned.execute(null, c -> run(c, params, owned::close));
            handedOff = definition.shape().isLazy();
            return result;
        } finally {
            if (!handedOff) {
                owned.close();
            }
        }
    }

    private R run(Connection c, Params params, Runnable release) throws SQLException {
        PreparedStatement statement = definition.prepare(c, params);
        return definition.shape().read(statement, release);
    }
}
