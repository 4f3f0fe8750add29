/**
 * Root API for sqltx, a typed SQL command layer over JDBC with explicit and ambient
 * transactions.
 *
 * <h2>Core Design</h2>
 * <p>A {@link io.sqltx.ConnectionHandle} owns one physical connection. Work is grouped into
 * a {@link io.sqltx.TransactionContext}, which is either an {@link io.sqltx.ExplicitTransaction}
 * bound to one handle, or an ambient {@link io.sqltx.TransactionScope} that handles discover
 * from the calling flow through the {@link io.sqltx.AmbientScopeManager}. Both are
 * {@link java.lang.AutoCloseable} guards: releasing a context that was not completed rolls
 * its work back.
 *
 * <p>Handles opened while an ambient scope is current enlist automatically. Handles opened
 * one after another share a physical connection; two enlisted handles open at the same time
 * on different physical connections escalate the transaction to distributed, which
 * {@link io.sqltx.TransactionContext#isDistributed()} reports and
 * {@link io.sqltx.EscalationPolicy#REJECT} refuses.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>sqltx-core</b>: transactions, scopes, {@linkplain io.sqltx.command commands}</li>
 *   <li><b>sqltx-jdbc</b>: connection providers, connection strings, dialects and table
 *       change sets</li>
 *   <li><b>sqltx-micrometer</b>: Micrometer metrics exporter</li>
 * </ul>
 *
 * <h2>Explicit transaction</h2>
 * <pre>{@code
 * try (ConnectionHandle conn = factory.open();
 *      ExplicitTransaction tx = Transactions.beginExplicit(conn, IsolationLevel.SERIALIZABLE)) {
 *     SqlCommand.create(insertOrder, conn, tx).execute(Params.of("id", 42, "item", "book"));
 *     tx.complete();
 * }
 * }</pre>
 *
 * <h2>Ambient scope</h2>
 * <pre>{@code
 * try (TransactionScope scope = Transactions.beginAmbient(IsolationLevel.READ_COMMITTED, true)) {
 *     SqlCommand.create(insertOrder, factory).execute(Params.of("id", 42, "item", "book"));
 *     SqlCommand.create(audit, factory).executeAsync(Params.of("msg", "order 42")).join();
 *     scope.requireLocal();
 *     scope.complete();
 * }
 * }</pre>
 *
 * @see io.sqltx.Transactions
 * @see io.sqltx.ConnectionFactory
 * @see io.sqltx.command.SqlCommand
 */
package io.sqltx;
