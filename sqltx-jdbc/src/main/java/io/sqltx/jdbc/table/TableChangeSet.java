package io.sqltx.jdbc.table;

import io.sqltx.ConnectionFactory;
import io.sqltx.ConnectionHandle;
import io.sqltx.TransactionContext;
import io.sqltx.jdbc.spi.Dialect;

import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered pending row mutations for one table, applied all-or-nothing.
 *
 * <p>{@code apply} sends every pending mutation in order, grouping consecutive mutations
 * with the same SQL into one JDBC batch. {@code bulkLoad} sends only the pending inserts as
 * multi-row INSERT statements and leaves updates and deletes pending.
 *
 * <p>Both run inside a savepoint when the connection is in a transaction (explicit or
 * ambient), and in a local transaction otherwise. On failure the work is rolled back, every
 * mutation stays pending and {@link BatchApplyException} is thrown. On success the applied
 * mutations are removed and the summed row count is returned.
 *
 * <pre>{@code
 * TableChangeSet changes = new TableChangeSet(accounts, Dialects.get("h2"))
 *     .insert(Map.of("id", 1L, "owner", "ann", "balance", BigDecimal.TEN))
 *     .update(Map.of("id", 2L), Map.of("balance", BigDecimal.ZERO));
 * changes.apply(connection, tx);
 * }</pre>
 */
public final class TableChangeSet {
    private static final Logger logger = Logger.getLogger(TableChangeSet.class.getName());

    private final TableDefinition table;
    private final Dialect dialect;
    private final List<RowMutation> pending = new ArrayList<>();

    public TableChangeSet(TableDefinition table, Dialect dialect) {
        this.table = Objects.requireNonNull(table, "table");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public TableDefinition table() {
        return table;
    }

    public TableChangeSet insert(Map<String, Object> values) {
        return add(new RowMutation.Insert(values));
    }

    public TableChangeSet update(Map<String, Object> key, Map<String, Object> values) {
        return add(new RowMutation.Update(key, values));
    }

    public TableChangeSet delete(Map<String, Object> key) {
        return add(new RowMutation.Delete(key));
    }

    /**
     * Queues a mutation.
     *
     * @throws IllegalArgumentException if it names unknown columns, a key does not match the
     *                                  table's key columns, or an update sets a key column
     */
    public synchronized TableChangeSet add(RowMutation mutation) {
        Objects.requireNonNull(mutation, "mutation");
        validate(mutation);
        pending.add(mutation);
        return this;
    }

    public synchronized List<RowMutation> pending() {
        return List.copyOf(pending);
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public synchronized void clear() {
        pending.clear();
    }

    public int apply(ConnectionHandle connection) {
        return apply(connection, null);
    }

    /**
     * Applies all pending mutations on {@code connection} under {@code context}.
     *
     * @return total rows affected
     * @throws BatchApplyException if the database rejected a mutation
     */
    public synchronized int apply(ConnectionHandle connection, TransactionContext context) {
        Objects.requireNonNull(connection, "connection");
        List<RowMutation> batch = List.copyOf(pending);
        if (batch.isEmpty()) {
            return 0;
        }
        int count = connection.execute(context, c -> inSavepoint(c, () -> applyAll(c, batch)));
        pending.subList(0, batch.size()).clear();
        logger.log(Level.FINE, "Applied {0} mutations to {1} ({2} rows)",
                new Object[]{batch.size(), table.name(), count});
        return count;
    }

    /**
     * Applies all pending mutations on a connection opened from {@code factory}, enlisted in
     * the current ambient transaction if there is one.
     */
    public int apply(ConnectionFactory factory) {
        Objects.requireNonNull(factory, "factory");
        try (ConnectionHandle connection = factory.open()) {
            return apply(connection, null);
        }
    }

    public int bulkLoad(ConnectionHandle connection) {
        return bulkLoad(connection, null);
    }

    /**
     * Loads pending inserts with multi-row INSERT statements. Updates and deletes stay pending.
     *
     * @return rows inserted
     * @throws BatchApplyException if the database rejected a chunk; {@code failedIndex} is the
     *                             position of the chunk's first insert
     */
    public synchronized int bulkLoad(ConnectionHandle connection, TransactionContext context) {
        Objects.requireNonNull(connection, "connection");
        List<RowMutation> batch = List.copyOf(pending);
        if (batch.stream().noneMatch(RowMutation.Insert.class::isInstance)) {
            return 0;
        }
        int count = connection.execute(context, c -> inSavepoint(c, () -> loadInserts(c, batch)));
        pending.removeIf(RowMutation.Insert.class::isInstance);
        logger.log(Level.FINE, "Bulk loaded {0} rows into {1}", new Object[]{count, table.name()});
        return count;
    }

    public int bulkLoad(ConnectionFactory factory) {
        Objects.requireNonNull(factory, "factory");
        try (ConnectionHandle connection = factory.open()) {
            return bulkLoad(connection, null);
        }
    }

    @Override
    public synchronized String toString() {
        return "TableChangeSet[" + table.name() + ", pending=" + pending.size() + "]";
    }

    @FunctionalInterface
    private interface Work {
        int run() throws SQLException;
    }

    private int inSavepoint(Connection c, Work work) throws SQLException {
        boolean local = c.getAutoCommit();
        Savepoint savepoint = null;
        if (local) {
            c.setAutoCommit(false);
        } else {
            savepoint = c.setSavepoint();
        }
        RuntimeException failure = null;
        try {
            int count = work.run();
            if (local) {
                c.commit();
            } else {
                c.releaseSavepoint(savepoint);
            }
            return count;
        } catch (SQLException e) {
            rollback(c, savepoint, e);
            failure = new BatchApplyException("Batch on table " + table.name() + " failed", -1, e);
            throw failure;
        } catch (RuntimeException e) {
            rollback(c, savepoint, e);
            failure = e;
            throw e;
        } finally {
            if (local) {
                restoreAutoCommit(c, failure);
            }
        }
    }

    private void restoreAutoCommit(Connection c, RuntimeException failure) {
        try {
            c.setAutoCommit(true);
        } catch (SQLException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                logger.log(Level.WARNING, "Could not restore auto-commit after applying changes to "
                        + table.name(), e);
            }
        }
    }

    private void rollback(Connection c, Savepoint savepoint, Exception failure) {
        try {
            if (savepoint == null) {
                c.rollback();
            } else {
                c.rollback(savepoint);
            }
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private int applyAll(Connection c, List<RowMutation> batch) {
        int total = 0;
        int start = 0;
        while (start < batch.size()) {
            String sql = sqlFor(batch.get(start));
            int end = start + 1;
            while (end < batch.size() && sql.equals(sqlFor(batch.get(end)))) {
                end++;
            }
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (int i = start; i < end; i++) {
                    bind(ps, batch.get(i));
                    ps.addBatch();
                }
                total += appliedRows(ps.executeBatch());
            } catch (BatchUpdateException e) {
                throw failure(start + failedOffset(e), e);
            } catch (SQLException e) {
                throw failure(start, e);
            }
            start = end;
        }
        return total;
    }

    private int loadInserts(Connection c, List<RowMutation> batch) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            if (batch.get(i) instanceof RowMutation.Insert) {
                positions.add(i);
            }
        }
        int total = 0;
        int start = 0;
        while (start < positions.size()) {
            List<String> columns = insertColumns((RowMutation.Insert) batch.get(positions.get(start)));
            int chunk = Math.max(1, Math.min(dialect.maxRowsPerInsert(),
                    dialect.maxBindParameters() / columns.size()));
            int end = start + 1;
            while (end < positions.size() && end - start < chunk
                    && columns.equals(insertColumns((RowMutation.Insert) batch.get(positions.get(end))))) {
                end++;
            }
            String sql = dialect.multiRowInsertSql(table, columns, end - start);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int index = 1;
                for (int i = start; i < end; i++) {
                    RowMutation.Insert insert = (RowMutation.Insert) batch.get(positions.get(i));
                    for (String column : columns) {
                        setValue(ps, index++, column, insert.values().get(column));
                    }
                }
                total += ps.executeUpdate();
            } catch (SQLException e) {
                throw failure(positions.get(start), e);
            }
            start = end;
        }
        return total;
    }

    private BatchApplyException failure(int index, SQLException cause) {
        return new BatchApplyException("Mutation " + index + " on table " + table.name()
                + " failed: " + cause.getMessage(), index, cause);
    }

    /**
     * Sums batch update counts; {@link Statement#SUCCESS_NO_INFO} counts as one row.
     */
    private static int appliedRows(int[] counts) {
        int total = 0;
        for (int count : counts) {
            if (count == Statement.SUCCESS_NO_INFO) {
                total++;
            } else {
                total += Math.max(count, 0);
            }
        }
        return total;
    }

    private static int failedOffset(BatchUpdateException e) {
        int[] counts = e.getUpdateCounts();
        if (counts == null) {
            return 0;
        }
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == Statement.EXECUTE_FAILED) {
                return i;
            }
        }
        return counts.length;
    }

    private String sqlFor(RowMutation mutation) {
        if (mutation instanceof RowMutation.Insert insert) {
            return dialect.insertSql(table, insertColumns(insert));
        } else if (mutation instanceof RowMutation.Update update) {
            return dialect.updateSql(table, ordered(update.values()));
        } else {
            return dialect.deleteSql(table);
        }
    }

    private void bind(PreparedStatement ps, RowMutation mutation) throws SQLException {
        int index = 1;
        if (mutation instanceof RowMutation.Insert insert) {
            for (String column : insertColumns(insert)) {
                setValue(ps, index++, column, insert.values().get(column));
            }
        } else if (mutation instanceof RowMutation.Update update) {
            for (String column : ordered(update.values())) {
                setValue(ps, index++, column, update.values().get(column));
            }
            bindKey(ps, index, update.key());
        } else if (mutation instanceof RowMutation.Delete delete) {
            bindKey(ps, index, delete.key());
        }
    }

    private void bindKey(PreparedStatement ps, int index, Map<String, Object> key) throws SQLException {
        for (String column : table.keyColumns()) {
            setValue(ps, index++, column, key.get(column));
        }
    }

    private void setValue(PreparedStatement ps, int index, String column, Object value) throws SQLException {
        int sqlType = table.column(column).type().getVendorTypeNumber();
        if (value == null) {
            ps.setNull(index, sqlType);
        } else {
            ps.setObject(index, value, sqlType);
        }
    }

    private List<String> insertColumns(RowMutation.Insert insert) {
        return ordered(insert.values());
    }

    /**
     * Keys of {@code values} in table column order.
     */
    private List<String> ordered(Map<String, Object> values) {
        List<String> columns = new ArrayList<>(values.size());
        for (String column : table.columnNames()) {
            if (values.containsKey(column)) {
                columns.add(column);
            }
        }
        return columns;
    }

    private void validate(RowMutation mutation) {
        if (mutation instanceof RowMutation.Insert insert) {
            requireColumns(insert.values());
        } else if (mutation instanceof RowMutation.Update update) {
            requireKey(update.key());
            requireColumns(update.values());
            for (String column : update.values().keySet()) {
                if (table.keyColumns().contains(column)) {
                    throw new IllegalArgumentException("Update cannot set key column '" + column + "'");
                }
            }
        } else if (mutation instanceof RowMutation.Delete delete) {
            requireKey(delete.key());
        }
    }

    private void requireColumns(Map<String, Object> values) {
        for (String column : values.keySet()) {
            table.column(column);
        }
    }

    private void requireKey(Map<String, Object> key) {
        if (table.keyColumns().isEmpty()) {
            throw new IllegalArgumentException("Table " + table.name() + " has no key columns");
        }
        if (!key.keySet().equals(Set.copyOf(table.keyColumns()))) {
            throw new IllegalArgumentException("Key " + key.keySet() + " does not match key columns "
                    + table.keyColumns() + " of table " + table.name());
        }
    }
}
