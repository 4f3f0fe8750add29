package io.sqltx.jdbc.spi;

import io.sqltx.jdbc.table.TableDefinition;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific SQL used to apply row mutations.
 * Register custom dialects via {@code META-INF/services/io.sqltx.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: H2, MySQL (+ TiDB, MariaDB), PostgreSQL.
 *
 * @see io.sqltx.jdbc.dialect.Dialects
 */
public interface Dialect {

    /**
     * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
     */
    String name();

    /**
     * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    List<String> jdbcUrlPrefixes();

    /**
     * Renders a table or column name for use in SQL.
     */
    String quote(String identifier);

    /**
     * SQL inserting one row. Parameters: {@code columns} in order.
     */
    String insertSql(TableDefinition table, List<String> columns);

    /**
     * SQL inserting {@code rows} rows in one statement. Parameters: {@code columns} in
     * order, repeated once per row.
     */
    String multiRowInsertSql(TableDefinition table, List<String> columns, int rows);

    /**
     * SQL updating one row by key. Parameters: {@code columns} in order, then the key
     * columns of {@code table} in order.
     */
    String updateSql(TableDefinition table, List<String> columns);

    /**
     * SQL deleting one row by key. Parameters: the key columns of {@code table} in order.
     */
    String deleteSql(TableDefinition table);

    /**
     * Upper bound on bind parameters per statement, used to size bulk-load chunks.
     */
    default int maxBindParameters() {
        return 32_767;
    }

    /**
     * Upper bound on rows per multi-row INSERT.
     */
    default int maxRowsPerInsert() {
        return 1_000;
    }
}
