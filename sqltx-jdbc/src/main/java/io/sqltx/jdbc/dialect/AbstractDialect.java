package io.sqltx.jdbc.dialect;

import io.sqltx.jdbc.spi.Dialect;
import io.sqltx.jdbc.table.TableDefinition;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Plain identifiers are left unquoted so they fold the same way they did in the DDL;
 * anything else is quoted with {@link #quoteChar()}. Subclasses can override methods to
 * provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {
    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    protected char quoteChar() {
        return '"';
    }

    @Override
    public String quote(String identifier) {
        if (PLAIN_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        String q = String.valueOf(quoteChar());
        return q + identifier.replace(q, q + q) + q;
    }

    @Override
    public String insertSql(TableDefinition table, List<String> columns) {
        return multiRowInsertSql(table, columns, 1);
    }

    @Override
    public String multiRowInsertSql(TableDefinition table, List<String> columns, int rows) {
        if (rows < 1) {
            throw new IllegalArgumentException("rows must be >= 1");
        }
        String row = columns.stream().map(c -> "?").collect(Collectors.joining(",", "(", ")"));
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(tableName(table))
                .append(" (").append(columnList(columns)).append(") VALUES ");
        for (int i = 0; i < rows; i++) {
            if (i > 0) {
                sql.append(',');
            }
            sql.append(row);
        }
        return sql.toString();
    }

    @Override
    public String updateSql(TableDefinition table, List<String> columns) {
        return "UPDATE " + tableName(table) + " SET "
                + columns.stream().map(c -> quote(c) + "=?").collect(Collectors.joining(", "))
                + " WHERE " + keyPredicate(table);
    }

    @Override
    public String deleteSql(TableDefinition table) {
        return "DELETE FROM " + tableName(table) + " WHERE " + keyPredicate(table);
    }

    protected String tableName(TableDefinition table) {
        return quote(table.name());
    }

    protected String columnList(List<String> columns) {
        return columns.stream().map(this::quote).collect(Collectors.joining(", "));
    }

    protected String keyPredicate(TableDefinition table) {
        return table.keyColumns().stream().map(c -> quote(c) + "=?").collect(Collectors.joining(" AND "));
    }
}
