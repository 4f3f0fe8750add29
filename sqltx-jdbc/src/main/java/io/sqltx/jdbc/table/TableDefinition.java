package io.sqltx.jdbc.table;

import java.sql.JDBCType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Name, typed columns and key columns of a table that mutations are applied to.
 *
 * <pre>{@code
 * TableDefinition accounts = TableDefinition.builder("accounts")
 *     .keyColumn("id", JDBCType.BIGINT)
 *     .column("owner", JDBCType.VARCHAR)
 *     .column("balance", JDBCType.DECIMAL)
 *     .build();
 * }</pre>
 */
public final class TableDefinition {
    private final String name;
    private final Map<String, Column> columns;
    private final List<String> keyColumns;

    private TableDefinition(String name, Map<String, Column> columns, List<String> keyColumns) {
        this.name = name;
        this.columns = columns;
        this.keyColumns = keyColumns;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<Column> columns() {
        return List.copyOf(columns.values());
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    /**
     * Columns identifying a row for updates and deletes; empty if the table has no key.
     */
    public List<String> keyColumns() {
        return keyColumns;
    }

    public boolean hasColumn(String column) {
        return columns.containsKey(column);
    }

    /**
     * @throws IllegalArgumentException if the table has no such column
     */
    public Column column(String column) {
        Column c = columns.get(column);
        if (c == null) {
            throw new IllegalArgumentException("Table " + name + " has no column '" + column + "'");
        }
        return c;
    }

    @Override
    public String toString() {
        return "TableDefinition[" + name + ", columns=" + columns.keySet() + ", key=" + keyColumns + "]";
    }

    /**
     * A column and the SQL type its values are bound as.
     */
    public record Column(String name, JDBCType type) {
        public Column {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Column name cannot be blank");
            }
        }
    }

    public static final class Builder {
        private final String name;
        private final Map<String, Column> columns = new LinkedHashMap<>();
        private final List<String> keyColumns = new ArrayList<>();

        private Builder(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Table name cannot be blank");
            }
            this.name = name;
        }

        public Builder column(String column, JDBCType type) {
            Column c = new Column(column, type);
            if (columns.putIfAbsent(column, c) != null) {
                throw new IllegalArgumentException("Duplicate column: " + column);
            }
            return this;
        }

        public Builder keyColumn(String column, JDBCType type) {
            column(column, type);
            keyColumns.add(column);
            return this;
        }

        public TableDefinition build() {
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("Table " + name + " needs at least one column");
            }
            return new TableDefinition(name, new LinkedHashMap<>(columns), List.copyOf(keyColumns));
        }
    }
}
