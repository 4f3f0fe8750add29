package io.sqltx.command;

import java.sql.ResultSetMetaData;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ready-made {@link RowMapper}s.
 */
public final class RowMappers {

    /**
     * Maps the first column, converted to {@code type} by the driver.
     */
    public static <T> RowMapper<T> singleColumn(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return rs -> rs.getObject(1, type);
    }

    /**
     * Maps a row to an unmodifiable map from column label (as reported by the driver) to
     * value, in select-list order.
     */
    public static RowMapper<Map<String, Object>> columnMap() {
        return rs -> {
            ResultSetMetaData meta = rs.getMetaData();
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            return Collections.unmodifiableMap(row);
        };
    }

    private RowMappers() {}
}
