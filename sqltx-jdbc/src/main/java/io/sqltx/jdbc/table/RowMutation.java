package io.sqltx.jdbc.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A pending change to one row. Value maps may hold {@code null}s, which are written as SQL NULL.
 */
public sealed interface RowMutation permits RowMutation.Insert, RowMutation.Update, RowMutation.Delete {

    /**
     * Inserts a row with the given column values; omitted columns take their defaults.
     */
    record Insert(Map<String, Object> values) implements RowMutation {
        public Insert {
            values = copy(values, "values");
        }
    }

    /**
     * Sets {@code values} on the row identified by {@code key}.
     */
    record Update(Map<String, Object> key, Map<String, Object> values) implements RowMutation {
        public Update {
            key = copy(key, "key");
            values = copy(values, "values");
        }
    }

    /**
     * Deletes the row identified by {@code key}.
     */
    record Delete(Map<String, Object> key) implements RowMutation {
        public Delete {
            key = copy(key, "key");
        }
    }

    private static Map<String, Object> copy(Map<String, Object> map, String name) {
        Objects.requireNonNull(map, name);
        if (map.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
