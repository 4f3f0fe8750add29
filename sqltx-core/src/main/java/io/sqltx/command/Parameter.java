package io.sqltx.command;

import java.sql.JDBCType;
import java.util.Objects;

/**
 * A named, typed statement parameter.
 *
 * @param name the placeholder name, without the leading colon
 * @param type the SQL type values are sent as
 */
public record Parameter(String name, JDBCType type) {
    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }
}
