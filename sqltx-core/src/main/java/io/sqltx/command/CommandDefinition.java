package io.sqltx.command;

import java.sql.Connection;
import java.sql.JDBCType;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of a SQL command: text with {@code :name} placeholders, the declared
 * parameters with their SQL types, the result shape and an optional timeout.
 *
 * <pre>{@code
 * CommandDefinition<SingleRow<String>> findName = CommandDefinition
 *     .builder("SELECT name FROM users WHERE id = :id")
 *     .param("id", JDBCType.BIGINT)
 *     .singleRow(rs -> rs.getString("name"));
 * }</pre>
 *
 * @param <R> the result type
 */
public final class CommandDefinition<R> {
    private final NamedStatement statement;
    private final Map<String, Parameter> parameters;
    private final ResultShape<R> shape;
    private final Duration timeout;

    private CommandDefinition(NamedStatement statement, Map<String, Parameter> parameters,
                              ResultShape<R> shape, Duration timeout) {
        this.statement = statement;
        this.parameters = parameters;
        this.shape = shape;
        this.timeout = timeout;
    }

    public static Builder builder(String sql) {
        return new Builder(sql);
    }

    public String sql() {
        return statement.sql();
    }

    public List<Parameter> parameters() {
        return List.copyOf(parameters.values());
    }

    public ResultShape<R> shape() {
        return shape;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * Checks that {@code params} supplies exactly the declared parameters.
     *
     * @throws IllegalArgumentException on a missing or undeclared parameter
     */
    void validate(Params params) {
        for (String name : params.names()) {
            if (!parameters.containsKey(name)) {
                throw new IllegalArgumentException("Unknown parameter '" + name + "' for: " + statement.sql());
            }
        }
        for (String name : parameters.keySet()) {
            if (!params.contains(name)) {
                throw new IllegalArgumentException("Missing value for parameter '" + name + "'");
            }
        }
    }

    /**
     * Prepares the statement on {@code connection} and binds {@code params}. Null values are
     * bound as SQL NULL of the declared type.
     */
    PreparedStatement prepare(Connection connection, Params params) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(statement.jdbcSql());
        try {
            if (timeout != null) {
                ps.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
            }
            List<String> names = statement.parameterNames();
            for (int i = 0; i < names.size(); i++) {
                Parameter parameter = parameters.get(names.get(i));
                int sqlType = parameter.type().getVendorTypeNumber();
                Object value = params.get(parameter.name());
                if (value == null) {
                    ps.setNull(i + 1, sqlType);
                } else {
                    ps.setObject(i + 1, value, sqlType);
                }
            }
            return ps;
        } catch (SQLException | RuntimeException e) {
            try {
                ps.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    @Override
    public String toString() {
        return "CommandDefinition[" + statement.sql() + "]";
    }

    public static final class Builder {
        private final NamedStatement statement;
        private final Map<String, Parameter> parameters = new LinkedHashMap<>();
        private Duration timeout;

        private Builder(String sql) {
            Objects.requireNonNull(sql, "sql");
            if (sql.isBlank()) {
                throw new IllegalArgumentException("sql must not be blank");
            }
            this.statement = NamedStatement.parse(sql);
        }

        public Builder param(String name, JDBCType type) {
            Parameter parameter = new Parameter(name, type);
            if (parameters.putIfAbsent(name, parameter) != null) {
                throw new IllegalArgumentException("Duplicate parameter: " + name);
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Finishes a command that returns the affected-row count.
         */
        public CommandDefinition<Integer> nonQuery() {
            return build(ResultShape.affectedRows());
        }

        /**
         * Finishes a command that returns at most one row.
         */
        public <T> CommandDefinition<SingleRow<T>> singleRow(RowMapper<T> mapper) {
            return build(ResultShape.singleRow(mapper));
        }

        /**
         * Finishes a command that returns a lazy sequence of rows.
         */
        public <T> CommandDefinition<RowSequence<T>> rows(RowMapper<T> mapper) {
            return build(ResultShape.rows(mapper));
        }

        /**
         * @throws IllegalArgumentException if the placeholders in the SQL and the declared
         *                                  parameters differ
         */
        public <R> CommandDefinition<R> build(ResultShape<R> shape) {
            Objects.requireNonNull(shape, "shape");
            Set<String> placeholders = new LinkedHashSet<>(statement.parameterNames());
            List<String> undeclared = new ArrayList<>(placeholders);
            undeclared.removeAll(parameters.keySet());
            if (!undeclared.isEmpty()) {
                throw new IllegalArgumentException("Placeholders without declared parameter: " + undeclared);
            }
            List<String> unused = new ArrayList<>(parameters.keySet());
            unused.removeAll(placeholders);
            if (!unused.isEmpty()) {
                throw new IllegalArgumentException("Declared parameters not used in SQL: " + unused);
            }
            return new CommandDefinition<>(statement, Collections.unmodifiableMap(new LinkedHashMap<>(parameters)),
                    shape, timeout);
        }
    }
}
