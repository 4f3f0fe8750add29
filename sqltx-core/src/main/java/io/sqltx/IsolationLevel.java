package io.sqltx;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transaction isolation levels, mapped onto the JDBC constants of {@link Connection}.
 */
public enum IsolationLevel {
    READ_UNCOMMITTED(Connection.TRANSACTION_READ_UNCOMMITTED),
    READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
    REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
    SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

    private final int jdbcLevel;

    IsolationLevel(int jdbcLevel) {
        this.jdbcLevel = jdbcLevel;
    }

    public int jdbcLevel() {
        return jdbcLevel;
    }

    /**
     * Switches {@code connection} to this level.
     *
     * @return the JDBC level in force before, for {@link #restore}
     */
    int applyTo(Connection connection) throws SQLException {
        int previous = connection.getTransactionIsolation();
        if (previous != jdbcLevel) {
            connection.setTransactionIsolation(jdbcLevel);
        }
        return previous;
    }

    static void restore(Connection connection, int previous) throws SQLException {
        if (previous != Connection.TRANSACTION_NONE && connection.getTransactionIsolation() != previous) {
            connection.setTransactionIsolation(previous);
        }
    }
}
