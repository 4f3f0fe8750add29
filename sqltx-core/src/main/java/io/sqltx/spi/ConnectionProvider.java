package io.sqltx.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens physical JDBC connections on behalf of {@link io.sqltx.ConnectionHandle}.
 *
 * <p>Each call must return a new (or freshly pooled) connection. The caller owns the
 * returned connection and closes it when the handle or the enclosing ambient
 * transaction releases it.
 *
 * @see io.sqltx.ConnectionFactory
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a physical JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
