package io.sqltx.jdbc;

import io.sqltx.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} that opens a new physical connection through
 * {@link DriverManager} on every call. No pooling.
 */
public final class DriverManagerConnectionProvider implements ConnectionProvider {
    private final String jdbcUrl;
    private final String user;
    private final String password;

    public DriverManagerConnectionProvider(String jdbcUrl) {
        this(jdbcUrl, null, null);
    }

    public DriverManagerConnectionProvider(String jdbcUrl, String user, String password) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.user = user;
        this.password = password;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    @Override
    public Connection getConnection() throws SQLException {
        if (user == null) {
            return DriverManager.getConnection(jdbcUrl);
        }
        return DriverManager.getConnection(jdbcUrl, user, password);
    }
}
