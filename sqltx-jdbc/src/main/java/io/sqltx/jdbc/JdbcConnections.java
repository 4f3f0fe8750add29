package io.sqltx.jdbc;

import io.sqltx.ConnectionFactory;

import javax.sql.DataSource;

/**
 * Convenience factories for {@link ConnectionFactory} over plain JDBC.
 *
 * <pre>{@code
 * ConnectionFactory db = JdbcConnections.fromConnectionString("jdbc:h2:mem:app;Enlist=false");
 * ConnectionFactory pooled = JdbcConnections.fromDataSource(hikariDataSource);
 * }</pre>
 *
 * <p>Use {@link ConnectionFactory#builder()} with a {@link DataSourceConnectionProvider} or
 * {@link DriverManagerConnectionProvider} to set metrics, scope manager or executor.
 */
public final class JdbcConnections {

    private JdbcConnections() {
    }

    public static ConnectionFactory fromConnectionString(String connectionString) {
        return fromConnectionString(connectionString, null, null);
    }

    /**
     * Builds a factory that opens connections through {@link java.sql.DriverManager}.
     * Auto-enlistment follows the {@code Enlist} option of the connection string.
     *
     * @throws IllegalArgumentException if the connection string is invalid
     */
    public static ConnectionFactory fromConnectionString(String connectionString, String user, String password) {
        ConnectionString parsed = ConnectionString.parse(connectionString);
        return ConnectionFactory.builder()
                .connectionProvider(new DriverManagerConnectionProvider(parsed.jdbcUrl(), user, password))
                .enlist(parsed.isEnlist())
                .build();
    }

    public static ConnectionFactory fromDataSource(DataSource dataSource) {
        return ConnectionFactory.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .build();
    }
}
