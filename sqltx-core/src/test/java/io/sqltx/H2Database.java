package io.sqltx;

import io.sqltx.command.CommandDefinition;
import io.sqltx.command.Params;
import io.sqltx.spi.ConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.JDBCType;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory H2 database with an {@code accounts} table, plus a provider that counts the
 * physical connections it hands out and how many of them are still open.
 */
public final class H2Database implements ConnectionProvider {
    public static final CommandDefinition<Integer> INSERT_ACCOUNT = CommandDefinition
            .builder("INSERT INTO accounts (id, owner, balance) VALUES (:id, :owner, :balance)")
            .param("id", JDBCType.INTEGER)
            .param("owner", JDBCType.VARCHAR)
            .param("balance", JDBCType.INTEGER)
            .nonQuery();

    private final JdbcDataSource dataSource = new JdbcDataSource();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();

    public H2Database() {
        dataSource.setURL("jdbc:h2:mem:sqltx_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE accounts (id INT PRIMARY KEY, owner VARCHAR(100), balance INT)");
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Params account(int id, String owner, int balance) {
        return Params.of("id", id, "owner", owner, "balance", balance);
    }

    public JdbcDataSource dataSource() {
        return dataSource;
    }

    @Override
    public Connection getConnection() throws SQLException {
        Connection physical = dataSource.getConnection();
        opened.incrementAndGet();
        return new CountingConnection(physical, closed).proxy();
    }

    public int openedConnections() {
        return opened.get();
    }

    public int openConnections() {
        return opened.get() - closed.get();
    }

    public ConnectionFactory factory(AmbientScopeManager scopes) {
        return ConnectionFactory.builder()
                .connectionProvider(this)
                .scopeManager(scopes)
                .build();
    }

    /**
     * Counts committed rows, read on a separate connection.
     */
    public int countAccounts() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM accounts")) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    public String owner(int id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT owner FROM accounts WHERE id = ?")) {
            ps.setInt(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    public void insert(int id, String owner, int balance) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("INSERT INTO accounts (id, owner, balance) VALUES (?, ?, ?)")) {
            ps.setInt(1, id);
            ps.setString(2, owner);
            ps.setInt(3, balance);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }
}
