package io.sqltx.jdbc.dialect;

import io.sqltx.jdbc.spi.Dialect;
import io.sqltx.jdbc.table.TableDefinition;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.JDBCType;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialectsTest {
    private static final TableDefinition ACCOUNTS = TableDefinition.builder("accounts")
            .keyColumn("id", JDBCType.INTEGER)
            .column("owner", JDBCType.VARCHAR)
            .column("balance", JDBCType.INTEGER)
            .build();

    @Test
    void allReturnsBuiltInDialects() {
        List<Dialect> dialects = Dialects.all();

        assertTrue(dialects.size() >= 3);
        assertTrue(dialects.stream().anyMatch(d -> d.name().equals("mysql")));
        assertTrue(dialects.stream().anyMatch(d -> d.name().equals("postgresql")));
        assertTrue(dialects.stream().anyMatch(d -> d.name().equals("h2")));
    }

    @Test
    void getByNameIsCaseInsensitive() {
        assertEquals("mysql", Dialects.get("MySQL").name());
        assertEquals("postgresql", Dialects.get("POSTGRESQL").name());
        assertEquals("h2", Dialects.get("H2").name());
    }

    @Test
    void getByNameThrowsForUnknown() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Dialects.get("oracle"));
        assertTrue(ex.getMessage().contains("Unknown dialect"));
        assertTrue(ex.getMessage().contains("oracle"));
    }

    @Test
    void detectFromJdbcUrl() {
        assertEquals("mysql", Dialects.detect("jdbc:mysql://localhost:3306/mydb").name());
        assertEquals("mysql", Dialects.detect("jdbc:tidb://localhost:4000/mydb").name());
        assertEquals("mysql", Dialects.detect("jdbc:mariadb://localhost:3306/mydb").name());
        assertEquals("postgresql", Dialects.detect("jdbc:postgresql://localhost:5432/mydb").name());
        assertEquals("h2", Dialects.detect("jdbc:h2:mem:test").name());
    }

    @Test
    void detectFromJdbcUrlThrowsForUnknown() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Dialects.detect("jdbc:oracle:thin:@localhost:1521:xe"));
        assertTrue(ex.getMessage().contains("No dialect found"));
    }

    @Test
    void detectFromJdbcUrlThrowsForNullOrEmpty() {
        assertThrows(IllegalArgumentException.class, () -> Dialects.detect((String) null));
        assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
    }

    @Test
    void detectFromDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:dialect_test;DB_CLOSE_DELAY=-1");

        assertEquals("h2", Dialects.detect(ds).name());
    }

    @Test
    void plainIdentifiersStayUnquoted() {
        Dialect h2 = Dialects.get("h2");

        assertEquals("accounts", h2.quote("accounts"));
        assertEquals("\"order items\"", h2.quote("order items"));
        assertEquals("\"say\"\"hi\"", h2.quote("say\"hi"));
        assertEquals("`order items`", Dialects.get("mysql").quote("order items"));
    }

    @Test
    void generatesTableSql() {
        Dialect dialect = Dialects.get("h2");

        assertEquals("INSERT INTO accounts (id, owner) VALUES (?,?)",
                dialect.insertSql(ACCOUNTS, List.of("id", "owner")));
        assertEquals("INSERT INTO accounts (id, owner) VALUES (?,?),(?,?),(?,?)",
                dialect.multiRowInsertSql(ACCOUNTS, List.of("id", "owner"), 3));
        assertEquals("UPDATE accounts SET owner=?, balance=? WHERE id=?",
                dialect.updateSql(ACCOUNTS, List.of("owner", "balance")));
        assertEquals("DELETE FROM accounts WHERE id=?", dialect.deleteSql(ACCOUNTS));
    }

    @Test
    void multiRowInsertRejectsZeroRows() {
        Dialect dialect = Dialects.get("postgresql");

        assertThrows(IllegalArgumentException.class,
                () -> dialect.multiRowInsertSql(ACCOUNTS, List.of("id"), 0));
    }

    @Test
    void mySqlAllowsMoreBindParameters() {
        assertEquals(65_535, Dialects.get("mysql").maxBindParameters());
        assertEquals(32_767, Dialects.get("postgresql").maxBindParameters());
    }
}
