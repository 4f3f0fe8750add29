package io.sqltx.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB and MariaDB.
 */
public final class MySqlDialect extends AbstractDialect {

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
    }

    @Override
    protected char quoteChar() {
        return '`';
    }

    @Override
    public int maxBindParameters() {
        return 65_535;
    }
}
