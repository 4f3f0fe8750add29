package io.sqltx.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SQL text with {@code :name} placeholders, rewritten to JDBC {@code ?} markers.
 *
 * <p>Placeholders inside string literals, quoted identifiers and comments are left alone,
 * and so are PostgreSQL {@code ::type} casts. A name may occur more than once.
 */
final class NamedStatement {
    private final String sql;
    private final String jdbcSql;
    private final List<String> parameterNames;

    private NamedStatement(String sql, String jdbcSql, List<String> parameterNames) {
        this.sql = sql;
        this.jdbcSql = jdbcSql;
        this.parameterNames = parameterNames;
    }

    static NamedStatement parse(String sql) {
        Objects.requireNonNull(sql, "sql");
        StringBuilder out = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();
        int length = sql.length();
        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipQuoted(sql, i, c);
                out.append(sql, i, end);
                i = end;
            } else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? length : end;
                out.append(sql, i, end);
                i = end;
            } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                out.append(sql, i, end);
                i = end;
            } else if (c == ':' && i + 1 < length && sql.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
            } else if (c == ':' && i + 1 < length && Character.isJavaIdentifierStart(sql.charAt(i + 1))) {
                int end = i + 1;
                while (end < length && Character.isJavaIdentifierPart(sql.charAt(end))) {
                    end++;
                }
                names.add(sql.substring(i + 1, end));
                out.append('?');
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return new NamedStatement(sql, out.toString(), List.copyOf(names));
    }

    String sql() {
        return sql;
    }

    String jdbcSql() {
        return jdbcSql;
    }

    /**
     * Placeholder names in order of appearance, repeated names included.
     */
    List<String> parameterNames() {
        return parameterNames;
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
