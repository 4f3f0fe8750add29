package io.sqltx.jdbc.dialect;

import io.sqltx.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds the {@link Dialect} that renders {@link io.sqltx.jdbc.table.TableChangeSet} SQL for a
 * database.
 *
 * <p>Built-in dialects (H2, MySQL and PostgreSQL) and any others on the class path are
 * discovered through {@link ServiceLoader} from
 * {@code META-INF/services/io.sqltx.jdbc.spi.Dialect}. A dialect is chosen by name, or by
 * matching its JDBC URL prefixes against a URL or the URL a {@link DataSource} reports:
 *
 * <pre>{@code
 * TableChangeSet changes = new TableChangeSet(accounts, Dialects.detect(dataSource));
 * TableChangeSet staging = new TableChangeSet(accounts, Dialects.get("postgresql"));
 * }</pre>
 */
public final class Dialects {
    private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    private static final Map<String, Dialect> BY_NAME = DIALECTS.stream()
            .collect(Collectors.toUnmodifiableMap(d -> key(d.name()), d -> d, (first, later) -> first));

    private Dialects() {
    }

    public static List<Dialect> all() {
        return DIALECTS;
    }

    /**
     * @param name dialect name, case-insensitive
     * @throws IllegalArgumentException if no registered dialect has that name
     */
    public static Dialect get(String name) {
        Objects.requireNonNull(name, "name");
        Dialect dialect = BY_NAME.get(key(name));
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: "
                    + new TreeSet<>(BY_NAME.keySet()));
        }
        return dialect;
    }

    /**
     * Detects the dialect from the URL of a connection borrowed from {@code dataSource}.
     *
     * @throws IllegalStateException    if the connection metadata cannot be read
     * @throws IllegalArgumentException if no dialect matches the URL
     */
    public static Dialect detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read the JDBC URL of " + dataSource, e);
        }
        return detect(url);
    }

    /**
     * Detects the dialect whose JDBC URL prefix matches {@code jdbcUrl}. The {@code Enlist}
     * option of a sqltx connection string does not affect detection.
     *
     * @throws IllegalArgumentException if the URL is empty or no dialect matches it
     */
    public static Dialect detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        return DIALECTS.stream()
                .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
                        + ". Supported prefixes: " + DIALECTS.stream()
                        .flatMap(d -> d.jdbcUrlPrefixes().stream())
                        .toList()));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
