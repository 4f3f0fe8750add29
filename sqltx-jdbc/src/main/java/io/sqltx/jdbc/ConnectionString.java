package io.sqltx.jdbc;

import java.util.Locale;
import java.util.Objects;

/**
 * A JDBC URL with the auto-enlistment option extracted.
 *
 * <p>{@code Enlist} is recognized case-insensitively in two places:
 * <ul>
 *   <li>as a {@code ;}-separated setting: {@code jdbc:h2:mem:db;Enlist=false}</li>
 *   <li>as a query parameter: {@code jdbc:postgresql://host/db?enlist=false&ssl=true}</li>
 * </ul>
 * The option is removed from {@link #jdbcUrl()}, so the driver never sees it. When absent,
 * enlistment is on.
 */
public final class ConnectionString {
    static final String ENLIST_KEY = "enlist";

    private final String jdbcUrl;
    private final boolean enlist;

    private ConnectionString(String jdbcUrl, boolean enlist) {
        this.jdbcUrl = jdbcUrl;
        this.enlist = enlist;
    }

    /**
     * @throws IllegalArgumentException if the URL is blank or {@code Enlist} is not
     *                                  {@code true} or {@code false}
     */
    public static ConnectionString parse(String connectionString) {
        Objects.requireNonNull(connectionString, "connectionString");
        if (connectionString.isBlank()) {
            throw new IllegalArgumentException("Connection string cannot be empty");
        }
        Boolean enlist = null;

        int query = connectionString.indexOf('?');
        String head = query < 0 ? connectionString : connectionString.substring(0, query);
        String tail = query < 0 ? null : connectionString.substring(query + 1);

        StringBuilder base = new StringBuilder();
        String[] settings = head.split(";", -1);
        base.append(settings[0]);
        for (int i = 1; i < settings.length; i++) {
            String setting = settings[i];
            Boolean value = enlistValue(setting);
            if (value != null) {
                enlist = value;
            } else if (!setting.isEmpty()) {
                base.append(';').append(setting);
            }
        }

        if (tail != null) {
            StringBuilder kept = new StringBuilder();
            for (String pair : tail.split("&", -1)) {
                Boolean value = enlistValue(pair);
                if (value != null) {
                    enlist = value;
                } else if (!pair.isEmpty()) {
                    if (kept.length() > 0) {
                        kept.append('&');
                    }
                    kept.append(pair);
                }
            }
            if (kept.length() > 0) {
                base.append('?').append(kept);
            }
        }
        return new ConnectionString(base.toString(), enlist == null || enlist);
    }

    /**
     * The URL to hand to the driver.
     */
    public String jdbcUrl() {
        return jdbcUrl;
    }

    public boolean isEnlist() {
        return enlist;
    }

    @Override
    public String toString() {
        return "ConnectionString[" + jdbcUrl + ", enlist=" + enlist + "]";
    }

    private static Boolean enlistValue(String setting) {
        int eq = setting.indexOf('=');
        if (eq < 0) {
            return null;
        }
        String key = setting.substring(0, eq).trim();
        if (!key.equalsIgnoreCase(ENLIST_KEY)) {
            return null;
        }
        String value = setting.substring(eq + 1).trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("Invalid Enlist value '" + setting.substring(eq + 1)
                        + "'; expected true or false");
        }
    }
}
