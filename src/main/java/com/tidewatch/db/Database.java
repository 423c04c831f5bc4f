package com.tidewatch.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Opens connections to the PostgreSQL schema that holds risk records and strategy signals.
 * Every connection has {@code search_path} set to the configured schema followed by {@code public}.
 */
public final class Database {
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private static final String DEFAULT_SCHEMA = "tidewatch";
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern QUERY_PASSWORD = Pattern.compile("(?i)(password=)[^&]+");
    private static final Pattern USERINFO_PASSWORD = Pattern.compile("(://[^:/@]+:)[^@]+(@)");

    private final PGSimpleDataSource dataSource = new PGSimpleDataSource();
    private final String jdbcUrl;
    private final String schema;

    public Database(String jdbcUrl, String user, String pass, String schema) {
        this.jdbcUrl = requirePostgresUrl(jdbcUrl);
        this.schema = normalizeSchema(schema);

        dataSource.setUrl(this.jdbcUrl);
        if (user != null && !user.isBlank()) {
            dataSource.setUser(user.trim());
        }
        if (pass != null) {
            dataSource.setPassword(pass);
        }
        dataSource.setCurrentSchema(this.schema);
        dataSource.setApplicationName("tidewatch");
    }

    /**
     * Opens a connection; the caller closes it. Failures are rethrown with the masked URL and a
     * coarse cause so operators can tell bad credentials from an unreachable server.
     */
    public Connection connect() throws SQLException {
        Connection conn;
        try {
            conn = dataSource.getConnection();
        } catch (SQLException e) {
            throw connectFailure(e);
        }
        try (Statement st = conn.createStatement()) {
            st.execute("SET search_path TO " + schema + ", public");
        } catch (SQLException e) {
            conn.close();
            throw connectFailure(e);
        }
        SQL_LOG.debug("Connection opened. url={}, schema={}", maskedJdbcUrl(), schema);
        return conn;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String masked = QUERY_PASSWORD.matcher(jdbcUrl).replaceAll("$1***");
        return USERINFO_PASSWORD.matcher(masked).replaceAll("$1***$2");
    }

    /** Blank means the default schema; anything else must be a plain SQL identifier. */
    static String normalizeSchema(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_SCHEMA;
        }
        String name = raw.trim();
        if (!SCHEMA_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("db.schema is not a plain identifier: " + name);
        }
        return name;
    }

    static String failureKind(SQLException e) {
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication failed") || msg.contains("permission denied")) {
            return "auth";
        }
        if (msg.contains("connection refused") || msg.contains("connection attempt failed")) {
            return "unreachable";
        }
        if (msg.contains("does not exist")) {
            return "missing_database";
        }
        return "connection_error";
    }

    private SQLException connectFailure(SQLException cause) {
        String details = String.format("DB connect failed (%s): url=%s, schema=%s, cause=%s",
                failureKind(cause), maskedJdbcUrl(), schema, cause.getMessage());
        SQL_LOG.error(details);
        return new SQLException(details, cause.getSQLState(), cause.getErrorCode(), cause);
    }

    private static String requirePostgresUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        String url = raw.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url is not a PostgreSQL JDBC URL: " + url.split("\\?")[0]);
        }
        return url;
    }
}
