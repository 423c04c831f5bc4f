package com.tidewatch.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            LOG.info("Schema ready. schema={}, version {} -> {}", schema, currentVersion, TARGET_VERSION);
        }
    }

    List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS financial_risk (" +
                "code TEXT PRIMARY KEY," +
                "name TEXT NOT NULL DEFAULT ''," +
                "board TEXT NOT NULL," +
                "risk_type TEXT NOT NULL," +
                "risk_level TEXT NOT NULL," +
                "reason TEXT NOT NULL DEFAULT ''," +
                "latest_revenue DOUBLE PRECISION NULL," +
                "latest_net_profit DOUBLE PRECISION NULL," +
                "loss_years INTEGER NOT NULL DEFAULT 0," +
                "cumulative_loss DOUBLE PRECISION NOT NULL DEFAULT 0," +
                "is_extreme BOOLEAN NOT NULL DEFAULT FALSE," +
                "scan_date DATE NOT NULL," +
                "scan_cycle TEXT NOT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_financial_risk_cycle ON financial_risk(scan_cycle)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_financial_risk_type_code ON financial_risk(risk_type, code)");

        sqls.add("CREATE TABLE IF NOT EXISTS strategy_signal (" +
                "id BIGSERIAL PRIMARY KEY," +
                "strategy_name TEXT NOT NULL," +
                "stock_code TEXT NOT NULL," +
                "stock_name TEXT NOT NULL DEFAULT ''," +
                "signal_date DATE NOT NULL," +
                "score DOUBLE PRECISION NOT NULL DEFAULT 0," +
                "reason TEXT NOT NULL DEFAULT ''," +
                "extra_data TEXT NOT NULL DEFAULT '{}'," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_strategy_signal_name_date ON strategy_signal(strategy_name, signal_date)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && value.trim().matches("\\d+")) {
                    return Integer.parseInt(value.trim());
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }
}
