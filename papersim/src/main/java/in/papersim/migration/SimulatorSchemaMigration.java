package in.papersim.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Simulator Schema Migration - creates the tables the reconciler owns on startup.
 *
 * - klines: cached complete bars, one row per (symbol, timeframe, start_time)
 * - simulator_errors: persisted audit events
 *
 * trades, runs, recommendations, instances and settings belong to the surrounding application.
 */
public final class SimulatorSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SimulatorSchemaMigration.class);

    private final DataSource dataSource;

    public SimulatorSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[SIM MIGRATION] Starting simulator schema migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "klines")) {
                log.info("[SIM MIGRATION] Creating klines table...");
                createKlinesTable(conn);
                log.info("[SIM MIGRATION] ✓ klines table created");
            } else {
                log.info("[SIM MIGRATION] klines table already exists");
            }

            if (!tableExists(conn, "simulator_errors")) {
                log.info("[SIM MIGRATION] Creating simulator_errors table...");
                createSimulatorErrorsTable(conn);
                log.info("[SIM MIGRATION] ✓ simulator_errors table created");
            } else {
                log.info("[SIM MIGRATION] simulator_errors table already exists");
            }

            log.info("[SIM MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[SIM MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Simulator schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createKlinesTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE klines (
                id BIGSERIAL PRIMARY KEY,
                symbol VARCHAR(50) NOT NULL,
                timeframe VARCHAR(10) NOT NULL,
                category VARCHAR(20) NOT NULL DEFAULT 'linear',
                start_time BIGINT NOT NULL,
                open_price NUMERIC(30,10) NOT NULL,
                high_price NUMERIC(30,10) NOT NULL,
                low_price NUMERIC(30,10) NOT NULL,
                close_price NUMERIC(30,10) NOT NULL,
                volume NUMERIC(30,10) NOT NULL DEFAULT 0,
                turnover NUMERIC(30,10) NOT NULL DEFAULT 0,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),

                CONSTRAINT uq_klines_symbol_tf_start UNIQUE (symbol, timeframe, start_time)
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_klines_symbol_tf_start ON klines(symbol, timeframe, start_time DESC)");
        }
    }

    private void createSimulatorErrorsTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE simulator_errors (
                id UUID PRIMARY KEY,
                trade_id VARCHAR(64),
                error_type VARCHAR(64) NOT NULL,
                message TEXT NOT NULL,
                context JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_simulator_errors_trade ON simulator_errors(trade_id, created_at DESC)");
        }
    }
}
