package in.papersim.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.papersim.domain.repository.TradeRepository;
import in.papersim.domain.trade.Trade;
import in.papersim.domain.trade.TradeSettlement;
import in.papersim.domain.trade.TradeSide;
import in.papersim.domain.trade.TradeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of TradeRepository.
 *
 * Status transitions are conditional updates ({@code WHERE status = expected}); settlement and reset
 * touch {@code trades} and {@code runs} in a single transaction.
 */
public final class PostgresTradeRepository implements TradeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SELECT_TRADE = """
        SELECT
            t.id, t.run_id, t.recommendation_id, t.symbol, t.side, t.strategy_type, t.strategy_name,
            COALESCE(t.timeframe, rec.timeframe) AS timeframe,
            COALESCE(t.entry_price, rec.entry_price) AS entry_price,
            t.quantity,
            COALESCE(t.stop_loss, rec.stop_loss) AS stop_loss,
            COALESCE(t.take_profit, rec.take_profit) AS take_profit,
            COALESCE(t.strategy_metadata::text, rec.strategy_metadata::text) AS strategy_metadata,
            t.status, t.fill_price, t.filled_at, t.exit_price, t.exit_reason, t.pnl, t.pnl_percent,
            t.closed_at, t.cancelled_at,
            t.pair_fill_price, t.pair_exit_price, t.pair_quantity,
            t.position_size_usd, t.risk_amount_usd,
            t.created_at, rec.analyzed_at,
            i.name AS instance_name,
            i.settings::text AS instance_settings
        FROM trades t
        LEFT JOIN recommendations rec ON t.recommendation_id = rec.id
        LEFT JOIN runs r ON t.run_id = r.id
        LEFT JOIN instances i ON r.instance_id = i.id
        """;

    private final DataSource dataSource;

    public PostgresTradeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Trade> findOpenTrades() {
        String sql = SELECT_TRADE + """
            WHERE t.pnl IS NULL
              AND t.status IN ('paper_trade', 'pending_fill', 'filled')
            ORDER BY t.created_at DESC
            """;

        List<Trade> trades = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                trades.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to find open trades: {}", e.getMessage());
            throw new RuntimeException("Failed to find open trades", e);
        }
        return trades;
    }

    @Override
    public Optional<Trade> findById(String tradeId) {
        String sql = SELECT_TRADE + "WHERE t.id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tradeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find trade {}: {}", tradeId, e.getMessage());
            throw new RuntimeException("Failed to find trade", e);
        }
        return Optional.empty();
    }

    @Override
    public boolean recordFill(String tradeId, BigDecimal fillPrice, BigDecimal pairFillPrice, Instant filledAt) {
        String sql = """
            UPDATE trades SET
                fill_price = ?,
                fill_time = ?,
                filled_at = ?,
                status = 'filled',
                pair_fill_price = COALESCE(?, pair_fill_price)
            WHERE id = ?
              AND status IN ('paper_trade', 'pending_fill')
              AND filled_at IS NULL
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(filledAt);
            ps.setBigDecimal(1, fillPrice);
            ps.setTimestamp(2, ts);
            ps.setTimestamp(3, ts);
            ps.setBigDecimal(4, pairFillPrice);
            ps.setString(5, tradeId);

            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            log.error("Failed to record fill for trade {}: {}", tradeId, e.getMessage());
            throw new RuntimeException("Failed to record fill", e);
        }
    }

    @Override
    public boolean cancelUnfilled(String tradeId, String reason, Instant cancelledAt) {
        String sql = """
            UPDATE trades SET
                exit_reason = ?,
                status = 'cancelled',
                cancelled_at = ?
            WHERE id = ?
              AND status IN ('paper_trade', 'pending_fill')
              AND pnl IS NULL
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, reason);
            ps.setTimestamp(2, Timestamp.from(cancelledAt));
            ps.setString(3, tradeId);

            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            log.error("Failed to cancel trade {}: {}", tradeId, e.getMessage());
            throw new RuntimeException("Failed to cancel trade", e);
        }
    }

    @Override
    public boolean settle(TradeSettlement s) {
        String tradeSql = """
            UPDATE trades SET
                exit_price = ?,
                exit_reason = ?,
                closed_at = ?,
                cancelled_at = ?,
                pnl = ?,
                pnl_percent = ?,
                status = ?,
                pair_exit_price = COALESCE(?, pair_exit_price)
            WHERE id = ?
              AND status = 'filled'
              AND pnl IS NULL
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(tradeSql)) {
                    ps.setBigDecimal(1, s.exitPrice());
                    ps.setString(2, s.exitReason());
                    ps.setTimestamp(3, Timestamp.from(s.closedAt()));
                    ps.setTimestamp(4, s.cancelledAt() != null ? Timestamp.from(s.cancelledAt()) : null);
                    ps.setBigDecimal(5, s.pnl());
                    ps.setBigDecimal(6, s.pnlPercent());
                    ps.setString(7, s.status().code());
                    ps.setBigDecimal(8, s.pairExitPrice());
                    ps.setString(9, s.tradeId());
                    updated = ps.executeUpdate();
                }

                if (updated != 1) {
                    conn.rollback();
                    log.warn("Trade {} not settled: no longer filled or already has pnl", s.tradeId());
                    return false;
                }

                applyRunAggregate(conn, s.tradeId(), s.pnl(), s.isWin() ? 1 : 0, s.isLoss() ? 1 : 0);
                conn.commit();
                return true;

            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to settle trade {}: {}", s.tradeId(), e.getMessage());
            throw new RuntimeException("Failed to settle trade", e);
        }
    }

    @Override
    public boolean resetToPending(String tradeId) {
        String lockSql = "SELECT pnl FROM trades WHERE id = ? FOR UPDATE";
        String resetSql = """
            UPDATE trades SET
                status = 'pending_fill',
                fill_price = NULL,
                fill_time = NULL,
                filled_at = NULL,
                exit_price = NULL,
                exit_reason = NULL,
                closed_at = NULL,
                cancelled_at = NULL,
                pnl = NULL,
                pnl_percent = NULL,
                pair_fill_price = NULL,
                pair_exit_price = NULL
            WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                BigDecimal realizedPnl;
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    ps.setString(1, tradeId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return false;
                        }
                        realizedPnl = rs.getBigDecimal("pnl");
                    }
                }

                if (realizedPnl != null) {
                    // Undo exactly what settle() added
                    applyRunAggregate(conn, tradeId, realizedPnl.negate(),
                        realizedPnl.signum() > 0 ? -1 : 0,
                        realizedPnl.signum() < 0 ? -1 : 0);
                }

                try (PreparedStatement ps = conn.prepareStatement(resetSql)) {
                    ps.setString(1, tradeId);
                    ps.executeUpdate();
                }

                conn.commit();
                return true;

            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to reset trade {}: {}", tradeId, e.getMessage());
            throw new RuntimeException("Failed to reset trade", e);
        }
    }

    private void applyRunAggregate(Connection conn, String tradeId, BigDecimal pnlDelta,
                                   int winDelta, int lossDelta) throws SQLException {
        String sql = """
            UPDATE runs SET
                total_pnl = COALESCE(total_pnl, 0) + ?,
                win_count = COALESCE(win_count, 0) + ?,
                loss_count = COALESCE(loss_count, 0) + ?
            WHERE id = (SELECT run_id FROM trades WHERE id = ?)
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setBigDecimal(1, pnlDelta);
            ps.setInt(2, winDelta);
            ps.setInt(3, lossDelta);
            ps.setString(4, tradeId);
            int rows = ps.executeUpdate();
            if (rows == 0) {
                log.warn("Trade {} has no owning run, aggregate not updated", tradeId);
            }
        }
    }

    private Trade mapRow(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        String strategyName = rs.getString("strategy_name");
        if (strategyName == null || strategyName.isBlank()) {
            strategyName = strategyFromSettings(rs.getString("instance_settings"));
        }

        return new Trade(
            id,
            rs.getString("run_id"),
            rs.getString("recommendation_id"),
            rs.getString("instance_name"),
            strategyName,
            rs.getString("symbol"),
            parseSide(id, rs.getString("side")),
            rs.getString("strategy_type"),
            rs.getString("timeframe"),
            rs.getBigDecimal("entry_price"),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("stop_loss"),
            rs.getBigDecimal("take_profit"),
            parseJson(id, rs.getString("strategy_metadata")),
            parseStatus(id, rs.getString("status")),
            rs.getBigDecimal("fill_price"),
            toInstant(rs.getTimestamp("filled_at")),
            rs.getBigDecimal("exit_price"),
            rs.getString("exit_reason"),
            rs.getBigDecimal("pnl"),
            rs.getBigDecimal("pnl_percent"),
            toInstant(rs.getTimestamp("closed_at")),
            toInstant(rs.getTimestamp("cancelled_at")),
            rs.getBigDecimal("pair_fill_price"),
            rs.getBigDecimal("pair_exit_price"),
            rs.getBigDecimal("pair_quantity"),
            rs.getBigDecimal("position_size_usd"),
            rs.getBigDecimal("risk_amount_usd"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("analyzed_at"))
        );
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    // A malformed column must not fail the whole listing; the reconciler rejects the trade instead.
    private static TradeSide parseSide(String tradeId, String side) {
        try {
            return TradeSide.fromCode(side);
        } catch (IllegalArgumentException e) {
            log.warn("Trade {} has unreadable side '{}'", tradeId, side);
            return null;
        }
    }

    private static TradeStatus parseStatus(String tradeId, String status) {
        try {
            return TradeStatus.fromCode(status);
        } catch (IllegalArgumentException e) {
            log.warn("Trade {} has unrecognised status '{}'", tradeId, status);
            return null;
        }
    }

    private static JsonNode parseJson(String tradeId, String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readTree(json);
        } catch (Exception e) {
            log.warn("Trade {} has unreadable strategy_metadata: {}", tradeId, e.getMessage());
            return null;
        }
    }

    private static String strategyFromSettings(String settingsJson) {
        if (settingsJson == null || settingsJson.isBlank()) return null;
        try {
            JsonNode strategy = MAPPER.readTree(settingsJson).get("strategy");
            return strategy != null && !strategy.isNull() && !strategy.asText().isBlank() ? strategy.asText() : null;
        } catch (Exception e) {
            log.debug("Instance settings are not valid JSON: {}", e.getMessage());
            return null;
        }
    }
}
