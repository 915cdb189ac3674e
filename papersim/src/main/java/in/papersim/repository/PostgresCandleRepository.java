package in.papersim.repository;

import in.papersim.domain.data.Candle;
import in.papersim.domain.data.Timeframe;
import in.papersim.domain.repository.CandleRepository;
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
 * PostgreSQL implementation of CandleRepository over the {@code klines} table.
 *
 * Bars are keyed by the exchange symbol (perpetual suffix stripped) and the trade-facing timeframe label.
 */
public final class PostgresCandleRepository implements CandleRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresCandleRepository.class);

    private static final String CATEGORY = "linear";

    private final DataSource dataSource;

    public PostgresCandleRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public int insertBatch(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO klines (symbol, timeframe, category, start_time,
                                open_price, high_price, low_price, close_price, volume, turnover)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (symbol, timeframe, start_time) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            conn.setAutoCommit(false);

            for (Candle candle : candles) {
                ps.setString(1, candle.symbol());
                ps.setString(2, candle.timeframe().getLabel());
                ps.setString(3, CATEGORY);
                ps.setLong(4, candle.startMillis());
                ps.setBigDecimal(5, candle.open());
                ps.setBigDecimal(6, candle.high());
                ps.setBigDecimal(7, candle.low());
                ps.setBigDecimal(8, candle.close());
                ps.setBigDecimal(9, candle.volume() != null ? candle.volume() : BigDecimal.ZERO);
                ps.setBigDecimal(10, candle.turnover() != null ? candle.turnover() : BigDecimal.ZERO);
                ps.addBatch();
            }

            int[] counts = ps.executeBatch();
            conn.commit();

            int inserted = 0;
            for (int count : counts) {
                if (count > 0) inserted += count;
            }
            log.debug("Inserted {} of {} klines", inserted, candles.size());
            return inserted;

        } catch (SQLException e) {
            log.error("Failed to insert klines batch: {}", e.getMessage());
            throw new RuntimeException("Failed to insert klines batch", e);
        }
    }

    @Override
    public List<Candle> findRange(String symbol, Timeframe timeframe, Instant from, Instant to) {
        String sql = """
            SELECT symbol, timeframe, start_time, open_price, high_price, low_price, close_price, volume, turnover
            FROM klines
            WHERE symbol = ? AND timeframe = ? AND start_time >= ? AND start_time <= ?
            ORDER BY start_time ASC
            """;

        List<Candle> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, timeframe.getLabel());
            ps.setLong(3, from.toEpochMilli());
            ps.setLong(4, to.toEpochMilli());

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs, timeframe));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find klines: {}", e.getMessage());
            throw new RuntimeException("Failed to find klines", e);
        }

        return result;
    }

    @Override
    public Optional<Candle> findLatest(String symbol, Timeframe timeframe) {
        String sql = """
            SELECT symbol, timeframe, start_time, open_price, high_price, low_price, close_price, volume, turnover
            FROM klines
            WHERE symbol = ? AND timeframe = ?
            ORDER BY start_time DESC
            LIMIT 1
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, timeframe.getLabel());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs, timeframe));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find latest kline: {}", e.getMessage());
            throw new RuntimeException("Failed to find latest kline", e);
        }

        return Optional.empty();
    }

    private Candle mapRow(ResultSet rs, Timeframe timeframe) throws SQLException {
        return new Candle(
            rs.getString("symbol"),
            timeframe,
            Instant.ofEpochMilli(rs.getLong("start_time")),
            rs.getBigDecimal("open_price"),
            rs.getBigDecimal("high_price"),
            rs.getBigDecimal("low_price"),
            rs.getBigDecimal("close_price"),
            rs.getBigDecimal("volume"),
            rs.getBigDecimal("turnover")
        );
    }
}
