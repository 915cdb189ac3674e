package in.papersim.repository;

import com.fasterxml.jackson.databind.JsonNode;
import in.papersim.domain.repository.SimulatorErrorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * PostgreSQL implementation of SimulatorErrorRepository over {@code simulator_errors}.
 */
public final class PostgresSimulatorErrorRepository implements SimulatorErrorRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSimulatorErrorRepository.class);

    private final DataSource dataSource;

    public PostgresSimulatorErrorRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(String tradeId, String errorType, String message, JsonNode context, Instant createdAt) {
        String sql = """
            INSERT INTO simulator_errors (id, trade_id, error_type, message, context, created_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, UUID.randomUUID());
            ps.setString(2, tradeId);
            ps.setString(3, errorType);
            ps.setString(4, message);
            ps.setString(5, context != null ? context.toString() : "{}");
            ps.setTimestamp(6, Timestamp.from(createdAt));

            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to insert simulator error: {}", e.getMessage());
            throw new RuntimeException("Failed to insert simulator error", e);
        }
    }
}
