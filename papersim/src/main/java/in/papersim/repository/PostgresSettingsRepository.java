package in.papersim.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.papersim.domain.repository.SettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of SettingsRepository. The {@code settings} column may be TEXT or JSONB.
 */
public final class PostgresSettingsRepository implements SettingsRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSettingsRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public PostgresSettingsRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<JsonNode> findSettings(String instanceId) {
        String sql = "SELECT settings::text AS settings FROM settings WHERE instance_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String json = rs.getString("settings");
                if (json == null || json.isBlank()) {
                    return Optional.empty();
                }
                return Optional.of(MAPPER.readTree(json));
            }

        } catch (SQLException e) {
            log.error("Failed to load settings for {}: {}", instanceId, e.getMessage());
            throw new RuntimeException("Failed to load settings", e);
        } catch (Exception e) {
            log.error("Settings for {} are not valid JSON: {}", instanceId, e.getMessage());
            throw new RuntimeException("Failed to parse settings", e);
        }
    }
}
