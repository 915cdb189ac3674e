package in.papersim.domain.repository;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Read access to the JSON settings document stored per instance.
 */
public interface SettingsRepository {

    Optional<JsonNode> findSettings(String instanceId);
}
