package in.papersim.domain.repository;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Persistent audit trail for reconciler errors that were not allowed to mutate a trade.
 */
public interface SimulatorErrorRepository {

    void insert(String tradeId, String errorType, String message, JsonNode context, Instant createdAt);
}
