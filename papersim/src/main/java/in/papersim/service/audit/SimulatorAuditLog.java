package in.papersim.service.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.papersim.domain.repository.SimulatorErrorRepository;
import in.papersim.infrastructure.metrics.ReconcilerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit trail for rejected transitions.
 *
 * Every event goes to the {@code AUDIT} logger and to {@code simulator_errors}. Failing to
 * persist an event is logged; it never fails the trade check that raised it.
 */
public final class SimulatorAuditLog {
    private static final Logger log = LoggerFactory.getLogger(SimulatorAuditLog.class);
    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final SimulatorErrorRepository errorRepo;
    private final ReconcilerMetrics metrics;
    private final Clock clock;

    public SimulatorAuditLog(SimulatorErrorRepository errorRepo, ReconcilerMetrics metrics) {
        this(errorRepo, metrics, Clock.systemUTC());
    }

    public SimulatorAuditLog(SimulatorErrorRepository errorRepo, ReconcilerMetrics metrics, Clock clock) {
        this.errorRepo = errorRepo;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void record(String tradeId, AuditEventType type, String message, Map<String, ?> context) {
        JsonNode contextJson = MAPPER.valueToTree(context != null ? new LinkedHashMap<>(context) : Map.of());

        audit.error("[SIMULATOR][{}] trade={} message={} context={}", type, tradeId, message, contextJson);
        metrics.recordAuditEvent(type.name());

        try {
            errorRepo.insert(tradeId, type.name(), message, contextJson, clock.instant());
        } catch (RuntimeException e) {
            log.error("[SIMULATOR] Failed to persist audit event {} for trade {}: {}", type, tradeId, e.getMessage());
        }
    }

    /**
     * Context map that tolerates null values, unlike {@link Map#of}.
     */
    public static Map<String, Object> context(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("context needs key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
