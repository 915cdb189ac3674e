package in.papersim.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.papersim.service.trade.LifecycleReconciler;
import in.papersim.service.trade.ReconcilePassSummary;
import in.papersim.service.trade.TradeResetService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

/**
 * HTTP batch trigger for the paper-trade simulator.
 *
 * POST /api/simulator/auto-close   run one reconciliation pass, 409 while another is running
 * POST /api/simulator/reset-trade  body {"tradeId": "..."}
 * GET  /api/health
 */
public final class SimulatorHandler {
    private static final Logger log = LoggerFactory.getLogger(SimulatorHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // JSON Response Keys
    private static final String JSON_SUCCESS = "success";
    private static final String JSON_MESSAGE = "message";
    private static final String JSON_ERROR = "error";

    private static final String CONTENT_TYPE_JSON = "application/json; charset=utf-8";

    private final LifecycleReconciler reconciler;
    private final TradeResetService resetService;

    public SimulatorHandler(LifecycleReconciler reconciler, TradeResetService resetService) {
        this.reconciler = reconciler;
        this.resetService = resetService;
    }

    /**
     * POST /api/simulator/auto-close
     */
    public void autoClose(HttpServerExchange exchange) {
        // A pass blocks on the database and the market data provider
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::autoClose);
            return;
        }

        try {
            Optional<ReconcilePassSummary> summary = reconciler.tryRunPass();
            if (summary.isEmpty()) {
                sendError(exchange, 409, "Reconciliation pass already in progress");
                return;
            }

            ObjectNode response = MAPPER.valueToTree(summary.get());
            response.put(JSON_SUCCESS, true);
            sendJson(exchange, 200, response);

        } catch (IllegalStateException e) {
            sendError(exchange, 503, e.getMessage());
        } catch (Exception e) {
            log.error("[SimulatorApi] Auto-close pass failed: {}", e.getMessage(), e);
            sendError(exchange, 500, "Auto-close failed: " + e.getMessage());
        }
    }

    /**
     * POST /api/simulator/reset-trade
     */
    public void resetTrade(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body == null || body.isBlank() ? "{}" : body);
                String tradeId = json.path("tradeId").asText("");
                if (tradeId.isBlank()) {
                    sendError(ex, 400, "tradeId is required");
                    return;
                }

                if (!resetService.reset(tradeId)) {
                    sendError(ex, 404, "Trade not found: " + tradeId);
                    return;
                }

                ObjectNode response = MAPPER.createObjectNode();
                response.put(JSON_SUCCESS, true);
                response.put("trade_id", tradeId);
                response.put(JSON_MESSAGE, "Trade reset to pending_fill");
                sendJson(ex, 200, response);

            } catch (JsonProcessingException e) {
                sendError(ex, 400, "Invalid JSON body");
            } catch (Exception e) {
                log.error("[SimulatorApi] Reset failed: {}", e.getMessage(), e);
                sendError(ex, 500, "Failed to reset trade");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        health.put("passRunning", reconciler.isPassRunning());
        sendJson(exchange, 200, health);
    }

    private static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put(JSON_SUCCESS, false);
        error.put(JSON_ERROR, message);
        sendJson(exchange, status, error);
    }
}
