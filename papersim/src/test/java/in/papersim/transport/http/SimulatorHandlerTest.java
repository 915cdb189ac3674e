package in.papersim.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.papersim.domain.repository.TradeRepository;
import in.papersim.domain.trade.TestTrades;
import in.papersim.service.trade.LifecycleReconciler;
import in.papersim.service.trade.ReconcileOutcome;
import in.papersim.service.trade.ReconcilePassSummary;
import in.papersim.service.trade.TradeResetService;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SimulatorHandlerTest {

    private static final int TEST_PORT = 19093;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private LifecycleReconciler reconciler;
    @Mock
    private TradeRepository tradeRepo;

    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        SimulatorHandler api = new SimulatorHandler(reconciler, new TradeResetService(tradeRepo));

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/api/health", api::health)
                .post("/api/simulator/auto-close", api::autoClose)
                .post("/api/simulator/reset-trade", api::resetTrade))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void autoClose_returnsPassSummary() throws Exception {
        // Arrange
        Instant checkedAt = Instant.parse("2024-01-02T00:00:00Z");
        ReconcileOutcome closed = ReconcileOutcome.forTrade(TestTrades.priceBased().build(), "1h", checkedAt)
            .action(ReconcileOutcome.Action.CLOSED)
            .currentPrice(new BigDecimal("95"))
            .exit("stop_loss", Instant.parse("2024-01-01T13:00:00Z"))
            .pnl(new BigDecimal("-10.00"))
            .build();
        ReconcileOutcome checked = ReconcileOutcome.forTrade(TestTrades.priceBased().id("trade-2").build(), "1h", checkedAt)
            .error("no candles")
            .build();
        when(reconciler.tryRunPass())
            .thenReturn(Optional.of(ReconcilePassSummary.of(List.of(closed, checked), 42)));

        // Act
        HttpResponse<String> response = post("/api/simulator/auto-close", "");

        // Assert
        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertTrue(json.path("success").asBoolean(), "success flag set");
        assertEquals(2, json.path("checked").asInt());
        assertEquals(1, json.path("closed").asInt());
        assertEquals(1, json.path("still_open").asInt());
        assertEquals(42, json.path("duration_ms").asLong());

        JsonNode first = json.path("results").get(0);
        assertEquals("trade-1", first.path("trade_id").asText());
        assertEquals("closed", first.path("action").asText());
        assertEquals("stop_loss", first.path("exit_reason").asText());
        assertEquals("2024-01-01T13:00:00Z", first.path("exit_timestamp").asText(), "ISO-8601 timestamps");
        assertFalse(first.has("error"), "Null fields omitted");

        assertEquals("no candles", json.path("results").get(1).path("error").asText());
    }

    @Test
    void autoClose_conflictWhilePassRunning() throws Exception {
        when(reconciler.tryRunPass()).thenReturn(Optional.empty());

        HttpResponse<String> response = post("/api/simulator/auto-close", "");

        assertEquals(409, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertFalse(json.path("success").asBoolean());
        assertEquals("Reconciliation pass already in progress", json.path("error").asText());
    }

    @Test
    void autoClose_unavailableAfterShutdown() throws Exception {
        when(reconciler.tryRunPass()).thenThrow(new IllegalStateException("Reconciler is closed"));

        HttpResponse<String> response = post("/api/simulator/auto-close", "");

        assertEquals(503, response.statusCode());
    }

    @Test
    void autoClose_unexpectedFailureIs500() throws Exception {
        when(reconciler.tryRunPass()).thenThrow(new RuntimeException("Failed to load open trades"));

        HttpResponse<String> response = post("/api/simulator/auto-close", "");

        assertEquals(500, response.statusCode());
        assertTrue(MAPPER.readTree(response.body()).path("error").asText().contains("Failed to load open trades"));
    }

    @Test
    void resetTrade_resetsKnownTrade() throws Exception {
        when(tradeRepo.resetToPending("trade-7")).thenReturn(true);

        HttpResponse<String> response = post("/api/simulator/reset-trade", "{\"tradeId\":\"trade-7\"}");

        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertTrue(json.path("success").asBoolean());
        assertEquals("trade-7", json.path("trade_id").asText());
    }

    @Test
    void resetTrade_unknownTradeIs404() throws Exception {
        when(tradeRepo.resetToPending("ghost")).thenReturn(false);

        HttpResponse<String> response = post("/api/simulator/reset-trade", "{\"tradeId\":\"ghost\"}");

        assertEquals(404, response.statusCode());
    }

    @Test
    void resetTrade_missingIdIs400() throws Exception {
        HttpResponse<String> response = post("/api/simulator/reset-trade", "{}");

        assertEquals(400, response.statusCode());
        assertEquals("tradeId is required", MAPPER.readTree(response.body()).path("error").asText());
        verifyNoInteractions(tradeRepo);
    }

    @Test
    void resetTrade_malformedBodyIs400() throws Exception {
        HttpResponse<String> response = post("/api/simulator/reset-trade", "{not json");

        assertEquals(400, response.statusCode());
    }

    @Test
    void health_reportsPassState() throws Exception {
        when(reconciler.isPassRunning()).thenReturn(true);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/api/health"))
            .GET()
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        JsonNode json = MAPPER.readTree(response.body());
        assertEquals("ok", json.path("status").asText());
        assertTrue(json.path("passRunning").asBoolean());
    }
}
