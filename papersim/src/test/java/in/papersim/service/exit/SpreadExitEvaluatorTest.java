package in.papersim.service.exit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.papersim.domain.data.Candle;
import in.papersim.domain.data.Timeframe;
import in.papersim.domain.trade.TestTrades;
import in.papersim.domain.trade.Trade;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Strategy exit bridge against small shell scripts standing in for the strategy process.
 */
@DisabledOnOs(OS.WINDOWS)
class SpreadExitEvaluatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");
    private static final Instant NOW = Instant.parse("2024-01-02T00:00:00Z");

    @TempDir
    Path tempDir;

    private static Candle bar(int index, double close) {
        return Candle.of("BTCUSDT", Timeframe.HOUR_1, T0.plusSeconds(3600L * index), close, close, close, close);
    }

    private ExitRequest request() {
        Trade trade = TestTrades.spread("ETHUSDT", "50").filled("100", T0).pairFill("50").build();
        return new ExitRequest(trade, trade.strategyName(),
            List.of(bar(0, 100), bar(1, 101), bar(2, 102)),
            List.of(bar(0, 50), bar(1, 51), bar(2, 52)),
            1);
    }

    private SpreadExitEvaluator evaluatorFor(String scriptBody, Duration timeout) throws IOException {
        Path script = tempDir.resolve("exit_check.sh");
        Files.writeString(script, scriptBody, StandardCharsets.UTF_8);
        return new SpreadExitEvaluator("/bin/sh", script.toString(), timeout, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void exitSignal_isParsed() throws Exception {
        SpreadExitEvaluator evaluator = evaluatorFor("""
            printf '%s' '{"should_exit": true, "exit_price": 104.5, "pair_exit_price": "49.5", "exit_reason": "z_score_reverted", "exit_timestamp": 1704114000000, "current_price": 103}'
            """, Duration.ofSeconds(10));

        ExitCheck check = evaluator.evaluate(request());

        assertTrue(check.isExit(), "Expected an exit, got " + check);
        ExitDecision decision = check.decision().orElseThrow();
        assertEquals("z_score_reverted", decision.reason());
        assertEquals(0, decision.exitPrice().compareTo(new BigDecimal("104.5")));
        assertEquals(0, decision.pairExitPrice().compareTo(new BigDecimal("49.5")));
        assertEquals(Instant.ofEpochMilli(1704114000000L), decision.exitTime());
        assertEquals(0, decision.currentPrice().compareTo(new BigDecimal("103")));
    }

    @Test
    void scriptReceivesTradeAndCandles() throws Exception {
        Path tradeArg = tempDir.resolve("trade.json");
        Path candlesArg = tempDir.resolve("candles.json");
        SpreadExitEvaluator evaluator = evaluatorFor(
            "printf '%s' \"$4\" > '" + tradeArg + "'\n"
                + "printf '%s' \"$3\" > '" + candlesArg + "'\n"
                + "printf '%s' '{\"should_exit\": false, \"current_price\": 102}'\n",
            Duration.ofSeconds(10));

        ExitCheck check = evaluator.evaluate(request());

        assertFalse(check.isExit());
        assertFalse(check.isFailed(), "No-exit result expected, got " + check);

        JsonNode trade = MAPPER.readTree(Files.readString(tradeArg));
        assertEquals("ETHUSDT", trade.path("pair_symbol").asText());
        assertEquals("spread_based", trade.path("strategy_type").asText());
        assertEquals("Buy", trade.path("side").asText());
        assertEquals(1, trade.path("fill_candle_index").asInt(), "Fill index is the scan start");

        JsonNode candles = MAPPER.readTree(Files.readString(candlesArg));
        assertEquals(3, candles.size());
        assertEquals(T0.toEpochMilli(), candles.get(0).path("timestamp").asLong());
        assertTrue(candles.get(0).has("close"), "Candle JSON carries OHLC fields");
    }

    @Test
    void nonZeroExit_isFailure() throws Exception {
        SpreadExitEvaluator evaluator = evaluatorFor("""
            echo 'Traceback: boom' >&2
            exit 3
            """, Duration.ofSeconds(10));

        ExitCheck check = evaluator.evaluate(request());

        assertTrue(check.isFailed(), "Non-zero exit must not be read as no-exit");
        assertTrue(check.error().contains("exit code 3"), check.error());
    }

    @Test
    void timeout_killsProcessAndFails() throws Exception {
        SpreadExitEvaluator evaluator = evaluatorFor("exec sleep 10\n", Duration.ofMillis(500));

        long started = System.nanoTime();
        ExitCheck check = evaluator.evaluate(request());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertTrue(check.isFailed(), "Timeout must be a failure");
        assertTrue(check.error().contains("timed out"), check.error());
        assertTrue(elapsedMs < 5_000, "Evaluator should return shortly after the timeout, took " + elapsedMs + "ms");
    }

    @Test
    void errorField_isFailure() throws Exception {
        SpreadExitEvaluator evaluator = evaluatorFor("""
            printf '%s' '{"should_exit": false, "error": "strategy not found"}'
            """, Duration.ofSeconds(10));

        ExitCheck check = evaluator.evaluate(request());

        assertTrue(check.isFailed());
        assertTrue(check.error().contains("strategy not found"), check.error());
    }

    @Test
    void spawnFailure_isFailure() {
        SpreadExitEvaluator evaluator = new SpreadExitEvaluator(
            tempDir.resolve("no-such-interpreter").toString(), "script.py", Duration.ofSeconds(1));

        ExitCheck check = evaluator.evaluate(request());

        assertTrue(check.isFailed());
        assertTrue(check.error().startsWith("Error spawning"), check.error());
    }

    @Test
    void parseResult_defaultsAndValidation() {
        SpreadExitEvaluator evaluator = new SpreadExitEvaluator("unused", "unused", Duration.ofSeconds(1),
            Clock.fixed(NOW, ZoneOffset.UTC));
        ExitRequest request = request();

        ExitCheck noTimestamp = evaluator.parseResult("{\"should_exit\": true, \"exit_price\": 99}", request);
        ExitDecision decision = noTimestamp.decision().orElseThrow();
        assertEquals(NOW, decision.exitTime(), "Missing exit_timestamp means now");
        assertEquals(SpreadExitEvaluator.DEFAULT_EXIT_REASON, decision.reason());
        assertEquals(0, decision.currentPrice().compareTo(new BigDecimal("102")), "Falls back to last close");

        ExitCheck isoTimestamp = evaluator.parseResult(
            "{\"should_exit\": true, \"exit_price\": 99, \"exit_timestamp\": \"2024-01-01T12:00:00Z\"}", request);
        assertEquals(Instant.parse("2024-01-01T12:00:00Z"), isoTimestamp.decision().orElseThrow().exitTime());

        assertTrue(evaluator.parseResult("{\"should_exit\": true}", request).isFailed(),
            "Exit without exit_price is a failure");
        assertTrue(evaluator.parseResult("not json", request).isFailed(), "Garbage output is a failure");
        assertTrue(evaluator.parseResult("[]", request).isFailed(), "Non-object output is a failure");
    }

    @Test
    void parseResult_unparsableOutputNamesParserError() {
        SpreadExitEvaluator evaluator = new SpreadExitEvaluator("unused", "unused", Duration.ofSeconds(1));

        ExitCheck check = evaluator.parseResult("Traceback (most recent call last):", request());

        assertTrue(check.isFailed(), "Unparsable output must never read as no exit");
        assertTrue(check.error().startsWith("Failed to parse strategy exit result: "), check.error());
        assertFalse(check.error().endsWith(": "), "Parser detail should be included");
    }
}
