package in.papersim.service.exit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.papersim.domain.data.Candle;
import in.papersim.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Exit check for spread trades, delegated to the strategy's own exit logic in an external process.
 *
 * Invocation: {@code <python> <script> <tradeId> <strategyName> <candlesJson> <tradeJson> <pairCandlesJson>}.
 * The process prints one JSON object on stdout:
 * {@code {should_exit, exit_price, exit_reason, exit_timestamp, current_price, pair_exit_price, error}}.
 *
 * The process is killed after the timeout. A timeout, a non-zero exit code, an {@code error} field,
 * unparsable output or a spawn failure all yield {@link ExitCheck#failed(String)}.
 */
public final class SpreadExitEvaluator implements ExitEvaluator {
    private static final Logger log = LoggerFactory.getLogger(SpreadExitEvaluator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String DEFAULT_EXIT_REASON = "strategy_exit";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String interpreter;
    private final String script;
    private final Duration timeout;
    private final Clock clock;

    public SpreadExitEvaluator(String interpreter, String script, Duration timeout) {
        this(interpreter, script, timeout, Clock.systemUTC());
    }

    public SpreadExitEvaluator(String interpreter, String script, Duration timeout, Clock clock) {
        this.interpreter = interpreter;
        this.script = script;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public ExitCheck evaluate(ExitRequest request) {
        Trade trade = request.trade();
        String strategyName = request.strategyName();
        if (strategyName == null || strategyName.isBlank()) {
            return ExitCheck.failed("No strategy name provided");
        }

        List<String> command;
        try {
            command = List.of(
                interpreter,
                script,
                trade.id(),
                strategyName,
                objectMapper.writeValueAsString(candlesJson(request.candles())),
                objectMapper.writeValueAsString(tradeJson(trade, request.startIndex())),
                objectMapper.writeValueAsString(candlesJson(request.pairCandles()))
            );
        } catch (IOException e) {
            return ExitCheck.failed("Failed to serialize strategy exit input: " + e.getMessage());
        }

        if (request.pairCandles().isEmpty()) {
            log.warn("[SpreadExit] {} ({}): no pair candles passed to strategy exit check", trade.symbol(), strategyName);
        }
        log.debug("[SpreadExit] {} ({}): candles={}, pair_candles={}, fill_index={}",
            trade.symbol(), strategyName, request.candles().size(), request.pairCandles().size(), request.startIndex());

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            String error = "Error spawning strategy exit check: " + e.getMessage();
            log.error("[SpreadExit] {} for {}", error, trade.symbol());
            return ExitCheck.failed(error);
        }

        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = readAsync(process.getErrorStream());

        try {
            process.getOutputStream().close();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                String error = "Strategy exit check timed out after " + timeout.toSeconds() + "s for "
                    + trade.symbol() + " (" + strategyName + "), trade " + trade.id();
                log.error("[SpreadExit] CRITICAL: {}", error);
                return ExitCheck.failed(error);
            }

            String err = stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!err.isBlank()) {
                log.debug("[SpreadExit] {} stderr:\n{}", trade.symbol(), err);
            }

            String out = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String error = "Strategy exit check failed with exit code " + exitCode;
                log.error("[SpreadExit] {} for {} ({}), stdout: {}", error, trade.symbol(), strategyName, out);
                return ExitCheck.failed(error);
            }

            return parseResult(out, request);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ExitCheck.failed("Strategy exit check interrupted");
        } catch (ExecutionException | TimeoutException | IOException e) {
            process.destroyForcibly();
            String error = "Error reading strategy exit output: " + e.getMessage();
            log.error("[SpreadExit] {} for {}", error, trade.symbol());
            return ExitCheck.failed(error);
        }
    }

    ExitCheck parseResult(String stdout, ExitRequest request) {
        JsonNode result;
        try {
            result = objectMapper.readTree(stdout);
        } catch (JsonProcessingException e) {
            log.error("[SpreadExit] Unparsable output for {}: {}", request.trade().symbol(), stdout);
            return ExitCheck.failed("Failed to parse strategy exit result: " + e.getOriginalMessage());
        }
        if (result == null || !result.isObject()) {
            return ExitCheck.failed("Failed to parse strategy exit result: expected a JSON object");
        }

        JsonNode error = result.get("error");
        if (error != null && !error.isNull() && !error.asText().isBlank()) {
            return ExitCheck.failed("Strategy exit check reported error: " + error.asText());
        }

        BigDecimal currentPrice = decimal(result.get("current_price"));
        if (currentPrice == null) {
            currentPrice = request.lastClose();
        }

        if (!result.path("should_exit").asBoolean(false)) {
            return ExitCheck.noExit(currentPrice);
        }

        BigDecimal exitPrice = decimal(result.get("exit_price"));
        if (exitPrice == null) {
            return ExitCheck.failed("Strategy requested exit without exit_price");
        }

        String reason = result.path("exit_reason").asText("");
        if (reason.isBlank()) {
            reason = DEFAULT_EXIT_REASON;
        }

        Instant exitTime = timestamp(result.get("exit_timestamp"));
        if (exitTime == null) {
            exitTime = clock.instant();
        }

        log.info("[SpreadExit] {} exit signal: reason={}, exit_price={}, pair_exit_price={}",
            request.trade().symbol(), reason, exitPrice, decimal(result.get("pair_exit_price")));

        return ExitCheck.exit(new ExitDecision(
            reason, exitPrice, decimal(result.get("pair_exit_price")), exitTime, currentPrice));
    }

    private ArrayNode candlesJson(List<Candle> candles) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Candle c : candles) {
            ObjectNode node = array.addObject();
            node.put("timestamp", c.startMillis());
            node.put("open", c.open());
            node.put("high", c.high());
            node.put("low", c.low());
            node.put("close", c.close());
            node.put("volume", c.volume() != null ? c.volume() : BigDecimal.ZERO);
        }
        return array;
    }

    private ObjectNode tradeJson(Trade trade, int fillIndex) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("symbol", trade.symbol());
        node.put("side", trade.side() != null ? trade.side().code() : null);
        node.put("entry_price", trade.entryPrice());
        node.put("stop_loss", trade.stopLoss());
        node.put("take_profit", trade.takeProfit());
        if (trade.strategyMetadata() != null) {
            node.set("strategy_metadata", trade.strategyMetadata());
        } else {
            node.putObject("strategy_metadata");
        }
        node.put("strategy_type", trade.strategyType());
        node.put("pair_symbol", trade.pairSymbol().orElse(null));
        node.put("fill_candle_index", fillIndex);
        return node;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.decimalValue();
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // Epoch millis, numeric string or ISO-8601
    private static Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return Instant.ofEpochMilli(node.asLong());
        String text = node.asText().trim();
        if (text.isEmpty()) return null;
        try {
            return Instant.ofEpochMilli(Long.parseLong(text));
        } catch (NumberFormatException ignored) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                log.warn("[SpreadExit] Unreadable exit_timestamp '{}', using now", text);
                return null;
            }
        }
    }

    private static CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }
}
