package in.papersim.infrastructure.broker.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.papersim.broker.MarketDataClient;
import in.papersim.broker.MarketDataException;
import in.papersim.domain.data.Candle;
import in.papersim.domain.data.Timeframe;
import in.papersim.util.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Bybit v5 public market data (linear perpetuals).
 *
 * Kline endpoint: GET /v5/market/kline?category=linear&symbol=&interval=&limit=&end=
 * Rows are [startTime, open, high, low, close, volume, turnover], newest first.
 *
 * Ticker endpoint: GET /v5/market/tickers?category=linear&symbol=
 * Price is result.list[0].lastPrice.
 */
public final class BybitMarketDataClient implements MarketDataClient {
    private static final Logger log = LoggerFactory.getLogger(BybitMarketDataClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.bybit.com";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    /** Bybit caps a single kline request at 1000 rows. */
    public static final int MAX_LIMIT = 1000;

    private static final String CATEGORY = "linear";

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public BybitMarketDataClient() {
        this(DEFAULT_BASE_URL, DEFAULT_TIMEOUT);
    }

    public BybitMarketDataClient(String baseUrl, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public List<Candle> getKlines(String symbol, Timeframe timeframe, int limit, Instant endTime)
            throws MarketDataException {
        String apiSymbol = Symbols.toExchangeSymbol(symbol);
        int boundedLimit = Math.max(1, Math.min(limit, MAX_LIMIT));

        String url = baseUrl + "/v5/market/kline"
            + "?category=" + CATEGORY
            + "&symbol=" + encode(apiSymbol)
            + "&interval=" + timeframe.getIntervalCode()
            + "&limit=" + boundedLimit
            + "&end=" + endTime.toEpochMilli();

        JsonNode result = call(url, apiSymbol);
        JsonNode list = result.get("list");
        if (list == null || !list.isArray()) {
            throw new MarketDataException("Bybit kline response for " + apiSymbol + " has no result.list");
        }

        List<Candle> candles = new ArrayList<>(list.size());
        for (JsonNode row : list) {
            if (!row.isArray() || row.size() < 5) {
                throw new MarketDataException("Malformed kline row for " + apiSymbol + ": " + row);
            }
            try {
                candles.add(new Candle(
                    apiSymbol,
                    timeframe,
                    Instant.ofEpochMilli(Long.parseLong(row.get(0).asText())),
                    new BigDecimal(row.get(1).asText()),
                    new BigDecimal(row.get(2).asText()),
                    new BigDecimal(row.get(3).asText()),
                    new BigDecimal(row.get(4).asText()),
                    optionalDecimal(row, 5),
                    optionalDecimal(row, 6)
                ));
            } catch (NumberFormatException e) {
                throw new MarketDataException("Malformed kline row for " + apiSymbol + ": " + row, e);
            }
        }

        // Newest first on the wire
        Collections.reverse(candles);

        log.debug("[Bybit] {} {} klines: {} rows ending {}", apiSymbol, timeframe.getLabel(), candles.size(), endTime);
        return candles;
    }

    @Override
    public Optional<BigDecimal> getCurrentPrice(String symbol) throws MarketDataException {
        String apiSymbol = Symbols.toExchangeSymbol(symbol);
        String url = baseUrl + "/v5/market/tickers?category=" + CATEGORY + "&symbol=" + encode(apiSymbol);

        JsonNode result = call(url, apiSymbol);
        JsonNode list = result.get("list");
        if (list == null || !list.isArray() || list.isEmpty()) {
            return Optional.empty();
        }

        JsonNode lastPrice = list.get(0).get("lastPrice");
        if (lastPrice == null || lastPrice.isNull() || lastPrice.asText().isBlank()) {
            return Optional.empty();
        }

        try {
            return Optional.of(new BigDecimal(lastPrice.asText()));
        } catch (NumberFormatException e) {
            throw new MarketDataException("Malformed lastPrice for " + apiSymbol + ": " + lastPrice, e);
        }
    }

    @Override
    public String getProviderCode() {
        return "BYBIT";
    }

    /**
     * Execute a GET and return the {@code result} node of a retCode=0 response.
     */
    private JsonNode call(String url, String apiSymbol) throws MarketDataException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new MarketDataException("Bybit request timed out after " + timeout.toMillis() + "ms for " + apiSymbol, e);
        } catch (IOException e) {
            throw new MarketDataException("Bybit request failed for " + apiSymbol + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException("Bybit request interrupted for " + apiSymbol, e);
        }

        if (response.statusCode() != 200) {
            throw new MarketDataException("Bybit HTTP " + response.statusCode() + " for " + apiSymbol);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new MarketDataException("Bybit returned unparsable body for " + apiSymbol, e);
        }

        int retCode = root.path("retCode").asInt(-1);
        if (retCode != 0) {
            throw new MarketDataException("Bybit retCode " + retCode + " for " + apiSymbol + ": "
                + root.path("retMsg").asText(""));
        }

        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new MarketDataException("Bybit response for " + apiSymbol + " has no result");
        }
        return result;
    }

    private static BigDecimal optionalDecimal(JsonNode row, int index) {
        if (row.size() <= index) return null;
        String text = row.get(index).asText();
        return text == null || text.isBlank() ? null : new BigDecimal(text);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
