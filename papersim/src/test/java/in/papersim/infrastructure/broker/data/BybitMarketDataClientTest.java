package in.papersim.infrastructure.broker.data;

import in.papersim.broker.MarketDataException;
import in.papersim.domain.data.Candle;
import in.papersim.domain.data.Timeframe;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BybitMarketDataClient against a canned Bybit v5 server.
 */
class BybitMarketDataClientTest {

    private static final int TEST_PORT = 19092;

    private Undertow server;
    private BybitMarketDataClient client;

    private volatile int responseStatus = 200;
    private volatile String responseBody = "{}";
    private volatile String lastPath;
    private volatile String lastQuery;

    @BeforeEach
    void setUp() {
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path().addPrefixPath("/v5/market", exchange -> {
                lastPath = exchange.getRequestPath();
                lastQuery = exchange.getQueryString();
                exchange.setStatusCode(responseStatus);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.getResponseSender().send(responseBody);
            }))
            .build();
        server.start();

        client = new BybitMarketDataClient("http://localhost:" + TEST_PORT + "/", Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void getKlines_returnsBarsOldestFirst() throws Exception {
        // Arrange: newest first, as Bybit sends them
        responseBody = """
            {"retCode":0,"retMsg":"OK","result":{"category":"linear","symbol":"BTCUSDT","list":[
              ["1704070800000","101","103","100","102","12.5","1275"],
              ["1704067200000","100","102","99","101","10","1010"]
            ]}}
            """;
        Instant end = Instant.parse("2024-01-01T01:30:00Z");

        // Act
        List<Candle> candles = client.getKlines("BTCUSDT.P", Timeframe.HOUR_1, 2, end);

        // Assert
        assertEquals(2, candles.size());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), candles.get(0).startTime(), "Oldest bar first");
        assertEquals(0, new BigDecimal("102").compareTo(candles.get(1).close()));
        assertEquals(0, new BigDecimal("12.5").compareTo(candles.get(1).volume()));
        assertEquals("BTCUSDT", candles.get(0).symbol(), "Perpetual suffix stripped");

        assertEquals("/v5/market/kline", lastPath);
        assertTrue(lastQuery.contains("symbol=BTCUSDT&"), "Exchange symbol sent without .P: " + lastQuery);
        assertTrue(lastQuery.contains("interval=60"), "1h maps to interval 60: " + lastQuery);
        assertTrue(lastQuery.contains("end=" + end.toEpochMilli()), "End time in epoch millis: " + lastQuery);
    }

    @Test
    void getKlines_capsLimitAtProviderMaximum() throws Exception {
        responseBody = """
            {"retCode":0,"result":{"list":[]}}
            """;

        List<Candle> candles = client.getKlines("ETHUSDT", Timeframe.MINUTE_15, 5000, Instant.now());

        assertTrue(candles.isEmpty());
        assertTrue(lastQuery.contains("limit=1000"), "Limit capped: " + lastQuery);
    }

    @Test
    void getKlines_nonZeroRetCodeFails() {
        responseBody = """
            {"retCode":10001,"retMsg":"params error: symbol invalid","result":{}}
            """;

        MarketDataException e = assertThrows(MarketDataException.class,
            () -> client.getKlines("NOPEUSDT", Timeframe.HOUR_1, 10, Instant.now()));
        assertTrue(e.getMessage().contains("10001"), "Message should carry retCode: " + e.getMessage());
    }

    @Test
    void getKlines_httpErrorFails() {
        responseStatus = 503;
        responseBody = "{}";

        assertThrows(MarketDataException.class,
            () -> client.getKlines("BTCUSDT", Timeframe.HOUR_1, 10, Instant.now()));
    }

    @Test
    void getCurrentPrice_readsLastPrice() throws Exception {
        responseBody = """
            {"retCode":0,"result":{"category":"linear","list":[{"symbol":"SOLUSDT","lastPrice":"98.765"}]}}
            """;

        Optional<BigDecimal> price = client.getCurrentPrice("SOLUSDT.P");

        assertEquals(Optional.of(new BigDecimal("98.765")), price);
        assertEquals("/v5/market/tickers", lastPath);
        assertTrue(lastQuery.contains("symbol=SOLUSDT"), lastQuery);
    }

    @Test
    void getCurrentPrice_emptyListIsAbsent() throws Exception {
        responseBody = """
            {"retCode":0,"result":{"list":[]}}
            """;

        assertTrue(client.getCurrentPrice("SOLUSDT").isEmpty());
    }
}
