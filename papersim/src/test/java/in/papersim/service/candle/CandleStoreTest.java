package in.papersim.service.candle;

import in.papersim.broker.MarketDataClient;
import in.papersim.broker.MarketDataException;
import in.papersim.domain.data.Candle;
import in.papersim.domain.data.Timeframe;
import in.papersim.domain.repository.CandleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CandleStoreTest {

    private static final Timeframe TF = Timeframe.HOUR_1;
    private static final long HOUR_MS = TF.getMillis();

    // Latest complete 1h bar at NOW starts 2024-01-01T23:00Z
    private static final Instant NOW = Instant.parse("2024-01-02T00:30:00Z");
    private static final Instant LATEST_COMPLETE = Instant.parse("2024-01-01T23:00:00Z");
    private static final Instant FROM = Instant.parse("2024-01-01T10:00:00Z");

    @Mock
    private CandleRepository candleRepo;
    @Mock
    private MarketDataClient marketData;

    private CandleStore store;

    @BeforeEach
    void setUp() {
        store = new CandleStore(candleRepo, marketData, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Candle bar(Instant start) {
        return Candle.of("BTCUSDT", TF, start, 100, 101, 99, 100);
    }

    /** Consecutive hourly bars from {@code first} through {@code last} inclusive. */
    private static List<Candle> hourly(Instant first, Instant last) {
        List<Candle> bars = new ArrayList<>();
        for (Instant t = first; !t.isAfter(last); t = t.plusMillis(HOUR_MS)) {
            bars.add(bar(t));
        }
        return bars;
    }

    @Test
    void coveredRange_isServedFromCache() throws Exception {
        // Arrange
        List<Candle> cached = hourly(FROM, LATEST_COMPLETE);
        when(candleRepo.findLatest("BTCUSDT", TF)).thenReturn(Optional.of(bar(LATEST_COMPLETE)));
        when(candleRepo.findRange("BTCUSDT", TF, FROM, NOW)).thenReturn(cached);

        // Act
        List<Candle> result = store.getCandles("BTCUSDT.P", TF, FROM, NOW);

        // Assert
        assertEquals(cached, result, "Cache hit returns the cached bars");
        verifyNoInteractions(marketData);
    }

    @Test
    void staleCache_isToppedUpWithCompleteBarsOnly() throws Exception {
        // Arrange
        when(candleRepo.findLatest("BTCUSDT", TF)).thenReturn(Optional.of(bar(LATEST_COMPLETE.minusMillis(HOUR_MS))));
        // Provider returns the in-progress 00:00 bar too
        when(marketData.getKlines("BTCUSDT", TF, CandleStore.FRESHNESS_FETCH_LIMIT, NOW))
            .thenReturn(hourly(LATEST_COMPLETE.minusMillis(HOUR_MS), LATEST_COMPLETE.plusMillis(HOUR_MS)));
        when(candleRepo.findRange("BTCUSDT", TF, FROM, NOW)).thenReturn(hourly(FROM, LATEST_COMPLETE));

        // Act
        store.getCandles("BTCUSDT", TF, FROM, NOW);

        // Assert
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Candle>> stored = ArgumentCaptor.forClass(List.class);
        verify(candleRepo).insertBatch(stored.capture());
        assertEquals(2, stored.getValue().size(), "The bar still in progress must not be stored");
        assertEquals(LATEST_COMPLETE, stored.getValue().get(1).startTime());
    }

    @Test
    void gapInCache_triggersFullFetch() throws Exception {
        // Arrange
        List<Candle> withGap = new ArrayList<>(hourly(FROM, LATEST_COMPLETE));
        withGap.remove(5);
        when(candleRepo.findLatest("BTCUSDT", TF)).thenReturn(Optional.of(bar(LATEST_COMPLETE)));
        when(candleRepo.findRange("BTCUSDT", TF, FROM, NOW)).thenReturn(withGap);
        when(marketData.getKlines(eq("BTCUSDT"), eq(TF), anyInt(), eq(NOW)))
            .thenReturn(hourly(FROM, LATEST_COMPLETE.plusMillis(HOUR_MS)));

        // Act
        List<Candle> result = store.getCandles("BTCUSDT", TF, FROM, NOW);

        // Assert
        assertEquals(14, result.size(), "10:00 through 23:00");
        assertEquals(FROM, result.get(0).startTime());
        assertEquals(LATEST_COMPLETE, result.get(result.size() - 1).startTime(), "In-progress bar excluded");
        verify(marketData).getKlines("BTCUSDT", TF, 15, NOW);
    }

    @Test
    void cacheMissingFirstBar_isNotCovered() {
        List<Candle> late = hourly(FROM.plusMillis(HOUR_MS), LATEST_COMPLETE);

        assertFalse(CandleStore.coversRange(late, TF, FROM, NOW, LATEST_COMPLETE),
            "A cache starting one bar late misses a lookback bar");
        assertTrue(CandleStore.coversRange(hourly(FROM, LATEST_COMPLETE), TF, FROM.minusMillis(1), NOW, LATEST_COMPLETE),
            "from just before a boundary only needs the bar at that boundary");
    }

    @Test
    void shortProviderHistory_returnsEmpty() throws Exception {
        // Arrange
        when(candleRepo.findLatest("BTCUSDT", TF)).thenReturn(Optional.of(bar(LATEST_COMPLETE)));
        when(candleRepo.findRange("BTCUSDT", TF, FROM, NOW)).thenReturn(List.of());
        when(marketData.getKlines(eq("BTCUSDT"), eq(TF), anyInt(), eq(NOW)))
            .thenReturn(hourly(LATEST_COMPLETE.minusMillis(4 * HOUR_MS), LATEST_COMPLETE));

        // Act
        List<Candle> result = store.getCandles("BTCUSDT", TF, FROM, NOW);

        // Assert
        assertTrue(result.isEmpty(), "Fewer bars than the window needs means no candles");
        verify(candleRepo).insertBatch(any());
    }

    @Test
    void providerDown_servesWhateverIsCached() throws Exception {
        // Arrange
        List<Candle> partial = hourly(FROM, FROM.plusMillis(2 * HOUR_MS));
        when(candleRepo.findLatest("BTCUSDT", TF)).thenReturn(Optional.empty());
        when(candleRepo.findRange("BTCUSDT", TF, FROM, NOW)).thenReturn(partial);
        when(marketData.getKlines(eq("BTCUSDT"), eq(TF), anyInt(), any()))
            .thenThrow(new MarketDataException("Bybit HTTP 503 for BTCUSDT"));

        // Act
        List<Candle> result = store.getCandles("BTCUSDT", TF, FROM, NOW);

        // Assert
        assertEquals(partial, result, "Degraded mode returns the cache as is");
        verify(candleRepo, never()).insertBatch(any());
    }

    @Test
    void longRange_isPagedBackwards() throws Exception {
        // Arrange: 1500 complete bars needed, provider pages are capped at 1000
        Instant from = LATEST_COMPLETE.minusMillis(1499 * HOUR_MS);
        when(candleRepo.findLatest("BTCUSDT", TF)).thenReturn(Optional.of(bar(LATEST_COMPLETE)));
        when(candleRepo.findRange("BTCUSDT", TF, from, NOW)).thenReturn(List.of());
        when(marketData.getKlines(eq("BTCUSDT"), eq(TF), anyInt(), any())).thenAnswer(invocation -> {
            int limit = invocation.getArgument(2);
            Instant end = TF.floor(invocation.getArgument(3));
            return hourly(end.minusMillis((limit - 1) * HOUR_MS), end);
        });

        // Act
        List<Candle> result = store.getCandles("BTCUSDT", TF, from, NOW);

        // Assert
        assertEquals(1500, result.size());
        assertEquals(from, result.get(0).startTime());
        assertFalse(CandleStore.hasGaps(result, TF), "Pages must stitch without gaps");

        verify(marketData).getKlines("BTCUSDT", TF, 1000, NOW);
        Instant secondCursor = TF.floor(NOW).minusMillis(999 * HOUR_MS).minusMillis(1);
        verify(marketData).getKlines("BTCUSDT", TF, 501, secondCursor);
    }

    @Test
    void expectedBars_countsCompleteBoundariesInRange() {
        assertEquals(14, CandleStore.expectedBars(TF, FROM, NOW, LATEST_COMPLETE));
        assertEquals(13, CandleStore.expectedBars(TF, FROM.plusMillis(1), NOW, LATEST_COMPLETE),
            "A range starting mid-bar skips that bar");
        assertEquals(0, CandleStore.expectedBars(TF, NOW, NOW, LATEST_COMPLETE));
    }
}
