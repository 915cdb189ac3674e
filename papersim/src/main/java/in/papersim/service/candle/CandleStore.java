package in.papersim.service.candle;

import in.papersim.broker.MarketDataClient;
import in.papersim.broker.MarketDataException;
import in.papersim.domain.data.Candle;
import in.papersim.domain.data.CandleWindow;
import in.papersim.domain.data.Timeframe;
import in.papersim.domain.repository.CandleRepository;
import in.papersim.util.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Candle Store - read-through cache of complete bars (PostgreSQL + market data provider).
 *
 * Lookup order:
 * 1. Top up the cache if its newest bar is older than the latest complete bar.
 * 2. Serve from the cache when the range is covered without gaps.
 * 3. Otherwise fetch the whole range remotely, persist complete bars and return them.
 *
 * A remote failure never propagates: the cached bars are returned as they are (degraded mode).
 */
public final class CandleStore {
    private static final Logger log = LoggerFactory.getLogger(CandleStore.class);

    /** Bars requested when topping up a stale cache. */
    static final int FRESHNESS_FETCH_LIMIT = 200;

    /** Provider page size for range fetches. */
    static final int MAX_PAGE_SIZE = 1000;

    /** Two consecutive bars further apart than this many intervals mark a gap. */
    private static final double GAP_TOLERANCE = 1.5;

    private final CandleRepository candleRepo;
    private final MarketDataClient marketData;
    private final Clock clock;

    public CandleStore(CandleRepository candleRepo, MarketDataClient marketData) {
        this(candleRepo, marketData, Clock.systemUTC());
    }

    public CandleStore(CandleRepository candleRepo, MarketDataClient marketData, Clock clock) {
        this.candleRepo = candleRepo;
        this.marketData = marketData;
        this.clock = clock;
    }

    /**
     * Bars covering a trade's lookback plus everything since its signal.
     */
    public List<Candle> getWindow(CandleWindow window) {
        return getCandles(window.symbol(), window.timeframe(), window.start(), clock.instant());
    }

    /**
     * Complete bars with start in [from, to], ascending.
     *
     * @return empty when the provider cannot supply the full range
     */
    public List<Candle> getCandles(String symbol, Timeframe timeframe, Instant from, Instant to) {
        String key = Symbols.toExchangeSymbol(symbol);
        Instant now = clock.instant();
        Instant latestComplete = timeframe.latestCompleteBarStart(now);

        refreshIfStale(key, timeframe, latestComplete, now);

        List<Candle> cached = candleRepo.findRange(key, timeframe, from, to);
        if (coversRange(cached, timeframe, from, to, latestComplete)) {
            log.debug("[CandleStore] {} {}: {} cached bars cover {} .. {}",
                key, timeframe.getLabel(), cached.size(), from, to);
            return cached;
        }

        log.info("[CandleStore] {} {}: cache does not cover {} .. {} ({} bars cached), fetching from {}",
            key, timeframe.getLabel(), from, to, cached.size(), marketData.getProviderCode());

        try {
            return fetchRange(key, timeframe, from, to, latestComplete, now);
        } catch (MarketDataException e) {
            log.warn("[CandleStore] {} {}: remote fetch failed, serving {} cached bars: {}",
                key, timeframe.getLabel(), cached.size(), e.getMessage());
            return cached;
        }
    }

    /**
     * Last traded price from the provider, empty when unavailable.
     */
    public Optional<BigDecimal> getCurrentPrice(String symbol) {
        try {
            return marketData.getCurrentPrice(symbol);
        } catch (MarketDataException e) {
            log.warn("[CandleStore] Ticker unavailable for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    private void refreshIfStale(String symbol, Timeframe timeframe, Instant latestComplete, Instant now) {
        Optional<Candle> latest = candleRepo.findLatest(symbol, timeframe);
        if (latest.isPresent() && !latest.get().startTime().isBefore(latestComplete)) {
            return;
        }

        log.info("[CandleStore] {} {}: cache stale (latest={}, latest complete={}), topping up",
            symbol, timeframe.getLabel(), latest.map(Candle::startTime).orElse(null), latestComplete);

        try {
            List<Candle> fetched = marketData.getKlines(symbol, timeframe, FRESHNESS_FETCH_LIMIT, now);
            store(symbol, timeframe, fetched, now);
        } catch (MarketDataException e) {
            log.warn("[CandleStore] {} {}: top-up failed: {}", symbol, timeframe.getLabel(), e.getMessage());
        }
    }

    private List<Candle> fetchRange(String symbol, Timeframe timeframe, Instant from, Instant to,
                                    Instant latestComplete, Instant now) throws MarketDataException {
        int expected = expectedBars(timeframe, from, to, latestComplete);
        // One extra slot for the bar still in progress at the end of the range
        int remaining = expected + 1;

        TreeMap<Instant, Candle> bars = new TreeMap<>();
        Instant cursor = to.isAfter(now) ? now : to;

        while (remaining > 0) {
            int limit = Math.min(remaining, MAX_PAGE_SIZE);
            List<Candle> page = marketData.getKlines(symbol, timeframe, limit, cursor);
            if (page.isEmpty()) {
                break;
            }

            int added = 0;
            for (Candle c : page) {
                if (bars.putIfAbsent(c.startTime(), c) == null) added++;
            }
            remaining -= added;

            Instant oldest = page.get(0).startTime();
            if (page.size() < limit || added == 0 || !oldest.isAfter(from)) {
                break;
            }
            cursor = oldest.minusMillis(1);
        }

        List<Candle> fetched = new ArrayList<>(bars.values());
        store(symbol, timeframe, fetched, now);

        List<Candle> inRange = new ArrayList<>();
        for (Candle c : fetched) {
            if (!c.startTime().isBefore(from) && !c.startTime().isAfter(to) && timeframe.isComplete(c.startTime(), now)) {
                inRange.add(c);
            }
        }

        if (inRange.size() < expected) {
            log.error("[CandleStore] {} {}: insufficient bars from {}: got {}, need {}",
                symbol, timeframe.getLabel(), marketData.getProviderCode(), inRange.size(), expected);
            return List.of();
        }

        log.info("[CandleStore] {} {}: fetched {} bars ({} in range)",
            symbol, timeframe.getLabel(), fetched.size(), inRange.size());
        return inRange;
    }

    /**
     * Persist only bars whose interval has fully elapsed.
     */
    private void store(String symbol, Timeframe timeframe, List<Candle> candles, Instant now) {
        List<Candle> complete = new ArrayList<>(candles.size());
        for (Candle c : candles) {
            if (timeframe.isComplete(c.startTime(), now)) {
                complete.add(c);
            }
        }

        if (complete.size() < candles.size()) {
            log.debug("[CandleStore] {} {}: skipped {} incomplete bar(s)",
                symbol, timeframe.getLabel(), candles.size() - complete.size());
        }
        if (complete.isEmpty()) {
            return;
        }

        int inserted = candleRepo.insertBatch(complete);
        log.debug("[CandleStore] {} {}: stored {} new of {} complete bars",
            symbol, timeframe.getLabel(), inserted, complete.size());
    }

    /**
     * Cached bars cover [from, to] when they run gap-free from the first bar boundary inside the
     * range up to the newest bar that can be complete.
     */
    static boolean coversRange(List<Candle> cached, Timeframe timeframe, Instant from, Instant to,
                               Instant latestComplete) {
        if (cached.isEmpty()) {
            return false;
        }

        Instant first = cached.get(0).startTime();
        Instant last = cached.get(cached.size() - 1).startTime();
        Instant requiredLast = to.isBefore(latestComplete) ? to : latestComplete;

        if (first.isAfter(timeframe.ceil(from))) {
            return false;
        }
        if (last.isBefore(requiredLast)) {
            return false;
        }
        return !hasGaps(cached, timeframe);
    }

    static boolean hasGaps(List<Candle> candles, Timeframe timeframe) {
        double maxDelta = timeframe.getMillis() * GAP_TOLERANCE;
        for (int i = 1; i < candles.size(); i++) {
            long delta = candles.get(i).startMillis() - candles.get(i - 1).startMillis();
            if (delta > maxDelta) {
                log.debug("[CandleStore] Gap of {} bars before {}",
                    delta / timeframe.getMillis(), candles.get(i).startTime());
                return true;
            }
        }
        return false;
    }

    /**
     * Number of complete bars whose start falls in [from, to].
     */
    static int expectedBars(Timeframe timeframe, Instant from, Instant to, Instant latestComplete) {
        Instant firstStart = timeframe.ceil(from);
        Instant lastStart = timeframe.floor(to);
        if (lastStart.isAfter(latestComplete)) {
            lastStart = latestComplete;
        }
        if (lastStart.isBefore(firstStart)) {
            return 0;
        }
        return (int) ((lastStart.toEpochMilli() - firstStart.toEpochMilli()) / timeframe.getMillis()) + 1;
    }
}
