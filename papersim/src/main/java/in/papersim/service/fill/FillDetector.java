package in.papersim.service.fill;

import in.papersim.domain.data.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Decides whether and where a waiting trade filled.
 *
 * Price-based trades fill on the first bar whose range touches the entry price.
 * Spread trades are signal driven and fill on the first bar at or after the signal at the
 * prices recorded with the signal.
 */
public final class FillDetector {
    private static final Logger log = LoggerFactory.getLogger(FillDetector.class);

    /**
     * First bar at index >= {@code fromIndex} with {@code low <= entry <= high}.
     */
    public FillResult detectPriceLevelFill(List<Candle> candles, BigDecimal entryPrice, int fromIndex) {
        if (entryPrice == null) {
            return FillResult.notFilled();
        }

        for (int i = Math.max(0, fromIndex); i < candles.size(); i++) {
            Candle candle = candles.get(i);
            if (candle.contains(entryPrice)) {
                log.debug("[Fill] Entry {} touched by bar {} [{} - {}]",
                    entryPrice, candle.startTime(), candle.low(), candle.high());
                return FillResult.at(entryPrice, null, candle.startTime(), i);
            }
        }
        return FillResult.notFilled();
    }

    /**
     * Signal fill for a spread trade at the first bar at index >= {@code fromIndex}.
     *
     * Requires a pair bar with a positive close at or before the fill bar.
     */
    public FillResult detectSignalFill(List<Candle> candles, List<Candle> pairCandles,
                                       BigDecimal entryPrice, BigDecimal pairEntryPrice, int fromIndex) {
        if (candles.isEmpty() || pairCandles.isEmpty() || entryPrice == null || pairEntryPrice == null) {
            return FillResult.notFilled();
        }
        if (fromIndex < 0 || fromIndex >= candles.size()) {
            return FillResult.notFilled();
        }

        Candle fillBar = candles.get(fromIndex);
        if (fillBar.close().signum() <= 0) {
            return FillResult.notFilled();
        }

        if (!hasPricedPairBar(pairCandles, fillBar.startTime())) {
            log.debug("[Fill] No priced pair bar at or before {}", fillBar.startTime());
            return FillResult.notFilled();
        }

        return FillResult.at(entryPrice, pairEntryPrice, fillBar.startTime(), fromIndex);
    }

    private static boolean hasPricedPairBar(List<Candle> pairCandles, Instant atOrBefore) {
        for (Candle pair : pairCandles) {
            if (pair.startTime().isAfter(atOrBefore)) {
                break;
            }
            if (pair.close().signum() > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the first bar starting at or after {@code time}, or -1.
     */
    public static int firstIndexAtOrAfter(List<Candle> candles, Instant time) {
        for (int i = 0; i < candles.size(); i++) {
            if (!candles.get(i).startTime().isBefore(time)) {
                return i;
            }
        }
        return -1;
    }
}
