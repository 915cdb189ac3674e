package in.papersim.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Completed OHLCV bar.
 *
 * Identity is (symbol, timeframe, startTime). Volume and turnover are optional.
 */
public record Candle(
    String symbol,
    Timeframe timeframe,
    Instant startTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal turnover
) {
    /**
     * True when the bar's [low, high] range contains {@code price}.
     */
    public boolean contains(BigDecimal price) {
        return low.compareTo(price) <= 0 && price.compareTo(high) <= 0;
    }

    public long startMillis() {
        return startTime.toEpochMilli();
    }

    public static Candle of(String symbol, Timeframe tf, Instant start,
                            double o, double h, double l, double c) {
        return new Candle(
            symbol, tf, start,
            BigDecimal.valueOf(o),
            BigDecimal.valueOf(h),
            BigDecimal.valueOf(l),
            BigDecimal.valueOf(c),
            null, null
        );
    }
}
