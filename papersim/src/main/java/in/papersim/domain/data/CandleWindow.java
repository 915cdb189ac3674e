package in.papersim.domain.data;

import java.time.Instant;

/**
 * Time range a strategy check needs: lookback bars before the signal plus every bar since.
 * Derived per trade, never persisted.
 */
public record CandleWindow(
    String symbol,
    Timeframe timeframe,
    Instant signalTime,
    int lookbackBars
) {
    public CandleWindow {
        if (lookbackBars < 0) {
            throw new IllegalArgumentException("lookbackBars must be >= 0, got " + lookbackBars);
        }
    }

    /**
     * signalTime - lookback * timeframe.
     */
    public Instant start() {
        return signalTime.minusMillis(lookbackBars * timeframe.getMillis());
    }

    /**
     * Bars elapsed since the signal, rounded up.
     */
    public long barsSinceSignal(Instant now) {
        long elapsed = Math.max(0, now.toEpochMilli() - signalTime.toEpochMilli());
        return (elapsed + timeframe.getMillis() - 1) / timeframe.getMillis();
    }

    /**
     * Lookback bars plus every bar since the signal.
     */
    public long totalBarsNeeded(Instant now) {
        return lookbackBars + barsSinceSignal(now);
    }
}
