package in.papersim.service.fill;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of a fill scan.
 *
 * @param fillIndex index of the fill bar in the scanned series, -1 when not filled
 * @param pairFillPrice only set for signal (spread) fills
 */
public record FillResult(
    boolean filled,
    BigDecimal fillPrice,
    BigDecimal pairFillPrice,
    Instant fillTime,
    int fillIndex
) {
    private static final FillResult NOT_FILLED = new FillResult(false, null, null, null, -1);

    public static FillResult notFilled() {
        return NOT_FILLED;
    }

    public static FillResult at(BigDecimal fillPrice, BigDecimal pairFillPrice, Instant fillTime, int fillIndex) {
        return new FillResult(true, fillPrice, pairFillPrice, fillTime, fillIndex);
    }
}
