package in.papersim.service.exit;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Exit signal produced by an evaluator.
 *
 * @param reason sl_hit, tp_hit or a strategy-specific reason
 * @param pairExitPrice pair leg exit price, spread trades only
 */
public record ExitDecision(
    String reason,
    BigDecimal exitPrice,
    BigDecimal pairExitPrice,
    Instant exitTime,
    BigDecimal currentPrice
) {
    public static final String SL_HIT = "sl_hit";
    public static final String TP_HIT = "tp_hit";

    public boolean isPriceLevelExit() {
        return SL_HIT.equals(reason) || TP_HIT.equals(reason);
    }
}
