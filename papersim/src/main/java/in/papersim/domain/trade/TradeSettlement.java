package in.papersim.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Terminal transition of a filled trade, committed together with the run aggregate.
 *
 * @param status CLOSED for an exit signal, CANCELLED for a max-bars force close
 * @param cancelledAt set only when status is CANCELLED
 */
public record TradeSettlement(
    String tradeId,
    TradeStatus status,
    BigDecimal exitPrice,
    BigDecimal pairExitPrice,
    String exitReason,
    Instant closedAt,
    Instant cancelledAt,
    BigDecimal pnl,
    BigDecimal pnlPercent
) {
    public TradeSettlement {
        if (status != TradeStatus.CLOSED && status != TradeStatus.CANCELLED) {
            throw new IllegalArgumentException("Settlement status must be terminal, got " + status);
        }
        if (pnl == null) {
            throw new IllegalArgumentException("Settlement requires realized pnl");
        }
    }

    public boolean isWin() {
        return pnl.signum() > 0;
    }

    public boolean isLoss() {
        return pnl.signum() < 0;
    }
}
