package in.papersim.service.trade;

import in.papersim.domain.trade.StrategyType;
import in.papersim.domain.trade.Trade;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Realized P&L of a settled trade, rounded half-up to cents.
 *
 * Single leg: (exit - fill) * qty for longs, (fill - exit) * qty for shorts; percent of fill * qty.
 * Spread: main leg as above plus the pair leg in the opposite direction; percent of the combined
 * notional of both legs.
 */
public final class PnlCalculator {

    private static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public record Pnl(BigDecimal amount, BigDecimal percent) {
    }

    /**
     * P&L of a filled trade exiting at {@code exitPrice} (and {@code pairExitPrice} for spreads).
     * Falls back to the single-leg formula when any pair value is missing.
     */
    public Pnl calculate(Trade trade, BigDecimal exitPrice, BigDecimal pairExitPrice) {
        BigDecimal fill = trade.fillPrice() != null ? trade.fillPrice() : trade.entryPrice();
        BigDecimal qty = trade.quantity();
        if (fill == null || qty == null || exitPrice == null) {
            throw new IllegalArgumentException("P&L needs fill price, quantity and exit price for trade " + trade.id());
        }

        boolean isLong = trade.isLong();
        BigDecimal mainPnl = legPnl(isLong, fill, exitPrice, qty);
        BigDecimal notional = fill.multiply(qty);
        BigDecimal total = mainPnl;

        boolean spread = trade.strategyKind().orElse(null) == StrategyType.SPREAD_BASED
            && trade.pairQuantity() != null
            && trade.pairFillPrice() != null
            && pairExitPrice != null;

        if (spread) {
            // Pair leg runs opposite to the main leg
            total = total.add(legPnl(!isLong, trade.pairFillPrice(), pairExitPrice, trade.pairQuantity()));
            notional = notional.add(trade.pairFillPrice().multiply(trade.pairQuantity()));
        }

        return new Pnl(round(total), percent(total, notional));
    }

    private static BigDecimal legPnl(boolean isLong, BigDecimal fill, BigDecimal exit, BigDecimal qty) {
        BigDecimal move = isLong ? exit.subtract(fill) : fill.subtract(exit);
        return move.multiply(qty);
    }

    private static BigDecimal percent(BigDecimal pnl, BigDecimal notional) {
        if (notional.signum() <= 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return round(pnl.divide(notional, MathContext.DECIMAL64).multiply(HUNDRED));
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
