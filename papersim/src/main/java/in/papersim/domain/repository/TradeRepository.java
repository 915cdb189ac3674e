package in.papersim.domain.repository;

import in.papersim.domain.trade.Trade;
import in.papersim.domain.trade.TradeSettlement;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for paper trades and the run aggregates they feed.
 *
 * Every mutation is guarded by the expected current status so a repeated call is a no-op.
 */
public interface TradeRepository {

    /**
     * Trades without realized P&L whose status is paper_trade, pending_fill or filled.
     */
    List<Trade> findOpenTrades();

    Optional<Trade> findById(String tradeId);

    /**
     * Mark a waiting trade as filled.
     *
     * @return false when the trade was no longer waiting to fill
     */
    boolean recordFill(String tradeId, BigDecimal fillPrice, BigDecimal pairFillPrice, Instant filledAt);

    /**
     * Cancel a trade that never filled. No exit price, no P&L, no aggregate change.
     */
    boolean cancelUnfilled(String tradeId, String reason, Instant cancelledAt);

    /**
     * Close or force-cancel a filled trade and add its P&L to the owning run, in one transaction.
     *
     * @return false when the trade was not in filled state (nothing written)
     */
    boolean settle(TradeSettlement settlement);

    /**
     * Return a trade to pending_fill, clearing fill and exit data. Reverses the trade's
     * contribution to the run aggregate when it had realized P&L.
     *
     * @return false when the trade does not exist
     */
    boolean resetToPending(String tradeId);
}
