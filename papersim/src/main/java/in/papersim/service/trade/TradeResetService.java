package in.papersim.service.trade;

import in.papersim.domain.repository.TradeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual reset of a paper trade back to pending_fill so the next pass re-simulates it.
 */
public final class TradeResetService {
    private static final Logger log = LoggerFactory.getLogger(TradeResetService.class);

    private final TradeRepository tradeRepo;

    public TradeResetService(TradeRepository tradeRepo) {
        this.tradeRepo = tradeRepo;
    }

    /**
     * @return false when no trade has this id
     */
    public boolean reset(String tradeId) {
        if (tradeId == null || tradeId.isBlank()) {
            throw new IllegalArgumentException("tradeId is required");
        }

        boolean reset = tradeRepo.resetToPending(tradeId);
        if (reset) {
            log.info("[TradeReset] Trade {} reset to pending_fill", tradeId);
        } else {
            log.warn("[TradeReset] Trade {} not found", tradeId);
        }
        return reset;
    }
}
