package in.papersim.service.exit;

import in.papersim.domain.data.Candle;
import in.papersim.domain.trade.Trade;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input to an exit evaluation.
 *
 * @param candles full window including lookback bars
 * @param pairCandles pair leg window, empty for single-leg trades
 * @param startIndex first bar eligible to trigger an exit
 */
public record ExitRequest(
    Trade trade,
    String strategyName,
    List<Candle> candles,
    List<Candle> pairCandles,
    int startIndex
) {
    public ExitRequest {
        candles = List.copyOf(candles);
        pairCandles = pairCandles != null ? List.copyOf(pairCandles) : List.of();
    }

    /**
     * Close of the newest bar, null for an empty window.
     */
    public BigDecimal lastClose() {
        return candles.isEmpty() ? null : candles.get(candles.size() - 1).close();
    }
}
