package in.papersim.service.exit;

import in.papersim.domain.data.Candle;
import in.papersim.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;

/**
 * Stop-loss / take-profit scan over historical bars.
 *
 * Long: SL when low <= SL, TP when high >= TP. Short: SL when high >= SL, TP when low <= TP.
 * When one bar touches both, the level closer to the bar's open is taken as hit first;
 * an equal distance resolves to TP.
 */
public final class PriceLevelExitEvaluator implements ExitEvaluator {
    private static final Logger log = LoggerFactory.getLogger(PriceLevelExitEvaluator.class);

    @Override
    public ExitCheck evaluate(ExitRequest request) {
        Trade trade = request.trade();
        BigDecimal stopLoss = trade.stopLoss();
        BigDecimal takeProfit = trade.takeProfit();
        if (stopLoss == null || takeProfit == null) {
            return ExitCheck.failed("Missing stop_loss or take_profit");
        }
        if (trade.side() == null) {
            return ExitCheck.failed("Missing trade side");
        }

        List<Candle> candles = request.candles();
        BigDecimal currentPrice = request.lastClose();
        boolean isLong = trade.isLong();

        for (int i = Math.max(0, request.startIndex()); i < candles.size(); i++) {
            Candle candle = candles.get(i);

            boolean slHit = isLong
                ? candle.low().compareTo(stopLoss) <= 0
                : candle.high().compareTo(stopLoss) >= 0;
            boolean tpHit = isLong
                ? candle.high().compareTo(takeProfit) >= 0
                : candle.low().compareTo(takeProfit) <= 0;

            if (!slHit && !tpHit) {
                continue;
            }

            boolean stopFirst = slHit && (!tpHit || stopCloserToOpen(candle, stopLoss, takeProfit));
            String reason = stopFirst ? ExitDecision.SL_HIT : ExitDecision.TP_HIT;
            BigDecimal level = stopFirst ? stopLoss : takeProfit;

            log.debug("[Exit] {} {} {} at bar {} ({}) [{} - {}]",
                trade.symbol(), isLong ? "LONG" : "SHORT", reason, i, candle.startTime(), candle.low(), candle.high());

            return ExitCheck.exit(new ExitDecision(reason, level, null, candle.startTime(), currentPrice));
        }

        return ExitCheck.noExit(currentPrice);
    }

    private static boolean stopCloserToOpen(Candle candle, BigDecimal stopLoss, BigDecimal takeProfit) {
        BigDecimal toStop = candle.open().subtract(stopLoss).abs();
        BigDecimal toTarget = candle.open().subtract(takeProfit).abs();
        return toStop.compareTo(toTarget) < 0;
    }
}
