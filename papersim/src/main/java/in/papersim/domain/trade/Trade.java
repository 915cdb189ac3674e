package in.papersim.domain.trade;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Paper trade as seen by the reconciler.
 *
 * Row fields come from {@code trades}; timeframe, entry and levels fall back to the originating
 * recommendation; instance name and strategy name come from the owning run's instance.
 */
public record Trade(
        String id,
        String runId,
        String recommendationId,
        String instanceName,
        String strategyName,
        String symbol,
        TradeSide side,
        String strategyType, // price_based | spread_based | anything else is rejected at exit time
        String timeframe,

        // Entry plan
        BigDecimal entryPrice,
        BigDecimal quantity,
        BigDecimal stopLoss,
        BigDecimal takeProfit,
        JsonNode strategyMetadata,

        // Lifecycle
        TradeStatus status,
        BigDecimal fillPrice,
        Instant filledAt,
        BigDecimal exitPrice,
        String exitReason,
        BigDecimal pnl,
        BigDecimal pnlPercent,
        Instant closedAt,
        Instant cancelledAt,

        // Spread leg
        BigDecimal pairFillPrice,
        BigDecimal pairExitPrice,
        BigDecimal pairQuantity,

        // Sizing, reported back untouched
        BigDecimal positionSizeUsd,
        BigDecimal riskAmountUsd,

        // Timestamps
        Instant createdAt,
        Instant analyzedAt) {

    public boolean isLong() {
        return side == TradeSide.BUY;
    }

    public boolean isFilled() {
        return status == TradeStatus.FILLED && filledAt != null;
    }

    public Optional<StrategyType> strategyKind() {
        return StrategyType.fromCode(strategyType);
    }

    /**
     * Time the trading signal was generated. The recommendation's analysis time wins over the row's
     * creation time because a manual reset rewrites the latter.
     */
    public Instant signalTime() {
        return analyzedAt != null ? analyzedAt : createdAt;
    }

    public Optional<String> pairSymbol() {
        return metadataText("pair_symbol");
    }

    /**
     * Pair leg entry price recorded at signal time.
     */
    public Optional<BigDecimal> pairEntryPrice() {
        if (strategyMetadata == null) return Optional.empty();
        JsonNode node = strategyMetadata.get("price_y_at_entry");
        if (node == null || node.isNull()) return Optional.empty();
        if (node.isNumber()) return Optional.of(node.decimalValue());
        try {
            return Optional.of(new BigDecimal(node.asText().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private Optional<String> metadataText(String field) {
        if (strategyMetadata == null) return Optional.empty();
        JsonNode node = strategyMetadata.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) return Optional.empty();
        return Optional.of(node.asText());
    }

    /**
     * Copy reflecting a fill committed during the current pass.
     */
    public Trade withFill(BigDecimal newFillPrice, BigDecimal newPairFillPrice, Instant newFilledAt) {
        return new Trade(
                id, runId, recommendationId, instanceName, strategyName, symbol, side, strategyType, timeframe,
                entryPrice, quantity, stopLoss, takeProfit, strategyMetadata,
                TradeStatus.FILLED, newFillPrice, newFilledAt, exitPrice, exitReason, pnl, pnlPercent,
                closedAt, cancelledAt,
                newPairFillPrice != null ? newPairFillPrice : pairFillPrice, pairExitPrice, pairQuantity,
                positionSizeUsd, riskAmountUsd,
                createdAt, analyzedAt);
    }
}
