package in.papersim.service.trade;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import in.papersim.domain.trade.Trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-trade result of a reconciliation pass.
 *
 * {@code error} annotates a check that ended without a decision; it does not make the pass fail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconcileOutcome(
    @JsonProperty("trade_id") String tradeId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("action") Action action,
    @JsonProperty("current_price") BigDecimal currentPrice,
    @JsonProperty("instance_name") String instanceName,
    @JsonProperty("strategy_name") String strategyName,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("fill_timestamp") Instant fillTime,
    @JsonProperty("exit_reason") String exitReason,
    @JsonProperty("exit_timestamp") Instant exitTime,
    @JsonProperty("pnl") BigDecimal pnl,
    @JsonProperty("candles_checked") Integer candlesChecked,
    @JsonProperty("bars_open") Integer barsOpen,
    @JsonProperty("checked_at") Instant checkedAt,
    @JsonProperty("position_size_usd") BigDecimal positionSizeUsd,
    @JsonProperty("risk_amount_usd") BigDecimal riskAmountUsd,
    @JsonProperty("error") String error
) {
    public enum Action {
        CHECKED("checked"),
        FILLED("filled"),
        CLOSED("closed"),
        CANCELLED("cancelled");

        private final String code;

        Action(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }

    /**
     * Builder pre-filled with the trade's identity and sizing.
     */
    public static Builder forTrade(Trade trade, String timeframe, Instant checkedAt) {
        return new Builder(trade, timeframe, checkedAt);
    }

    public static final class Builder {
        private final Trade trade;
        private final String timeframe;
        private final Instant checkedAt;

        private Action action = Action.CHECKED;
        private BigDecimal currentPrice;
        private String strategyName;
        private Instant fillTime;
        private String exitReason;
        private Instant exitTime;
        private BigDecimal pnl;
        private Integer candlesChecked;
        private Integer barsOpen;
        private String error;
        private boolean fillCommitted;

        private Builder(Trade trade, String timeframe, Instant checkedAt) {
            this.trade = trade;
            this.timeframe = timeframe;
            this.checkedAt = checkedAt;
            this.strategyName = trade.strategyName();
        }

        public Builder action(Action action) {
            this.action = action;
            return this;
        }

        public Builder currentPrice(BigDecimal currentPrice) {
            this.currentPrice = currentPrice;
            return this;
        }

        public Builder strategyName(String strategyName) {
            this.strategyName = strategyName;
            return this;
        }

        public Builder fillTime(Instant fillTime) {
            this.fillTime = fillTime;
            return this;
        }

        public Builder exit(String reason, Instant time) {
            this.exitReason = reason;
            this.exitTime = time;
            return this;
        }

        public Builder pnl(BigDecimal pnl) {
            this.pnl = pnl;
            return this;
        }

        public Builder candlesChecked(int candlesChecked) {
            this.candlesChecked = candlesChecked;
            return this;
        }

        public Builder barsOpen(int barsOpen) {
            this.barsOpen = barsOpen;
            return this;
        }

        /**
         * The fill is persisted; whatever happens later in the check, the outcome reports it.
         */
        public Builder fillCommitted() {
            this.fillCommitted = true;
            this.action = Action.FILLED;
            return this;
        }

        public boolean isFillCommitted() {
            return fillCommitted;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public ReconcileOutcome build() {
            return new ReconcileOutcome(
                trade.id(), trade.symbol(), action,
                currentPrice != null ? currentPrice : BigDecimal.ZERO,
                trade.instanceName(), strategyName, timeframe,
                fillTime, exitReason, exitTime, pnl,
                candlesChecked, barsOpen, checkedAt,
                trade.positionSizeUsd(), trade.riskAmountUsd(),
                error);
        }
    }
}
