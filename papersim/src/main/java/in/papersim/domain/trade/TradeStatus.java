package in.papersim.domain.trade;

/**
 * Paper trade lifecycle status as stored in {@code trades.status}.
 *
 * PAPER_TRADE is the legacy name for a trade waiting to fill and is treated exactly like PENDING_FILL.
 */
public enum TradeStatus {
    PAPER_TRADE("paper_trade"),
    PENDING_FILL("pending_fill"),
    FILLED("filled"),
    CLOSED("closed"),
    CANCELLED("cancelled");

    private final String code;

    TradeStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isAwaitingFill() {
        return this == PAPER_TRADE || this == PENDING_FILL;
    }

    public boolean isTerminal() {
        return this == CLOSED || this == CANCELLED;
    }

    public static TradeStatus fromCode(String code) {
        if (code != null) {
            for (TradeStatus status : values()) {
                if (status.code.equalsIgnoreCase(code.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown trade status: " + code);
    }
}
