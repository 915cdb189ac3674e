package in.papersim.domain.trade;

/**
 * Position direction. Stored as "Buy" / "Sell".
 */
public enum TradeSide {
    BUY("Buy"),
    SELL("Sell");

    private final String code;

    TradeSide(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isLong() {
        return this == BUY;
    }

    public static TradeSide fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Trade side is required");
        }
        return switch (code.trim().toLowerCase()) {
            case "buy", "long" -> BUY;
            case "sell", "short" -> SELL;
            default -> throw new IllegalArgumentException("Unknown trade side: " + code);
        };
    }
}
