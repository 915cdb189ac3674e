package in.papersim.util;

/**
 * Symbol helpers for exchange calls.
 */
public final class Symbols {

    /** Suffix used by charting feeds for perpetual contracts, e.g. BTCUSDT.P. */
    public static final String PERPETUAL_SUFFIX = ".P";

    /**
     * Strip the perpetual suffix before any call to the exchange.
     * Trade records keep the original symbol.
     */
    public static String toExchangeSymbol(String symbol) {
        if (symbol == null) return null;
        String trimmed = symbol.trim();
        if (trimmed.endsWith(PERPETUAL_SUFFIX)) {
            return trimmed.substring(0, trimmed.length() - PERPETUAL_SUFFIX.length());
        }
        return trimmed;
    }

    private Symbols() {}
}
