package in.papersim.domain.trade;

import java.util.Optional;

/**
 * Strategy family of a trade. Decides fill semantics, exit logic and lookback.
 */
public enum StrategyType {
    /** Single instrument with fixed stop-loss / take-profit levels. */
    PRICE_BASED("price_based", 1),
    /** Paired instruments, entry and exit driven by a relative-value signal. */
    SPREAD_BASED("spread_based", 120);

    /** Lookback used when the strategy type is missing or not recognised. */
    public static final int UNKNOWN_LOOKBACK_BARS = 120;

    private final String code;
    private final int lookbackBars;

    StrategyType(String code, int lookbackBars) {
        this.code = code;
        this.lookbackBars = lookbackBars;
    }

    public String code() {
        return code;
    }

    public int getLookbackBars() {
        return lookbackBars;
    }

    public static Optional<StrategyType> fromCode(String code) {
        if (code == null) return Optional.empty();
        for (StrategyType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static int lookbackFor(String code) {
        return fromCode(code).map(StrategyType::getLookbackBars).orElse(UNKNOWN_LOOKBACK_BARS);
    }
}
