package in.papersim.config;

import in.papersim.domain.trade.StrategyType;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Max bars a trade may stay open, per (timeframe, phase, strategy family).
 *
 * A strategy-specific table overrides the global table entry by entry. A missing entry or a
 * value <= 0 disables the check for that combination.
 */
public final class MaxOpenBarsPolicy {

    public enum Phase {
        BEFORE_FILL("max_open_bars_before_filled"),
        AFTER_FILL("max_open_bars_after_filled");

        private final String settingsKey;

        Phase(String settingsKey) {
            this.settingsKey = settingsKey;
        }

        public String settingsKey() {
            return settingsKey;
        }

        /** Settings key of the table specific to a strategy family. */
        public String settingsKey(StrategyType type) {
            return settingsKey + "_" + type.code();
        }
    }

    private static final MaxOpenBarsPolicy EMPTY = new MaxOpenBarsPolicy(Map.of(), Map.of());

    private final Map<Phase, Map<String, Integer>> global;
    private final Map<Phase, Map<StrategyType, Map<String, Integer>>> byStrategy;

    public MaxOpenBarsPolicy(Map<Phase, Map<String, Integer>> global,
                             Map<Phase, Map<StrategyType, Map<String, Integer>>> byStrategy) {
        this.global = new EnumMap<>(Phase.class);
        global.forEach((phase, table) -> this.global.put(phase, Map.copyOf(table)));
        this.byStrategy = new EnumMap<>(Phase.class);
        byStrategy.forEach((phase, tables) -> {
            Map<StrategyType, Map<String, Integer>> copy = new EnumMap<>(StrategyType.class);
            tables.forEach((type, table) -> copy.put(type, Map.copyOf(table)));
            this.byStrategy.put(phase, copy);
        });
    }

    /**
     * Policy with no limits; nothing is ever auto-cancelled.
     */
    public static MaxOpenBarsPolicy empty() {
        return EMPTY;
    }

    /**
     * Limit for a trade's timeframe label ("1h", "1D"), phase and raw strategy_type.
     * Unknown strategy types use the global table only.
     */
    public OptionalInt maxBars(String timeframeLabel, Phase phase, String strategyType) {
        if (timeframeLabel == null) {
            return OptionalInt.empty();
        }

        Map<String, Integer> table = new HashMap<>(global.getOrDefault(phase, Map.of()));
        Optional<StrategyType> kind = StrategyType.fromCode(strategyType);
        if (kind.isPresent()) {
            table.putAll(byStrategy.getOrDefault(phase, Map.of()).getOrDefault(kind.get(), Map.of()));
        }

        Integer value = table.get(timeframeLabel);
        if (value == null) {
            value = table.get(timeframeLabel.toLowerCase());
        }
        return value != null && value > 0 ? OptionalInt.of(value) : OptionalInt.empty();
    }

    public boolean isEmpty() {
        return global.values().stream().allMatch(Map::isEmpty)
            && byStrategy.values().stream().allMatch(m -> m.values().stream().allMatch(Map::isEmpty));
    }
}
