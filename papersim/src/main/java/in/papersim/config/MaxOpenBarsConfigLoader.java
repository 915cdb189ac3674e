package in.papersim.config;

import com.fasterxml.jackson.databind.JsonNode;
import in.papersim.domain.repository.SettingsRepository;
import in.papersim.domain.trade.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Loads {@link MaxOpenBarsPolicy} from the simulator's settings document.
 *
 * Expected shape:
 * <pre>
 * {
 *   "max_open_bars_before_filled": {"1h": 24, "4h": 12},
 *   "max_open_bars_after_filled_spread_based": {"1h": 96}
 * }
 * </pre>
 */
public final class MaxOpenBarsConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(MaxOpenBarsConfigLoader.class);

    public static final String DEFAULT_INSTANCE_ID = "simulator";

    private final SettingsRepository settingsRepo;
    private final String instanceId;

    public MaxOpenBarsConfigLoader(SettingsRepository settingsRepo, String instanceId) {
        this.settingsRepo = settingsRepo;
        this.instanceId = instanceId;
    }

    /**
     * Current policy. A missing or unreadable settings row yields an empty policy.
     */
    public MaxOpenBarsPolicy load() {
        Optional<JsonNode> settings;
        try {
            settings = settingsRepo.findSettings(instanceId);
        } catch (RuntimeException e) {
            log.warn("[MaxOpenBars] Failed to load settings '{}', max-bars checks disabled: {}", instanceId, e.getMessage());
            return MaxOpenBarsPolicy.empty();
        }

        if (settings.isEmpty() || !settings.get().isObject()) {
            log.warn("[MaxOpenBars] No settings for '{}', max-bars checks disabled", instanceId);
            return MaxOpenBarsPolicy.empty();
        }

        return parse(settings.get());
    }

    static MaxOpenBarsPolicy parse(JsonNode settings) {
        Map<MaxOpenBarsPolicy.Phase, Map<String, Integer>> global = new EnumMap<>(MaxOpenBarsPolicy.Phase.class);
        Map<MaxOpenBarsPolicy.Phase, Map<StrategyType, Map<String, Integer>>> byStrategy =
            new EnumMap<>(MaxOpenBarsPolicy.Phase.class);

        for (MaxOpenBarsPolicy.Phase phase : MaxOpenBarsPolicy.Phase.values()) {
            global.put(phase, table(settings, phase.settingsKey()));

            Map<StrategyType, Map<String, Integer>> tables = new EnumMap<>(StrategyType.class);
            for (StrategyType type : StrategyType.values()) {
                tables.put(type, table(settings, phase.settingsKey(type)));
            }
            byStrategy.put(phase, tables);
        }

        return new MaxOpenBarsPolicy(global, byStrategy);
    }

    private static Map<String, Integer> table(JsonNode settings, String key) {
        Map<String, Integer> table = new HashMap<>();
        JsonNode node = settings.get(key);
        if (node == null || !node.isObject()) {
            return table;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value.isNumber()) {
                table.put(entry.getKey(), value.asInt());
            } else if (value.isTextual()) {
                try {
                    table.put(entry.getKey(), Integer.parseInt(value.asText().trim()));
                } catch (NumberFormatException e) {
                    log.warn("[MaxOpenBars] {}.{} is not a number: '{}'", key, entry.getKey(), value.asText());
                }
            }
        }
        return table;
    }
}
