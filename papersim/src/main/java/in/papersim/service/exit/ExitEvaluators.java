package in.papersim.service.exit;

import in.papersim.domain.trade.StrategyType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exit evaluator per strategy family.
 */
public final class ExitEvaluators {

    private final Map<StrategyType, ExitEvaluator> evaluators;

    public ExitEvaluators(Map<StrategyType, ExitEvaluator> evaluators) {
        this.evaluators = new EnumMap<>(StrategyType.class);
        this.evaluators.putAll(evaluators);
    }

    public static ExitEvaluators of(ExitEvaluator priceBased, ExitEvaluator spreadBased) {
        return new ExitEvaluators(Map.of(
            StrategyType.PRICE_BASED, priceBased,
            StrategyType.SPREAD_BASED, spreadBased));
    }

    /**
     * Evaluator for a raw strategy_type value, empty when the type is unknown.
     */
    public Optional<ExitEvaluator> forStrategyType(String strategyType) {
        return StrategyType.fromCode(strategyType).map(evaluators::get);
    }
}
