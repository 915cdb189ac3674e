package in.papersim.service.trade;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Counters and per-trade results of one reconciliation pass.
 *
 * Counters follow the final action of each trade: a trade filled and closed in the same pass
 * counts as closed only.
 */
public record ReconcilePassSummary(
    @JsonProperty("checked") int checked,
    @JsonProperty("filled") int filled,
    @JsonProperty("closed") int closed,
    @JsonProperty("cancelled") int cancelled,
    @JsonProperty("still_open") int stillOpen,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("results") List<ReconcileOutcome> results
) {
    public static ReconcilePassSummary of(List<ReconcileOutcome> results, long durationMs) {
        int filled = 0;
        int closed = 0;
        int cancelled = 0;
        for (ReconcileOutcome outcome : results) {
            switch (outcome.action()) {
                case FILLED -> filled++;
                case CLOSED -> closed++;
                case CANCELLED -> cancelled++;
                default -> { }
            }
        }
        int checked = results.size();
        return new ReconcilePassSummary(checked, filled, closed, cancelled,
            checked - filled - closed - cancelled, durationMs, List.copyOf(results));
    }
}
