package in.papersim.infrastructure.metrics;

import java.time.Duration;

/**
 * Reconciler metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Trade transitions per action (filled, closed, cancelled)
 * - Check failures per kind (market data, strategy exit, exception)
 * - Audit events per type
 * - Pass duration and open trade count
 */
public interface ReconcilerMetrics {

    /**
     * Record a committed status transition.
     *
     * @param action filled | closed | cancelled
     */
    void recordTransition(String action);

    /**
     * Record a trade check that ended without a decision.
     *
     * @param kind no_candles | insufficient_lookback | exit_check | exception | ...
     */
    void recordCheckFailure(String kind);

    void recordAuditEvent(String type);

    void recordPassDuration(Duration duration);

    /**
     * Trades still open after the latest pass.
     */
    void setOpenTrades(int count);
}
