package in.papersim.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of ReconcilerMetrics.
 *
 * Metrics:
 * - papersim_trades_transitioned_total{action}
 * - papersim_check_failures_total{kind}
 * - papersim_audit_events_total{type}
 * - papersim_pass_duration_seconds
 * - papersim_open_trades
 */
public class PrometheusReconcilerMetrics implements ReconcilerMetrics {

    private final CollectorRegistry registry;

    private final Counter transitions;
    private final Counter checkFailures;
    private final Counter auditEvents;
    private final Histogram passDuration;
    private final Gauge openTrades;

    public PrometheusReconcilerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusReconcilerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.transitions = Counter.build()
            .name("papersim_trades_transitioned_total")
            .help("Paper trade status transitions committed by the reconciler")
            .labelNames("action")
            .register(registry);

        this.checkFailures = Counter.build()
            .name("papersim_check_failures_total")
            .help("Trade checks that ended without a decision")
            .labelNames("kind")
            .register(registry);

        this.auditEvents = Counter.build()
            .name("papersim_audit_events_total")
            .help("Simulator audit events (invariant violations, rejected exits)")
            .labelNames("type")
            .register(registry);

        this.passDuration = Histogram.build()
            .name("papersim_pass_duration_seconds")
            .help("Duration of a reconciliation pass in seconds")
            .buckets(0.5, 1.0, 5.0, 15.0, 30.0, 60.0, 120.0, 300.0)
            .register(registry);

        this.openTrades = Gauge.build()
            .name("papersim_open_trades")
            .help("Trades still open after the latest reconciliation pass")
            .register(registry);
    }

    @Override
    public void recordTransition(String action) {
        transitions.labels(action).inc();
    }

    @Override
    public void recordCheckFailure(String kind) {
        checkFailures.labels(kind).inc();
    }

    @Override
    public void recordAuditEvent(String type) {
        auditEvents.labels(type).inc();
    }

    @Override
    public void recordPassDuration(Duration duration) {
        passDuration.observe(duration.toMillis() / 1000.0);
    }

    @Override
    public void setOpenTrades(int count) {
        openTrades.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
