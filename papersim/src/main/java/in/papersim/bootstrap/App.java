package in.papersim.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.papersim.broker.MarketDataClient;
import in.papersim.config.MaxOpenBarsConfigLoader;
import in.papersim.domain.repository.CandleRepository;
import in.papersim.domain.repository.SettingsRepository;
import in.papersim.domain.repository.SimulatorErrorRepository;
import in.papersim.domain.repository.TradeRepository;
import in.papersim.infrastructure.broker.data.BybitMarketDataClient;
import in.papersim.infrastructure.metrics.PrometheusMetricsHandler;
import in.papersim.infrastructure.metrics.PrometheusReconcilerMetrics;
import in.papersim.migration.SimulatorSchemaMigration;
import in.papersim.repository.PostgresCandleRepository;
import in.papersim.repository.PostgresSettingsRepository;
import in.papersim.repository.PostgresSimulatorErrorRepository;
import in.papersim.repository.PostgresTradeRepository;
import in.papersim.service.audit.SimulatorAuditLog;
import in.papersim.service.candle.CandleStore;
import in.papersim.service.execution.ReconcilerScheduler;
import in.papersim.service.exit.ExitEvaluators;
import in.papersim.service.exit.PriceLevelExitEvaluator;
import in.papersim.service.exit.SpreadExitEvaluator;
import in.papersim.service.fill.FillDetector;
import in.papersim.service.trade.LifecycleReconciler;
import in.papersim.service.trade.PnlCalculator;
import in.papersim.service.trade.TradeResetService;
import in.papersim.service.validation.TimestampInvariantChecker;
import in.papersim.transport.http.SimulatorHandler;
import in.papersim.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * PaperSim entry point (NO Spring).
 *
 * Wires the reconciliation engine:
 * - PostgreSQL repositories (HikariCP)
 * - Bybit market data with a PostgreSQL bar cache
 * - Price-level and strategy-script exit evaluators
 * - HTTP batch trigger, Prometheus /metrics and the fixed-delay scheduler
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== PaperSim Reconciler Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("HTTP_PORT", 9091);
        int workerThreads = Env.getInt("RECONCILER_THREADS", 1);
        Duration interval = Env.getSeconds("RECONCILE_INTERVAL_SECONDS", 60);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();

        new SimulatorSchemaMigration(dataSource).migrate();

        TradeRepository tradeRepo = new PostgresTradeRepository(dataSource);
        CandleRepository candleRepo = new PostgresCandleRepository(dataSource);
        SettingsRepository settingsRepo = new PostgresSettingsRepository(dataSource);
        SimulatorErrorRepository errorRepo = new PostgresSimulatorErrorRepository(dataSource);
        log.info("✓ Repositories initialized");

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusReconcilerMetrics metrics = new PrometheusReconcilerMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Market data + candle cache
        // ═══════════════════════════════════════════════════════════════
        MarketDataClient marketData = new BybitMarketDataClient(
            Env.get("BYBIT_BASE_URL", BybitMarketDataClient.DEFAULT_BASE_URL),
            Env.getMillis("MARKET_DATA_TIMEOUT_MS", BybitMarketDataClient.DEFAULT_TIMEOUT.toMillis()));
        CandleStore candleStore = new CandleStore(candleRepo, marketData);
        log.info("✓ Candle store initialized (provider={})", marketData.getProviderCode());

        // ═══════════════════════════════════════════════════════════════
        // Exit evaluators
        // ═══════════════════════════════════════════════════════════════
        SpreadExitEvaluator spreadExit = new SpreadExitEvaluator(
            Env.get("STRATEGY_EXIT_PYTHON", "python3"),
            Env.get("STRATEGY_EXIT_SCRIPT", "python/check_strategy_exit.py"),
            Env.getSeconds("STRATEGY_EXIT_TIMEOUT_SECONDS", SpreadExitEvaluator.DEFAULT_TIMEOUT.toSeconds()));
        ExitEvaluators exitEvaluators = ExitEvaluators.of(new PriceLevelExitEvaluator(), spreadExit);

        // ═══════════════════════════════════════════════════════════════
        // Reconciler
        // ═══════════════════════════════════════════════════════════════
        MaxOpenBarsConfigLoader maxBarsLoader = new MaxOpenBarsConfigLoader(settingsRepo,
            Env.get("SIMULATOR_SETTINGS_INSTANCE", MaxOpenBarsConfigLoader.DEFAULT_INSTANCE_ID));
        SimulatorAuditLog auditLog = new SimulatorAuditLog(errorRepo, metrics);

        LifecycleReconciler reconciler = new LifecycleReconciler(
            tradeRepo,
            candleStore,
            new FillDetector(),
            exitEvaluators,
            maxBarsLoader,
            new TimestampInvariantChecker(),
            new PnlCalculator(),
            auditLog,
            metrics,
            Clock.systemUTC(),
            workerThreads);
        TradeResetService resetService = new TradeResetService(tradeRepo);
        log.info("✓ Lifecycle reconciler initialized (threads={})", workerThreads);

        ReconcilerScheduler scheduler = new ReconcilerScheduler(reconciler, interval);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        SimulatorHandler api = new SimulatorHandler(reconciler, resetService);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .post("/api/simulator/auto-close", api::autoClose)
            .post("/api/simulator/reset-trade", api::resetTrade);

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        scheduler.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down PaperSim...");
            scheduler.stop();
            server.stop();
            reconciler.close();
            dataSource.close();
            log.info("PaperSim stopped");
        }, "papersim-shutdown"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("PaperSim started on http://localhost:{}/", port);
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/papersim");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("papersim-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
