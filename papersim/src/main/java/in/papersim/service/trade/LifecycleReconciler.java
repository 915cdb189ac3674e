package in.papersim.service.trade;

import in.papersim.config.MaxOpenBarsConfigLoader;
import in.papersim.config.MaxOpenBarsPolicy;
import in.papersim.domain.common.ValidationResult;
import in.papersim.domain.data.Candle;
import in.papersim.domain.data.CandleWindow;
import in.papersim.domain.data.Timeframe;
import in.papersim.domain.repository.TradeRepository;
import in.papersim.domain.trade.StrategyType;
import in.papersim.domain.trade.Trade;
import in.papersim.domain.trade.TradeSettlement;
import in.papersim.domain.trade.TradeStatus;
import in.papersim.infrastructure.metrics.ReconcilerMetrics;
import in.papersim.service.audit.AuditEventType;
import in.papersim.service.audit.SimulatorAuditLog;
import in.papersim.service.candle.CandleStore;
import in.papersim.service.exit.ExitCheck;
import in.papersim.service.exit.ExitDecision;
import in.papersim.service.exit.ExitEvaluator;
import in.papersim.service.exit.ExitEvaluators;
import in.papersim.service.exit.ExitRequest;
import in.papersim.service.fill.FillDetector;
import in.papersim.service.fill.FillResult;
import in.papersim.service.validation.TimestampInvariantChecker;
import in.papersim.util.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives every open paper trade through pending -> filled -> closed/cancelled against historical bars.
 *
 * One pass:
 * 1. Load open trades and the max-open-bars policy.
 * 2. Group trades by (symbol, timeframe); groups run on a bounded worker pool, trades within a
 *    group run in order.
 * 3. Per trade: fetch bars, detect the fill, evaluate the exit, enforce max-open-bars.
 *
 * Every write is a guarded conditional update, so repeating a pass over the same data changes nothing.
 * A failing trade becomes a "checked" outcome carrying the error; it never aborts the pass.
 */
public final class LifecycleReconciler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LifecycleReconciler.class);

    static final String MAX_BARS_EXCEEDED = "max_bars_exceeded";

    private final TradeRepository tradeRepo;
    private final CandleStore candleStore;
    private final FillDetector fillDetector;
    private final ExitEvaluators exitEvaluators;
    private final MaxOpenBarsConfigLoader maxBarsLoader;
    private final TimestampInvariantChecker invariants;
    private final PnlCalculator pnlCalculator;
    private final SimulatorAuditLog auditLog;
    private final ReconcilerMetrics metrics;
    private final Clock clock;
    private final ExecutorService workers;

    private final AtomicBoolean passRunning = new AtomicBoolean(false);
    private volatile boolean closed = false;

    public LifecycleReconciler(
            TradeRepository tradeRepo,
            CandleStore candleStore,
            FillDetector fillDetector,
            ExitEvaluators exitEvaluators,
            MaxOpenBarsConfigLoader maxBarsLoader,
            TimestampInvariantChecker invariants,
            PnlCalculator pnlCalculator,
            SimulatorAuditLog auditLog,
            ReconcilerMetrics metrics,
            Clock clock,
            int workerThreads) {
        this.tradeRepo = tradeRepo;
        this.candleStore = candleStore;
        this.fillDetector = fillDetector;
        this.exitEvaluators = exitEvaluators;
        this.maxBarsLoader = maxBarsLoader;
        this.invariants = invariants;
        this.pnlCalculator = pnlCalculator;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.clock = clock;

        AtomicInteger threadNumber = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads),
            r -> new Thread(r, "reconciler-worker-" + threadNumber.incrementAndGet()));
    }

    /**
     * Run one pass unless another is already in progress.
     *
     * @return empty when a pass is already running
     */
    public Optional<ReconcilePassSummary> tryRunPass() {
        if (closed) {
            throw new IllegalStateException("Reconciler is closed");
        }
        if (!passRunning.compareAndSet(false, true)) {
            log.warn("[Reconciler] Pass already in progress, skipping");
            return Optional.empty();
        }
        try {
            return Optional.of(doRunPass());
        } finally {
            passRunning.set(false);
        }
    }

    /**
     * Run one pass.
     *
     * @throws IllegalStateException when a pass is already running or the reconciler is closed
     */
    public ReconcilePassSummary runPass() {
        return tryRunPass().orElseThrow(() -> new IllegalStateException("Reconciliation pass already in progress"));
    }

    public boolean isPassRunning() {
        return passRunning.get();
    }

    private ReconcilePassSummary doRunPass() {
        Instant start = clock.instant();
        log.info("════════════════════════════════════════════════════════");
        log.info("[Reconciler] Pass started at {}", start);

        List<Trade> trades = tradeRepo.findOpenTrades();
        MaxOpenBarsPolicy policy = maxBarsLoader.load();
        log.info("[Reconciler] {} open trades, max-bars policy {}", trades.size(), policy.isEmpty() ? "empty" : "loaded");

        ReconcileOutcome[] outcomes = new ReconcileOutcome[trades.size()];

        // Same (symbol, timeframe) never runs concurrently
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < trades.size(); i++) {
            groups.computeIfAbsent(groupKey(trades.get(i)), k -> new ArrayList<>()).add(i);
        }

        List<Future<?>> futures = new ArrayList<>(groups.size());
        for (List<Integer> group : groups.values()) {
            futures.add(workers.submit(() -> {
                for (int index : group) {
                    if (closed) {
                        outcomes[index] = skipped(trades.get(index), "Reconciler shutting down");
                        continue;
                    }
                    outcomes[index] = reconcileTrade(trades.get(index), policy);
                }
            }));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("[Reconciler] Interrupted while waiting for trade groups");
                break;
            } catch (ExecutionException e) {
                log.error("[Reconciler] Trade group failed: {}", e.getCause().getMessage(), e.getCause());
            }
        }

        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] == null) {
                outcomes[i] = skipped(trades.get(i), "Trade was not processed");
            }
        }

        Duration elapsed = Duration.between(start, clock.instant());
        ReconcilePassSummary summary = ReconcilePassSummary.of(Arrays.asList(outcomes), elapsed.toMillis());

        metrics.recordPassDuration(elapsed);
        metrics.setOpenTrades(summary.stillOpen() + summary.filled());

        log.info("[Reconciler] Pass complete: checked={}, filled={}, closed={}, cancelled={}, still_open={}, elapsed={}ms",
            summary.checked(), summary.filled(), summary.closed(), summary.cancelled(), summary.stillOpen(),
            summary.durationMs());
        log.info("════════════════════════════════════════════════════════");
        return summary;
    }

    /**
     * Check one trade. Never throws.
     */
    ReconcileOutcome reconcileTrade(Trade trade, MaxOpenBarsPolicy policy) {
        String timeframe = timeframeLabel(trade);
        ReconcileOutcome.Builder outcome = ReconcileOutcome.forTrade(trade, timeframe, clock.instant());

        try {
            return check(trade, timeframe, policy, outcome);
        } catch (Exception e) {
            log.error("[Reconciler] Trade {} ({}) check failed: {}", trade.id(), trade.symbol(), e.getMessage(), e);
            metrics.recordCheckFailure("exception");
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            // A fill committed before the failure is already persisted
            ReconcileOutcome.Action action = outcome.isFillCommitted()
                ? ReconcileOutcome.Action.FILLED
                : ReconcileOutcome.Action.CHECKED;
            return outcome.action(action)
                .currentPrice(BigDecimal.ZERO)
                .error(error)
                .build();
        }
    }

    private ReconcileOutcome check(Trade trade, String timeframeLabel, MaxOpenBarsPolicy policy,
                                   ReconcileOutcome.Builder outcome) {
        log.debug("[Reconciler] {} {} status={} side={} type={} entry={} SL={} TP={}",
            trade.id(), trade.symbol(), trade.status(), trade.side(), trade.strategyType(),
            trade.entryPrice(), trade.stopLoss(), trade.takeProfit());

        // Step 1: required fields
        Optional<String> invalid = validateRequiredFields(trade);
        if (invalid.isPresent()) {
            log.error("[Reconciler] TRADE SKIPPED {}: {}", trade.id(), invalid.get());
            metrics.recordCheckFailure("invalid_trade");
            return outcome.error(invalid.get()).build();
        }

        Timeframe timeframe;
        try {
            timeframe = Timeframe.fromLabel(timeframeLabel);
        } catch (IllegalArgumentException e) {
            metrics.recordCheckFailure("invalid_trade");
            return outcome.error(e.getMessage()).build();
        }

        // Steps 2-4: signal time, lookback, bars
        Instant signalTime = trade.signalTime();
        int lookback = StrategyType.lookbackFor(trade.strategyType());
        Optional<StrategyType> kind = trade.strategyKind();
        boolean spread = kind.orElse(null) == StrategyType.SPREAD_BASED;

        List<Candle> candles = candleStore.getWindow(new CandleWindow(trade.symbol(), timeframe, signalTime, lookback));
        if (candles.isEmpty()) {
            log.warn("[Reconciler] {} {}: no candles available", trade.id(), trade.symbol());
            metrics.recordCheckFailure("no_candles");
            return outcome.error("no candles").build();
        }
        outcome.candlesChecked(candles.size());
        BigDecimal lastClose = candles.get(candles.size() - 1).close();
        outcome.currentPrice(lastClose);

        // Step 5: lookback before the signal
        int barsBeforeSignal = countBefore(candles, signalTime);
        if (barsBeforeSignal < lookback) {
            String error = "insufficient lookback: " + barsBeforeSignal + " bars before signal, need " + lookback;
            log.warn("[Reconciler] {} {}: {}", trade.id(), trade.symbol(), error);
            metrics.recordCheckFailure("insufficient_lookback");
            return outcome.error(error).build();
        }

        int signalIndex = FillDetector.firstIndexAtOrAfter(candles, signalTime);

        List<Candle> pairCandles = List.of();
        if (spread && trade.pairSymbol().isPresent()) {
            pairCandles = candleStore.getWindow(
                new CandleWindow(trade.pairSymbol().get(), timeframe, signalTime, lookback));
        }
        if (spread) {
            int pairBarsBeforeSignal = countBefore(pairCandles, signalTime);
            if (pairCandles.isEmpty() || pairBarsBeforeSignal < lookback) {
                String error = "insufficient pair lookback: " + pairBarsBeforeSignal
                    + " bars before signal, need " + lookback;
                log.warn("[Reconciler] {} {}/{}: {}", trade.id(), trade.symbol(),
                    trade.pairSymbol().orElse("?"), error);
                metrics.recordCheckFailure("insufficient_lookback");
                return outcome.error(error).build();
            }
        }

        // Step 6: fill
        boolean filledThisPass = false;
        int fillIndex;

        if (trade.status().isAwaitingFill()) {
            FillResult fill = signalIndex < 0
                ? FillResult.notFilled()
                : spread
                    ? fillDetector.detectSignalFill(candles, pairCandles, trade.entryPrice(),
                        trade.pairEntryPrice().orElse(null), signalIndex)
                    : fillDetector.detectPriceLevelFill(candles, trade.entryPrice(), signalIndex);

            if (!fill.filled()) {
                return handleUnfilled(trade, timeframeLabel, policy, signalIndex, candles.size(), outcome);
            }

            ValidationResult fillCheck = invariants.check(trade.createdAt(), fill.fillTime(), null);
            if (!fillCheck.passed()) {
                auditLog.record(trade.id(), AuditEventType.TIMESTAMP_VIOLATION_ON_FILL, fillCheck.firstViolation(),
                    SimulatorAuditLog.context(
                        "symbol", trade.symbol(),
                        "created_at", trade.createdAt(),
                        "fill_time", fill.fillTime(),
                        "fill_price", fill.fillPrice()));
                return outcome.error(fillCheck.firstViolation()).build();
            }

            if (!tradeRepo.recordFill(trade.id(), fill.fillPrice(), fill.pairFillPrice(), fill.fillTime())) {
                log.warn("[Reconciler] {} no longer waiting to fill, skipping", trade.id());
                return outcome.error("Trade no longer pending fill").build();
            }

            outcome.fillCommitted();
            metrics.recordTransition("filled");
            log.info("[Reconciler] {} FILLED @ {} at {} (bar {})",
                trade.symbol(), fill.fillPrice(), fill.fillTime(), fill.fillIndex());

            trade = trade.withFill(fill.fillPrice(), fill.pairFillPrice(), fill.fillTime());
            filledThisPass = true;
            fillIndex = fill.fillIndex();
            outcome.fillTime(fill.fillTime());

        } else if (trade.status() == TradeStatus.FILLED) {
            fillIndex = trade.filledAt() != null
                ? FillDetector.firstIndexAtOrAfter(candles, trade.filledAt())
                : signalIndex;
            if (fillIndex < 0) {
                log.debug("[Reconciler] {}: no bars since fill at {}", trade.id(), trade.filledAt());
                return outcome.barsOpen(0).build();
            }
            outcome.fillTime(trade.filledAt());

        } else {
            return outcome.error("Trade already settled as " + trade.status().code()).build();
        }

        int barsOpen = candles.size() - fillIndex;
        outcome.barsOpen(barsOpen);

        // Step 7: strategy
        String strategyName = trade.strategyName();
        if (strategyName == null || strategyName.isBlank()) {
            metrics.recordCheckFailure("no_strategy");
            return undecided(outcome, filledThisPass, "No strategy name in instance settings");
        }

        Optional<ExitEvaluator> evaluator = exitEvaluators.forStrategyType(trade.strategyType());
        if (evaluator.isEmpty()) {
            String error = "Unknown strategy type: " + trade.strategyType();
            auditLog.record(trade.id(), AuditEventType.UNKNOWN_STRATEGY_TYPE, error,
                SimulatorAuditLog.context(
                    "symbol", trade.symbol(),
                    "strategy_type", trade.strategyType(),
                    "strategy_name", strategyName));
            metrics.recordCheckFailure("unknown_strategy");
            return undecided(outcome, filledThisPass, error);
        }

        // Step 8: exit
        int startIndex = spread ? fillIndex : fillIndex + 1;
        ExitCheck exitCheck = evaluator.get().evaluate(
            new ExitRequest(trade, strategyName, candles, pairCandles, startIndex));

        if (exitCheck.isFailed()) {
            log.error("[Reconciler] {} {}: exit check failed: {}", trade.id(), trade.symbol(), exitCheck.error());
            metrics.recordCheckFailure("exit_check");
            return undecided(outcome, filledThisPass, exitCheck.error());
        }

        BigDecimal currentPrice = exitCheck.currentPrice() != null ? exitCheck.currentPrice() : lastClose;
        outcome.currentPrice(currentPrice);

        if (exitCheck.isExit()) {
            return settleExit(trade, exitCheck.decision().get(), spread, filledThisPass, outcome);
        }

        // Step 10: max bars after fill
        OptionalInt maxAfterFill = policy.maxBars(timeframeLabel, MaxOpenBarsPolicy.Phase.AFTER_FILL, trade.strategyType());
        if (maxAfterFill.isPresent() && barsOpen >= maxAfterFill.getAsInt()) {
            return cancelFilled(trade, spread, barsOpen, maxAfterFill.getAsInt(), lastClose, pairCandles,
                filledThisPass, outcome);
        }

        // Step 11
        return outcome.action(filledThisPass ? ReconcileOutcome.Action.FILLED : ReconcileOutcome.Action.CHECKED).build();
    }

    private ReconcileOutcome handleUnfilled(Trade trade, String timeframeLabel, MaxOpenBarsPolicy policy,
                                            int signalIndex, int candleCount, ReconcileOutcome.Builder outcome) {
        int barsPending = signalIndex < 0 ? 0 : candleCount - signalIndex;
        outcome.barsOpen(barsPending);

        OptionalInt maxBeforeFill = policy.maxBars(timeframeLabel, MaxOpenBarsPolicy.Phase.BEFORE_FILL, trade.strategyType());
        if (maxBeforeFill.isEmpty() || barsPending < maxBeforeFill.getAsInt()) {
            log.debug("[Reconciler] {} not filled yet ({} bars pending)", trade.symbol(), barsPending);
            return outcome.build();
        }

        // Never filled: no exit price, no P&L, no aggregate change
        if (!tradeRepo.cancelUnfilled(trade.id(), MAX_BARS_EXCEEDED, clock.instant())) {
            return outcome.error("Trade no longer pending fill").build();
        }

        metrics.recordTransition("cancelled");
        log.info("[Reconciler] {} CANCELLED ({}) after {} bars (max: {}), never filled",
            trade.symbol(), trade.status().code(), barsPending, maxBeforeFill.getAsInt());
        return outcome.action(ReconcileOutcome.Action.CANCELLED)
            .exit(MAX_BARS_EXCEEDED, null)
            .build();
    }

    private ReconcileOutcome settleExit(Trade trade, ExitDecision decision, boolean spread, boolean filledThisPass,
                                        ReconcileOutcome.Builder outcome) {
        if (spread && decision.isPriceLevelExit()) {
            String error = "Spread trade exit reported as " + decision.reason() + ", spread exits must come from the strategy signal";
            auditLog.record(trade.id(), AuditEventType.SPREAD_TRADE_PRICE_LEVEL_EXIT, error,
                SimulatorAuditLog.context(
                    "symbol", trade.symbol(),
                    "exit_reason", decision.reason(),
                    "exit_price", decision.exitPrice(),
                    "exit_time", decision.exitTime()));
            return undecided(outcome, filledThisPass, error);
        }

        if (trade.filledAt() == null) {
            String error = "Trade has no filled_at, cannot close";
            auditLog.record(trade.id(), AuditEventType.MISSING_FILLED_AT_ON_CLOSE, error,
                SimulatorAuditLog.context(
                    "symbol", trade.symbol(),
                    "created_at", trade.createdAt(),
                    "exit_time", decision.exitTime(),
                    "exit_reason", decision.reason()));
            return undecided(outcome, filledThisPass, error);
        }

        ValidationResult closeCheck = invariants.check(trade.createdAt(), trade.filledAt(), decision.exitTime());
        if (!closeCheck.passed()) {
            auditLog.record(trade.id(), AuditEventType.TIMESTAMP_VIOLATION_ON_CLOSE, closeCheck.firstViolation(),
                SimulatorAuditLog.context(
                    "symbol", trade.symbol(),
                    "created_at", trade.createdAt(),
                    "filled_at", trade.filledAt(),
                    "exit_time", decision.exitTime(),
                    "exit_reason", decision.reason()));
            return undecided(outcome, filledThisPass, closeCheck.firstViolation());
        }

        PnlCalculator.Pnl pnl = pnlCalculator.calculate(trade, decision.exitPrice(), decision.pairExitPrice());
        TradeSettlement settlement = new TradeSettlement(
            trade.id(), TradeStatus.CLOSED,
            decision.exitPrice(), decision.pairExitPrice(), decision.reason(),
            decision.exitTime(), null,
            pnl.amount(), pnl.percent());

        if (!tradeRepo.settle(settlement)) {
            return undecided(outcome, filledThisPass, "Trade no longer open");
        }

        metrics.recordTransition("closed");
        log.info("[Reconciler] TRADE CLOSED: {} | Exit: {} @ {} | P&L: {} ({}%)",
            trade.symbol(), decision.reason(), decision.exitPrice(), pnl.amount(), pnl.percent());

        return outcome.action(ReconcileOutcome.Action.CLOSED)
            .exit(decision.reason(), decision.exitTime())
            .pnl(pnl.amount())
            .build();
    }

    private ReconcileOutcome cancelFilled(Trade trade, boolean spread, int barsOpen, int maxBars,
                                          BigDecimal lastClose, List<Candle> pairCandles,
                                          boolean filledThisPass, ReconcileOutcome.Builder outcome) {
        BigDecimal price = candleStore.getCurrentPrice(trade.symbol()).orElse(lastClose);
        BigDecimal pairPrice = null;
        if (spread && trade.pairSymbol().isPresent()) {
            BigDecimal pairLastClose = pairCandles.isEmpty() ? null : pairCandles.get(pairCandles.size() - 1).close();
            pairPrice = candleStore.getCurrentPrice(trade.pairSymbol().get()).orElse(pairLastClose);
        }
        Instant cancelTime = clock.instant();

        ValidationResult cancelCheck = invariants.check(trade.createdAt(), trade.filledAt(), cancelTime);
        if (!cancelCheck.passed()) {
            auditLog.record(trade.id(), AuditEventType.TIMESTAMP_VIOLATION_ON_CANCEL, cancelCheck.firstViolation(),
                SimulatorAuditLog.context(
                    "symbol", trade.symbol(),
                    "created_at", trade.createdAt(),
                    "filled_at", trade.filledAt(),
                    "cancel_time", cancelTime,
                    "bars_open", barsOpen,
                    "max_bars", maxBars));
            return undecided(outcome, filledThisPass, cancelCheck.firstViolation());
        }

        // Force close at market, both legs for spreads
        PnlCalculator.Pnl pnl = pnlCalculator.calculate(trade, price, pairPrice);
        TradeSettlement settlement = new TradeSettlement(
            trade.id(), TradeStatus.CANCELLED,
            price, pairPrice, MAX_BARS_EXCEEDED,
            cancelTime, cancelTime,
            pnl.amount(), pnl.percent());

        if (!tradeRepo.settle(settlement)) {
            return undecided(outcome, filledThisPass, "Trade no longer open");
        }

        metrics.recordTransition("cancelled");
        log.info("[Reconciler] {} CANCELLED after {} bars open (max: {}) @ {} | P&L: {}",
            trade.symbol(), barsOpen, maxBars, price, pnl.amount());

        return outcome.action(ReconcileOutcome.Action.CANCELLED)
            .currentPrice(price)
            .exit(MAX_BARS_EXCEEDED, cancelTime)
            .pnl(pnl.amount())
            .build();
    }

    /**
     * No exit decision this pass. A fill committed earlier in the same check still counts.
     */
    private static ReconcileOutcome undecided(ReconcileOutcome.Builder outcome, boolean filledThisPass, String error) {
        return outcome
            .action(filledThisPass ? ReconcileOutcome.Action.FILLED : ReconcileOutcome.Action.CHECKED)
            .error(error)
            .build();
    }

    private static Optional<String> validateRequiredFields(Trade trade) {
        if (trade.status() == null) return Optional.of("Unrecognised status");
        if (trade.side() == null) return Optional.of("Missing side");
        if (trade.entryPrice() == null) return Optional.of("Missing entry_price");
        if (trade.quantity() == null) return Optional.of("Missing quantity");
        if (trade.signalTime() == null) return Optional.of("Missing created_at");

        StrategyType kind = trade.strategyKind().orElse(null);
        if (kind == StrategyType.PRICE_BASED) {
            if (trade.stopLoss() == null) return Optional.of("Missing stop_loss");
            if (trade.takeProfit() == null) return Optional.of("Missing take_profit");
        }
        if (kind == StrategyType.SPREAD_BASED && trade.status().isAwaitingFill()) {
            if (trade.pairSymbol().isEmpty()) return Optional.of("Missing pair_symbol in strategy_metadata");
            if (trade.pairEntryPrice().isEmpty()) return Optional.of("Missing price_y_at_entry in strategy_metadata");
        }
        return Optional.empty();
    }

    private ReconcileOutcome skipped(Trade trade, String error) {
        return ReconcileOutcome.forTrade(trade, timeframeLabel(trade), clock.instant()).error(error).build();
    }

    private static int countBefore(List<Candle> candles, Instant time) {
        int count = 0;
        for (Candle c : candles) {
            if (!c.startTime().isBefore(time)) break;
            count++;
        }
        return count;
    }

    private static String timeframeLabel(Trade trade) {
        return trade.timeframe() != null && !trade.timeframe().isBlank() ? trade.timeframe() : Timeframe.DEFAULT_LABEL;
    }

    private static String groupKey(Trade trade) {
        return Symbols.toExchangeSymbol(trade.symbol()) + "|" + timeframeLabel(trade).toLowerCase();
    }

    /**
     * Stop starting new trade groups and wait for in-flight trades to finish.
     */
    @Override
    public void close() {
        closed = true;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Reconciler] Stopped");
    }
}
