package com.daytrader.core.engine;

import com.daytrader.broker.MarketDataService;
import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.domain.enums.Phase;
import com.daytrader.domain.enums.TickStatus;
import com.daytrader.domain.model.Position;
import com.daytrader.domain.model.Signal;
import com.daytrader.domain.model.TickResult;
import com.daytrader.event.EventPublisherHelper;
import com.daytrader.event.TradingHaltEvent;
import com.daytrader.exception.StateCorruptionException;
import com.daytrader.notification.NotificationService;
import com.daytrader.observability.TradingMetrics;
import com.daytrader.oms.OrderManager;
import com.daytrader.oms.OrderSubmissionResult;
import com.daytrader.portfolio.PortfolioLedger;
import com.daytrader.strategy.MarketSnapshot;
import com.daytrader.strategy.RegisteredStrategy;
import com.daytrader.strategy.StrategyRegistry;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Time-phased state machine that drives the trading day.
 *
 * <p>Each {@link #tick(LocalDateTime)}:
 * <ol>
 *   <li>Resolves the phase from absolute wall time and today's session bounds. A non-trading
 *       day or a time before session start returns without side effects; there is no
 *       "sleep until tomorrow" decision</li>
 *   <li>Submits liquidation sells first: positions of strategies past their liquidation
 *       deadline, then positions carried over from the previous session</li>
 *   <li>Evaluates the strategies whose window accepts entries and forwards their signals to
 *       the {@link OrderManager} in order</li>
 *   <li>On the first POST_MARKET tick of a day runs the {@link EndOfDayTask}s</li>
 * </ol>
 *
 * <p>A tick is idempotent: positions with an open order are not liquidated again, and the
 * order manager's duplicate gate drops repeated strategy signals. Phases only move forward
 * within a day; a tick whose time falls in an earlier phase is ignored with a warning.
 *
 * <p><b>Concurrency:</b> ticks are serialized by {@code tickLock}; a stop request lets the
 * running tick finish and turns every later tick into a no-op.
 */
@Service
public class TradingEngine {

    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final TradingCalendarService tradingCalendarService;
    private final StrategyRegistry strategyRegistry;
    private final OrderManager orderManager;
    private final PortfolioLedger portfolioLedger;
    private final MarketDataService marketDataService;
    private final NotificationService notificationService;
    private final TradingMetrics tradingMetrics;
    private final EventPublisherHelper eventPublisherHelper;
    private final List<EndOfDayTask> endOfDayTasks;
    private final EngineProperties engineProperties;
    private final AsyncTaskExecutor strategyExecutor;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicReference<String> haltReason = new AtomicReference<>();

    /** Strategies whose evaluation thread has not returned yet, including abandoned ones. */
    private final Set<String> runningEvaluations = ConcurrentHashMap.newKeySet();

    private volatile TradingSession session;
    private volatile boolean stopRequested;

    public TradingEngine(
            TradingCalendarService tradingCalendarService,
            StrategyRegistry strategyRegistry,
            OrderManager orderManager,
            PortfolioLedger portfolioLedger,
            MarketDataService marketDataService,
            NotificationService notificationService,
            TradingMetrics tradingMetrics,
            EventPublisherHelper eventPublisherHelper,
            List<EndOfDayTask> endOfDayTasks,
            EngineProperties engineProperties,
            @Qualifier("strategyExecutor") AsyncTaskExecutor strategyExecutor) {
        this.tradingCalendarService = tradingCalendarService;
        this.strategyRegistry = strategyRegistry;
        this.orderManager = orderManager;
        this.portfolioLedger = portfolioLedger;
        this.marketDataService = marketDataService;
        this.notificationService = notificationService;
        this.tradingMetrics = tradingMetrics;
        this.eventPublisherHelper = eventPublisherHelper;
        this.endOfDayTasks = endOfDayTasks;
        this.engineProperties = engineProperties;
        this.strategyExecutor = strategyExecutor;
    }

    // ========================
    // TICK
    // ========================

    public TickResult tick() {
        return tick(tradingCalendarService.now());
    }

    /**
     * Testable version: runs one engine cycle as of {@code now}.
     */
    public TickResult tick(LocalDateTime now) {
        tickLock.lock();
        try {
            if (stopRequested) {
                return TickResult.of(TickStatus.STOPPED);
            }

            LocalDate date = now.toLocalDate();
            if (!tradingCalendarService.isTradingDay(date)) {
                log.debug("{} is not a trading day", date);
                return TickResult.of(TickStatus.NON_TRADING_DAY);
            }

            Optional<Phase> resolved = tradingCalendarService.resolvePhase(now);
            if (resolved.isEmpty()) {
                log.debug("Waiting for session start at {}", tradingCalendarService.sessionStart(date));
                return TickResult.of(TickStatus.WAITING);
            }

            TradingSession current = sessionFor(date);
            if (current.isHalted()) {
                return TickResult.of(TickStatus.HALTED, Phase.HALTED);
            }

            Phase phase = resolved.get();
            if (current.isBehind(phase)) {
                log.warn(
                        "Clock moved back: {} resolves to {} but {} was already entered today; tick ignored",
                        now,
                        phase,
                        current.getLastPhase());
                return TickResult.of(TickStatus.CLOCK_REGRESSED, current.getLastPhase());
            }
            enterPhase(current, phase, now);

            try {
                return runPhase(current, phase, now);
            } catch (StateCorruptionException e) {
                halt(e.getMessage());
                return TickResult.of(TickStatus.HALTED, Phase.HALTED);
            }
        } finally {
            tickLock.unlock();
        }
    }

    private TickResult runPhase(TradingSession current, Phase phase, LocalDateTime now) {
        if (phase == Phase.POST_MARKET) {
            runEndOfDay(current);
            return TickResult.of(TickStatus.ACTIVE, phase);
        }
        if (!phase.isMarketOpen()) {
            return TickResult.of(TickStatus.ACTIVE, phase);
        }

        List<Signal> submitted = new ArrayList<>();
        int[] outcome = new int[2];

        // Step 2: Liquidation first
        Set<String> liquidating = new HashSet<>();
        for (Signal signal : collectLiquidationSignals(current, now, liquidating)) {
            submit(signal, now, submitted, outcome);
        }

        // Step 3: Strategies whose window accepts entries
        List<String> evaluated = new ArrayList<>();
        for (RegisteredStrategy registered : strategyRegistry.getStrategiesAcceptingEntries(now)) {
            if (liquidating.contains(registered.id())) {
                continue;
            }
            evaluated.add(registered.id());
            for (Signal signal : evaluate(registered, now)) {
                submit(signal, now, submitted, outcome);
            }
        }

        return TickResult.builder()
                .status(TickStatus.ACTIVE)
                .phase(phase)
                .submittedSignals(List.copyOf(submitted))
                .evaluatedStrategies(List.copyOf(evaluated))
                .ordersAccepted(outcome[0])
                .ordersRejected(outcome[1])
                .build();
    }

    private void submit(Signal signal, LocalDateTime now, List<Signal> submitted, int[] outcome) {
        OrderSubmissionResult result = orderManager.submit(signal, now);
        submitted.add(signal);
        if (result.isAccepted()) {
            outcome[0]++;
        } else {
            outcome[1]++;
        }
    }

    // ========================
    // LIQUIDATION
    // ========================

    private List<Signal> collectLiquidationSignals(TradingSession current, LocalDateTime now, Set<String> liquidating) {
        List<Signal> signals = new ArrayList<>();

        for (RegisteredStrategy due : strategyRegistry.getStrategiesDueForLiquidation(now)) {
            List<Position> owned = portfolioLedger.getPositionsOwnedBy(due.id());
            if (owned.isEmpty()) {
                continue;
            }
            liquidating.add(due.id());
            for (Position position : owned) {
                if (portfolioLedger.hasOpenOrder(due.id(), position.getSymbol())) {
                    continue;
                }
                log.info(
                        "Forced liquidation: {} x{} owned by {} (deadline passed at {})",
                        position.getSymbol(),
                        position.getQuantity(),
                        due.id(),
                        now.toLocalTime());
                signals.add(Signal.liquidation(
                        due.id(), position.getSymbol(), position.getQuantity(), "Window deadline liquidation"));
            }
        }

        if (engineProperties.isOpeningLiquidation()) {
            if (!current.isOpeningLiquidationDone()) {
                recordCarriedPositions(current);
            }
            signals.addAll(carriedPositionSignals(current, liquidating));
        }
        return signals;
    }

    /**
     * Remembers, once per day, the positions held when the market opened that belong to no
     * intraday strategy: positions found at startup and those of hold-overnight strategies.
     */
    private void recordCarriedPositions(TradingSession current) {
        Set<String> carriedOwners = new HashSet<>(strategyRegistry.getOvernightStrategyIds());
        carriedOwners.add(Position.STARTUP_OWNER);
        for (Position position : portfolioLedger.getPositions()) {
            if (carriedOwners.contains(position.getOwningStrategyId())) {
                current.carryPosition(position.getSymbol(), position.getOwningStrategyId());
            }
        }
        current.markOpeningLiquidationDone();
        if (!current.getCarriedPositions().isEmpty()) {
            log.info("Market open liquidation of carried positions: {}", current.getCarriedPositions());
        }
    }

    private List<Signal> carriedPositionSignals(TradingSession current, Set<String> liquidating) {
        List<Signal> signals = new ArrayList<>();
        for (Map.Entry<String, String> carried : List.copyOf(current.getCarriedPositions().entrySet())) {
            String symbol = carried.getKey();
            String owner = carried.getValue();
            Optional<Position> position = portfolioLedger.getPosition(symbol);
            if (position.isEmpty() || !owner.equals(position.get().getOwningStrategyId())) {
                current.clearCarriedPosition(symbol);
                continue;
            }
            liquidating.add(owner);
            if (portfolioLedger.hasOpenOrder(owner, symbol)) {
                continue;
            }
            signals.add(Signal.liquidation(
                    owner, symbol, position.get().getQuantity(), "Market open liquidation of carried position"));
        }
        return signals;
    }

    // ========================
    // STRATEGY EVALUATION
    // ========================

    private List<Signal> evaluate(RegisteredStrategy registered, LocalDateTime now) {
        String strategyId = registered.id();
        if (runningEvaluations.contains(strategyId)) {
            reportStrategyFailure(strategyId, "still running from an earlier tick", null);
            return List.of();
        }
        MarketSnapshot snapshot = marketDataService.snapshot(registered.strategy().watchedSymbols(), now);
        Duration timeout = engineProperties.getStrategyTimeout();

        Future<List<Signal>> future;
        runningEvaluations.add(strategyId);
        try {
            future = strategyExecutor.submit(() -> {
                try {
                    return registered.strategy().evaluate(snapshot, portfolioLedger, now);
                } finally {
                    runningEvaluations.remove(strategyId);
                }
            });
        } catch (RejectedExecutionException e) {
            runningEvaluations.remove(strategyId);
            reportStrategyFailure(strategyId, "rejected, no free evaluation thread", null);
            return List.of();
        }

        try {
            List<Signal> signals = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (signals == null) {
                return List.of();
            }
            List<Signal> accepted = new ArrayList<>();
            for (Signal signal : signals) {
                if (!strategyId.equals(signal.getStrategyId()) || signal.isLiquidation()) {
                    log.warn("Dropping signal from {} with foreign id or liquidation flag: {}", strategyId, signal);
                    continue;
                }
                accepted.add(signal);
            }
            return accepted;
        } catch (TimeoutException e) {
            // Interrupts the evaluation thread; a strategy ignoring the interrupt stays in runningEvaluations
            future.cancel(true);
            reportStrategyFailure(strategyId, "timed out after " + timeout.toMillis() + "ms", null);
        } catch (ExecutionException e) {
            reportStrategyFailure(strategyId, String.valueOf(e.getCause()), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while evaluating strategy {}", strategyId);
        }
        return List.of();
    }

    private void reportStrategyFailure(String strategyId, String problem, Throwable cause) {
        log.error("Strategy {} failed: {}", strategyId, problem, cause);
        tradingMetrics.recordStrategyFailure(strategyId);
        notificationService.notify(
                AlertSeverity.WARNING, "Strategy failed: " + strategyId, "Evaluation " + problem + ", skipped this tick");
    }

    // ========================
    // SESSION
    // ========================

    private TradingSession sessionFor(LocalDate date) {
        TradingSession current = session;
        if (current == null || !current.getTradingDate().equals(date)) {
            current = new TradingSession(date);
            if (haltReason.get() != null) {
                current.markHalted();
            }
            session = current;
            log.info("New trading session for {}", date);
        }
        return current;
    }

    private void enterPhase(TradingSession current, Phase phase, LocalDateTime now) {
        Phase previous = current.getLastPhase();
        if (current.enterPhase(phase, now)) {
            log.info("Phase transition: {} -> {} at {}", previous, phase, now);
            eventPublisherHelper.publishPhaseTransition(this, previous, phase, now);
        }
    }

    private void runEndOfDay(TradingSession current) {
        if (current.isPostMarketDone()) {
            return;
        }
        current.markPostMarketDone();
        log.info("Post-market: running {} end-of-day task(s) for {}", endOfDayTasks.size(), current.getTradingDate());
        for (EndOfDayTask task : endOfDayTasks) {
            try {
                task.run(current.getTradingDate());
            } catch (RuntimeException e) {
                log.error("End-of-day task {} failed", task.getName(), e);
                notificationService.notify(
                        AlertSeverity.WARNING, "End-of-day task failed: " + task.getName(), String.valueOf(e.getMessage()));
            }
        }
    }

    // ========================
    // CONTROL
    // ========================

    /**
     * Stops trading for the rest of the process lifetime. The ledger is rebuilt from the broker
     * on the next start, which is the only way back.
     */
    public void halt(String reason) {
        if (!haltReason.compareAndSet(null, reason)) {
            return;
        }
        TradingSession current = session;
        if (current != null) {
            current.markHalted();
            eventPublisherHelper.publishPhaseTransition(
                    this, current.getLastPhase(), Phase.HALTED, tradingCalendarService.now());
        }
        orderManager.haltTrading(reason);
        log.error("TRADING HALTED: {}", reason);
        notificationService.notify(AlertSeverity.CRITICAL, "Trading halted", reason);
    }

    @EventListener
    public void onTradingHalt(TradingHaltEvent event) {
        halt(event.getReason());
    }

    /** The current tick completes; every later tick returns STOPPED. */
    public void requestStop() {
        if (!stopRequested) {
            stopRequested = true;
            log.info("Engine stop requested");
        }
    }

    /**
     * Waits until no tick is running.
     *
     * @return false if a tick was still running when the timeout expired
     */
    public boolean awaitIdle(Duration timeout) {
        try {
            if (tickLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                tickLock.unlock();
                return true;
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public boolean isHalted() {
        return haltReason.get() != null;
    }

    public Optional<TradingSession> getSession() {
        return Optional.ofNullable(session);
    }
}
