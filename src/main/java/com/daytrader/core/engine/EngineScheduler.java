package com.daytrader.core.engine;

import com.daytrader.calendar.SessionScheduleConfig;
import com.daytrader.domain.enums.Phase;
import com.daytrader.domain.enums.TickStatus;
import com.daytrader.domain.model.TickResult;
import com.daytrader.observability.TradingMetrics;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives {@link TradingEngine#tick()} on a fixed delay and, when auto-shutdown is enabled,
 * closes the application once the end-of-day tasks have run.
 *
 * <p>Unexpected exceptions from a tick are logged and the next tick runs as scheduled.
 */
@Component
public class EngineScheduler {

    private static final Logger log = LoggerFactory.getLogger(EngineScheduler.class);

    private final TradingEngine tradingEngine;
    private final TradingMetrics tradingMetrics;
    private final SessionScheduleConfig sessionScheduleConfig;
    private final ApplicationContext applicationContext;

    private final AtomicBoolean shutdownTriggered = new AtomicBoolean(false);

    public EngineScheduler(
            TradingEngine tradingEngine,
            TradingMetrics tradingMetrics,
            SessionScheduleConfig sessionScheduleConfig,
            ApplicationContext applicationContext) {
        this.tradingEngine = tradingEngine;
        this.tradingMetrics = tradingMetrics;
        this.sessionScheduleConfig = sessionScheduleConfig;
        this.applicationContext = applicationContext;
    }

    @Scheduled(
            fixedDelayString = "#{@engineProperties.tickInterval.toMillis()}",
            initialDelayString = "${daytrader.engine.initial-delay:2000}")
    public void runTick() {
        long started = System.nanoTime();
        TickResult result;
        try {
            result = tradingEngine.tick();
        } catch (RuntimeException e) {
            log.error("Unexpected tick failure", e);
            return;
        }
        tradingMetrics.recordTick(result.getStatus(), Duration.ofNanos(System.nanoTime() - started));

        if (result.getStatus() != TickStatus.ACTIVE) {
            log.debug("Tick: {}", result.getStatus());
        } else if (!result.getSubmittedSignals().isEmpty()) {
            log.info(
                    "Tick [{}]: {} signal(s), {} accepted, {} rejected, evaluated {}",
                    result.getPhase(),
                    result.getSubmittedSignals().size(),
                    result.getOrdersAccepted(),
                    result.getOrdersRejected(),
                    result.getEvaluatedStrategies());
        }

        if (result.getPhase() == Phase.POST_MARKET && sessionScheduleConfig.isAutoShutdown()) {
            triggerShutdown();
        }
    }

    private void triggerShutdown() {
        if (!shutdownTriggered.compareAndSet(false, true)) {
            return;
        }
        log.info("End of trading day, auto-shutdown enabled: closing application");
        tradingEngine.requestStop();
        // Exit off the scheduler thread; closing the context waits for scheduled tasks
        Thread shutdown = new Thread(
                () -> System.exit(SpringApplication.exit(applicationContext, () -> 0)), "daytrader-shutdown");
        shutdown.start();
    }
}
