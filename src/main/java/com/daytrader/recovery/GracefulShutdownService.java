package com.daytrader.recovery;

import com.daytrader.core.engine.TradingEngine;
import com.daytrader.portfolio.PortfolioLedger;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Ensures orderly shutdown of the trading loop.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase value so it runs BEFORE the other
 * lifecycle components of the engine stop. The shutdown sequence:
 * <ol>
 *   <li>Request an engine stop: no new tick starts</li>
 *   <li>Wait for the running tick, including its in-flight broker calls, to finish</li>
 *   <li>Log open orders left at the broker; they are picked up again at the next start</li>
 * </ol>
 *
 * <p>Positions are NOT closed. Placing exit orders during an uncertain shutdown is worse than
 * carrying them; the next session liquidates carried positions at market open.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final TradingEngine tradingEngine;
    private final PortfolioLedger portfolioLedger;
    private final Duration tickWaitTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            TradingEngine tradingEngine,
            PortfolioLedger portfolioLedger,
            @Value("${daytrader.shutdown.tick-wait-timeout:60s}") Duration tickWaitTimeout) {
        this.tradingEngine = tradingEngine;
        this.portfolioLedger = portfolioLedger;
        this.tickWaitTimeout = tickWaitTimeout;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            tradingEngine.requestStop();

            if (tradingEngine.awaitIdle(tickWaitTimeout)) {
                log.info("Engine idle, no tick in progress");
            } else {
                log.warn("Tick still running after {}s, shutting down anyway", tickWaitTimeout.toSeconds());
            }

            int openOrders = portfolioLedger.getOpenOrderCount();
            if (openOrders > 0) {
                log.warn("{} order(s) still open at the broker at shutdown: {}", openOrders, portfolioLedger.getOpenOrders());
            }
            log.info("Graceful shutdown completed");
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Run before other Spring components shut down (higher phase = earlier shutdown)
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
