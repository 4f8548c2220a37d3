package com.daytrader.observability;

import com.daytrader.domain.enums.CallClass;
import com.daytrader.domain.enums.TickStatus;
import com.daytrader.event.FillEvent;
import com.daytrader.event.OrderEvent;
import com.daytrader.event.OrderEventType;
import com.daytrader.event.SignalRejectedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the trading day.
 * <ul>
 *   <li><b>engine.tick</b> (timer, tag status): duration of each engine tick</li>
 *   <li><b>orders.placed</b> (counter): orders accepted by the broker</li>
 *   <li><b>signals.rejected</b> (counter, tag reason): signals dropped by the order manager</li>
 *   <li><b>fills</b> (counter, tag side): fills folded into the portfolio</li>
 *   <li><b>broker.retries</b> / <b>broker.retries.exhausted</b> (counters, tag class)</li>
 *   <li><b>strategy.failures</b> (counter, tag strategy)</li>
 * </ul>
 */
@Service
public class TradingMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter ordersPlacedCounter;

    public TradingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.ordersPlacedCounter = Counter.builder("orders.placed")
                .description("Orders accepted by the broker")
                .register(meterRegistry);
    }

    public void recordTick(TickStatus status, Duration duration) {
        Timer.builder("engine.tick")
                .tag("status", status.name())
                .register(meterRegistry)
                .record(duration);
    }

    public void recordRetry(CallClass callClass) {
        meterRegistry.counter("broker.retries", "class", callClass.name()).increment();
    }

    public void recordRetryExhausted(CallClass callClass) {
        meterRegistry.counter("broker.retries.exhausted", "class", callClass.name()).increment();
    }

    public void recordStrategyFailure(String strategyId) {
        meterRegistry.counter("strategy.failures", "strategy", strategyId).increment();
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() == OrderEventType.PLACED) {
            ordersPlacedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onSignalRejected(SignalRejectedEvent event) {
        meterRegistry
                .counter("signals.rejected", "reason", event.getReason().name())
                .increment();
    }

    @EventListener
    @Order(20)
    public void onFill(FillEvent event) {
        meterRegistry.counter("fills", "side", event.getFill().side().name()).increment();
    }
}
