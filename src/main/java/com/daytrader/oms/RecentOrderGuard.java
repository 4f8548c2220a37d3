package com.daytrader.oms;

import com.daytrader.domain.model.Signal;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Short-lived memory of recent submissions per (strategyId, symbol, side).
 *
 * <p>Complements the open-order check: an order that filled within seconds is no longer open,
 * but a strategy re-emitting the same entry on the next tick should still not trade again
 * until the cooldown has passed. Engine liquidations are exempt.
 *
 * <p>Expiry follows the times passed in by the order manager, not the wall clock. The cache
 * ticker only moves forward, so a clock stepping back never shortens a cooldown.
 */
@Component
public class RecentOrderGuard {

    private final AtomicLong latestNanos = new AtomicLong();
    private final Cache<String, LocalDateTime> recentSubmissions;

    public RecentOrderGuard(OrderManagerProperties orderManagerProperties) {
        this.recentSubmissions = Caffeine.newBuilder()
                .ticker(latestNanos::get)
                .expireAfterWrite(orderManagerProperties.getResubmitCooldown().toNanos(), TimeUnit.NANOSECONDS)
                .maximumSize(10_000)
                .build();
    }

    public boolean isCoolingDown(Signal signal, LocalDateTime now) {
        advanceTo(now);
        return !signal.isLiquidation() && recentSubmissions.getIfPresent(key(signal)) != null;
    }

    public void markSubmitted(Signal signal, LocalDateTime submittedAt) {
        advanceTo(submittedAt);
        recentSubmissions.put(key(signal), submittedAt);
    }

    private void advanceTo(LocalDateTime time) {
        long nanos = time.toEpochSecond(ZoneOffset.UTC) * 1_000_000_000L + time.getNano();
        latestNanos.accumulateAndGet(nanos, Math::max);
    }

    private String key(Signal signal) {
        return signal.getStrategyId() + "|" + signal.getSymbol() + "|" + signal.getSide();
    }
}
