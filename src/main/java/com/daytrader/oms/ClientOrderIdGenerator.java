package com.daytrader.oms;

import com.daytrader.domain.model.Signal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates client order ids, the idempotency keys sent with every submission.
 *
 * <p>Format: {@code {run_4}{strategyPrefix_3}{actionCode_3}{seq_4}}, e.g. "0K3ZBRKENT0007"
 * = run 0K3Z, strategy "breakout", entry, 7th entry of that strategy today.
 * <ul>
 *   <li>The run token is the process start time (seconds of day, base 36), so ids from a
 *       restarted process never collide with ids already at the broker from the same day</li>
 *   <li>Action codes: ENT (buy), EXT (strategy sell), LIQ (engine liquidation)</li>
 *   <li>Counters reset on the first id of a new day and wrap at 10000</li>
 * </ul>
 */
@Component
public class ClientOrderIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClientOrderIdGenerator.class);

    private static final int MAX_SEQUENCE = 10000;

    private final String runToken;
    private final ConcurrentHashMap<String, AtomicInteger> sequenceCounters = new ConcurrentHashMap<>();
    private final AtomicReference<LocalDate> lastResetDate = new AtomicReference<>(LocalDate.now());

    public ClientOrderIdGenerator() {
        this(runTokenFor(LocalTime.now()));
    }

    public ClientOrderIdGenerator(String runToken) {
        this.runToken = runToken;
    }

    public String generate(Signal signal) {
        return generate(signal, LocalDate.now());
    }

    /**
     * Testable version: generates an id for a signal on the given trading date.
     */
    public String generate(Signal signal, LocalDate date) {
        resetIfNewDay(date);

        String counterKey = strategyPrefix(signal.getStrategyId()) + actionCode(signal);
        AtomicInteger counter = sequenceCounters.computeIfAbsent(counterKey, k -> new AtomicInteger(0));
        int seq = counter.incrementAndGet();

        String clientOrderId = String.format("%s%s%04d", runToken, counterKey, seq % MAX_SEQUENCE);
        log.debug("Generated client order id: {}", clientOrderId);
        return clientOrderId;
    }

    public static String runTokenFor(LocalTime startTime) {
        String token = Integer.toString(startTime.toSecondOfDay(), 36).toUpperCase();
        return "0".repeat(Math.max(0, 4 - token.length())) + token;
    }

    private void resetIfNewDay(LocalDate date) {
        LocalDate lastReset = lastResetDate.get();
        if (!date.equals(lastReset) && lastResetDate.compareAndSet(lastReset, date)) {
            sequenceCounters.clear();
            log.info("Client order id counters reset for new day: {}", date);
        }
    }

    private String actionCode(Signal signal) {
        if (signal.isLiquidation()) {
            return "LIQ";
        }
        return signal.isBuy() ? "ENT" : "EXT";
    }

    private String strategyPrefix(String strategyId) {
        if (strategyId == null || strategyId.isEmpty()) {
            return "GEN";
        }
        String letters = strategyId.replaceAll("[^A-Za-z0-9]", "");
        if (letters.isEmpty()) {
            return "GEN";
        }
        String prefix = letters.substring(0, Math.min(3, letters.length())).toUpperCase();
        return prefix + "X".repeat(3 - prefix.length());
    }
}
