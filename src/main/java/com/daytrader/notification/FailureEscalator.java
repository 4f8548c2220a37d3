package com.daytrader.notification;

import com.daytrader.domain.enums.AlertSeverity;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Escalates repeated failures of one kind (exhausted broker retries, failed submissions) to a
 * CRITICAL alert once a threshold is crossed inside a sliding window.
 *
 * <p>Escalation only alerts: trading keeps running in a degraded state. After an escalation
 * the window for that kind is cleared, so the next alert needs a fresh run of failures.
 */
@Component
public class FailureEscalator {

    private static final Logger log = LoggerFactory.getLogger(FailureEscalator.class);

    private final NotificationService notificationService;
    private final int threshold;
    private final Duration window;
    private final Map<String, Deque<Instant>> failuresByKind = new HashMap<>();

    public FailureEscalator(
            NotificationService notificationService,
            @Value("${daytrader.escalation.threshold:5}") int threshold,
            @Value("${daytrader.escalation.window:60s}") Duration window) {
        this.notificationService = notificationService;
        this.threshold = threshold;
        this.window = window;
    }

    public boolean recordFailure(String kind) {
        return recordFailure(kind, Instant.now());
    }

    /**
     * Testable version: records one failure observed at {@code now}.
     *
     * @return true if this failure triggered an escalation
     */
    public boolean recordFailure(String kind, Instant now) {
        int count;
        synchronized (failuresByKind) {
            Deque<Instant> failures = failuresByKind.computeIfAbsent(kind, k -> new ArrayDeque<>());
            failures.addLast(now);
            Instant cutoff = now.minus(window);
            while (!failures.isEmpty() && failures.peekFirst().isBefore(cutoff)) {
                failures.pollFirst();
            }
            count = failures.size();
            if (count < threshold) {
                return false;
            }
            failures.clear();
        }

        log.error("{} failures of type {} within {}s, escalating", count, kind, window.toSeconds());
        notificationService.notify(
                AlertSeverity.CRITICAL,
                "Repeated " + kind,
                String.format("%d %s failures within %ds. Trading continues in degraded mode.",
                        count, kind, window.toSeconds()));
        return true;
    }
}
