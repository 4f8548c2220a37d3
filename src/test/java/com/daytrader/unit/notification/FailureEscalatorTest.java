package com.daytrader.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.notification.FailureEscalator;
import com.daytrader.notification.NotificationService;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for FailureEscalator's sliding window.
 */
class FailureEscalatorTest {

    private static final Instant T0 = Instant.parse("2026-10-14T01:00:00Z");

    private NotificationService notificationService;
    private FailureEscalator failureEscalator;

    @BeforeEach
    void setUp() {
        notificationService = mock(NotificationService.class);
        failureEscalator = new FailureEscalator(notificationService, 3, Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("The threshold-th failure within the window escalates")
    void escalatesAtThreshold() {
        assertThat(failureEscalator.recordFailure("TransientApiFailure", T0)).isFalse();
        assertThat(failureEscalator.recordFailure("TransientApiFailure", T0.plusSeconds(10))).isFalse();
        assertThat(failureEscalator.recordFailure("TransientApiFailure", T0.plusSeconds(20))).isTrue();

        verify(notificationService).notify(eq(AlertSeverity.CRITICAL), eq("Repeated TransientApiFailure"), anyString());
    }

    @Test
    @DisplayName("Failures older than the window do not count")
    void slidingWindow() {
        failureEscalator.recordFailure("TransientApiFailure", T0);
        failureEscalator.recordFailure("TransientApiFailure", T0.plusSeconds(10));

        assertThat(failureEscalator.recordFailure("TransientApiFailure", T0.plusSeconds(65))).isFalse();
    }

    @Test
    @DisplayName("Kinds are counted separately and the count restarts after escalation")
    void separateKindsAndReset() {
        failureEscalator.recordFailure("TransientApiFailure", T0);
        failureEscalator.recordFailure("SubmissionFailed", T0);
        failureEscalator.recordFailure("TransientApiFailure", T0);
        assertThat(failureEscalator.recordFailure("SubmissionFailed", T0)).isFalse();
        assertThat(failureEscalator.recordFailure("TransientApiFailure", T0)).isTrue();

        assertThat(failureEscalator.recordFailure("TransientApiFailure", T0.plusSeconds(1))).isFalse();
        verify(notificationService, times(1)).notify(eq(AlertSeverity.CRITICAL), anyString(), anyString());
    }
}
