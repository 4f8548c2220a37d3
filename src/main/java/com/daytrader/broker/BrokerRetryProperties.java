package com.daytrader.broker;

import com.daytrader.domain.enums.CallClass;
import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry budgets per broker call class, properties prefix {@code daytrader.broker.retry.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>quote: 3 attempts, 200ms base delay, x2 backoff</li>
 *   <li>read: 3 attempts, 500ms base delay, x2 backoff</li>
 *   <li>submit: 3 attempts, 1s base delay, x2 backoff</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "daytrader.broker.retry")
public class BrokerRetryProperties {

    private CallPolicy quote = new CallPolicy(3, Duration.ofMillis(200), 2.0, 0.2);
    private CallPolicy read = new CallPolicy(3, Duration.ofMillis(500), 2.0, 0.2);
    private CallPolicy submit = new CallPolicy(3, Duration.ofSeconds(1), 2.0, 0.0);

    public CallPolicy forClass(CallClass callClass) {
        return switch (callClass) {
            case QUOTE -> quote;
            case READ -> read;
            case SUBMIT -> submit;
        };
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CallPolicy {

        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(500);
        private double multiplier = 2.0;

        /** Randomization factor in [0, 1); 0 disables jitter. */
        private double jitter = 0.0;
    }
}
