package com.daytrader.core.engine;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine loop settings, properties prefix {@code daytrader.engine.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "daytrader.engine")
public class EngineProperties {

    /** Fixed delay between two ticks. */
    private Duration tickInterval = Duration.ofSeconds(30);

    /** A strategy evaluation running longer than this is abandoned and reported as failed. */
    private Duration strategyTimeout = Duration.ofSeconds(5);

    /** Sell positions carried from the previous session once the market opens. */
    private boolean openingLiquidation = true;
}
