package com.daytrader.oms;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Order-path settings, properties prefix {@code daytrader.orders.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "daytrader.orders")
public class OrderManagerProperties {

    /** Safety margin on the estimated price when checking cash for a buy (0.05 = 5%). */
    private BigDecimal slippageBuffer = new BigDecimal("0.05");

    /** Orders open longer than this are alerted. */
    private Duration pendingTimeout = Duration.ofMinutes(10);

    /** Cancel the unfilled remainder at the broker once the pending timeout fires. */
    private boolean cancelOnTimeout = false;

    /** Same strategy, symbol and side may not be submitted again within this period. */
    private Duration resubmitCooldown = Duration.ofSeconds(60);
}
