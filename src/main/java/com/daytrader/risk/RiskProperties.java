package com.daytrader.risk;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Account-level limits, properties prefix {@code daytrader.risk.*}. Null or zero disables a limit.
 */
@Data
@Component
@ConfigurationProperties(prefix = "daytrader.risk")
public class RiskProperties {

    /** Maximum realized loss per day, as a positive amount. New entries stop once reached. */
    private BigDecimal dailyLossLimit;

    /** Maximum number of distinct symbols held or being bought at once. */
    private int maxOpenPositions = 0;
}
