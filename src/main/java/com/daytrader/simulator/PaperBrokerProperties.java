package com.daytrader.simulator;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Paper broker account, properties prefix {@code daytrader.paper.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "daytrader.paper")
public class PaperBrokerProperties {

    /** Cash the simulated account starts with. */
    private BigDecimal startingCash = new BigDecimal("10000000");

    /** Seed last prices by symbol; symbols absent here are unknown to the broker. */
    private Map<String, BigDecimal> quotes = new LinkedHashMap<>();

    /** Market order slippage in basis points against the trader. */
    private int slippageBps = 0;
}
