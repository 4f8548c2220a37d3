package com.daytrader.strategy;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configured strategies, properties prefix {@code daytrader.strategies[n].*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "daytrader")
public class StrategiesProperties {

    private List<StrategyDefinition> strategies = new ArrayList<>();
}
