package com.daytrader.sizing;

import com.daytrader.domain.enums.SizingPolicy;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Position sizing settings, properties prefix {@code daytrader.sizing.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>policy: NONE (signals keep their quantity)</li>
 *   <li>capitalPercentage: 10 (PERCENTAGE_OF_CAPITAL allocates 10% of available cash)</li>
 *   <li>kellyMultiplier: 0.5 (half Kelly)</li>
 *   <li>kellyMinSamples: 5 closed trades before journal statistics replace the defaults</li>
 *   <li>default win rate 0.5, average win +2%, average loss -2%</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "daytrader.sizing")
public class PositionSizingConfig {

    private SizingPolicy policy = SizingPolicy.NONE;
    private BigDecimal capitalPercentage = new BigDecimal("10");
    private double kellyMultiplier = 0.5;
    private int kellyMinSamples = 5;
    private double defaultWinRate = 0.5;
    private double defaultAverageWin = 0.02;
    private double defaultAverageLoss = -0.02;
}
