package com.daytrader.strategy;

import com.daytrader.domain.enums.Phase;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * One entry of {@code daytrader.strategies[]}.
 *
 * <p>The window is the strategy's phase unless {@code start}/{@code end} narrow it. New entries
 * are allowed until {@code end - liquidationLead}; from then on the engine liquidates the
 * strategy's positions, unless {@code holdOvernight} is set, in which case they are carried and
 * sold at the next market open.
 */
@Data
public class StrategyDefinition {

    /** Registry key of the {@link StrategyFactory}. */
    private String key;

    /** Unique id; positions and orders are attributed to it. */
    private String id;

    private boolean enabled = true;

    private Phase phase;

    private LocalTime start;

    private LocalTime end;

    private Duration liquidationLead = Duration.ofMinutes(1);

    private boolean holdOvernight = false;

    private List<String> symbols = new ArrayList<>();

    private Map<String, String> params = new HashMap<>();

    public String param(String name, String defaultValue) {
        return params.getOrDefault(name, defaultValue);
    }
}
