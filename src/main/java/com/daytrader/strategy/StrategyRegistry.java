package com.daytrader.strategy;

import com.daytrader.calendar.TradingCalendarService;
import com.daytrader.domain.enums.Phase;
import com.daytrader.exception.ConfigurationException;
import com.daytrader.exception.ResourceNotFoundException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the configured strategies once at startup and answers window questions for the
 * engine and the order manager.
 *
 * <p>Resolution maps each {@link StrategyDefinition#getKey()} to a {@link StrategyFactory} bean.
 * Startup fails with {@link ConfigurationException} when:
 * <ul>
 *   <li>a key has no factory, or two factories share a key</li>
 *   <li>an id is missing or used twice</li>
 *   <li>a window is empty, lies outside market hours, or overlaps another enabled window</li>
 * </ul>
 *
 * <p>Disabled definitions are skipped entirely. After construction the registry is immutable.
 */
@Component
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final TradingCalendarService tradingCalendarService;
    private final Map<String, RegisteredStrategy> strategiesById;

    public StrategyRegistry(
            StrategiesProperties strategiesProperties,
            List<StrategyFactory> strategyFactories,
            TradingCalendarService tradingCalendarService) {
        this.tradingCalendarService = tradingCalendarService;
        Map<String, StrategyFactory> factoriesByKey = indexFactories(strategyFactories);

        Map<String, RegisteredStrategy> resolved = new LinkedHashMap<>();
        for (StrategyDefinition definition : strategiesProperties.getStrategies()) {
            if (!definition.isEnabled()) {
                log.info("Strategy {} disabled, skipping", definition.getId());
                continue;
            }
            validateDefinition(definition, resolved);
            StrategyFactory factory = factoriesByKey.get(definition.getKey());
            if (factory == null) {
                throw new ConfigurationException(
                        "Unknown strategy key '" + definition.getKey() + "' for strategy " + definition.getId()
                                + ", known keys: " + factoriesByKey.keySet());
            }
            TradingStrategy strategy = factory.create(definition);
            resolved.put(definition.getId(), new RegisteredStrategy(definition, strategy));
            log.info(
                    "Strategy registered: id={}, key={}, window={}-{}, liquidationLead={}, holdOvernight={}",
                    definition.getId(),
                    definition.getKey(),
                    windowStartTime(definition),
                    windowEndTime(definition),
                    definition.getLiquidationLead(),
                    definition.isHoldOvernight());
        }
        validateNoOverlap(resolved.values());
        this.strategiesById = Collections.unmodifiableMap(resolved);
    }

    // ========================
    // LOOKUP
    // ========================

    public List<RegisteredStrategy> getStrategies() {
        return List.copyOf(strategiesById.values());
    }

    public RegisteredStrategy getOrThrow(String strategyId) {
        RegisteredStrategy registered = strategiesById.get(strategyId);
        if (registered == null) {
            throw new ResourceNotFoundException("Strategy", strategyId);
        }
        return registered;
    }

    public boolean isRegistered(String strategyId) {
        return strategiesById.containsKey(strategyId);
    }

    // ========================
    // WINDOWS
    // ========================

    public StrategyWindow windowFor(StrategyDefinition definition, LocalDate date) {
        LocalDateTime start = tradingCalendarService.atSessionTime(date, windowStartTime(definition));
        LocalDateTime end = tradingCalendarService.atSessionTime(date, windowEndTime(definition));
        LocalDateTime deadline = definition.isHoldOvernight() ? end : end.minus(definition.getLiquidationLead());
        return new StrategyWindow(start, end, deadline);
    }

    /** Strategies whose window accepts new entries at {@code now}. */
    public List<RegisteredStrategy> getStrategiesAcceptingEntries(LocalDateTime now) {
        return strategiesById.values().stream()
                .filter(r -> windowFor(r.definition(), now.toLocalDate()).acceptsEntries(now))
                .toList();
    }

    /**
     * Strategies whose positions must be flattened at {@code now}: past their liquidation
     * deadline today and not holding overnight.
     */
    public List<RegisteredStrategy> getStrategiesDueForLiquidation(LocalDateTime now) {
        return strategiesById.values().stream()
                .filter(r -> !r.definition().isHoldOvernight())
                .filter(r -> windowFor(r.definition(), now.toLocalDate()).isPastDeadline(now))
                .toList();
    }

    /** Ids of strategies whose positions are carried to the next session. */
    public List<String> getOvernightStrategyIds() {
        return strategiesById.values().stream()
                .filter(r -> r.definition().isHoldOvernight())
                .map(RegisteredStrategy::id)
                .toList();
    }

    /**
     * True if {@code strategyId} may open or close positions on its own initiative at {@code now}.
     */
    public boolean isEntryPermitted(String strategyId, LocalDateTime now) {
        RegisteredStrategy registered = strategiesById.get(strategyId);
        return registered != null
                && windowFor(registered.definition(), now.toLocalDate()).acceptsEntries(now);
    }

    private LocalTime windowStartTime(StrategyDefinition definition) {
        return definition.getStart() != null
                ? definition.getStart()
                : tradingCalendarService.phaseStartTime(definition.getPhase());
    }

    private LocalTime windowEndTime(StrategyDefinition definition) {
        return definition.getEnd() != null
                ? definition.getEnd()
                : tradingCalendarService.phaseEndTime(definition.getPhase());
    }

    // ========================
    // VALIDATION
    // ========================

    private Map<String, StrategyFactory> indexFactories(List<StrategyFactory> strategyFactories) {
        Map<String, StrategyFactory> factoriesByKey = new HashMap<>();
        for (StrategyFactory factory : strategyFactories) {
            StrategyFactory previous = factoriesByKey.put(factory.getKey(), factory);
            if (previous != null) {
                throw new ConfigurationException("Duplicate strategy factory key: " + factory.getKey());
            }
        }
        return factoriesByKey;
    }

    private void validateDefinition(StrategyDefinition definition, Map<String, RegisteredStrategy> resolved) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new ConfigurationException("Strategy with key '" + definition.getKey() + "' has no id");
        }
        if (resolved.containsKey(definition.getId())) {
            throw new ConfigurationException("Duplicate strategy id: " + definition.getId());
        }
        if (definition.getPhase() == null && (definition.getStart() == null || definition.getEnd() == null)) {
            throw new ConfigurationException(
                    "Strategy " + definition.getId() + " needs a phase or an explicit start and end");
        }
        if (definition.getPhase() != null && !definition.getPhase().isMarketOpen()) {
            throw new ConfigurationException(
                    "Strategy " + definition.getId() + " is assigned to non-trading phase " + definition.getPhase());
        }
        Duration lead = definition.getLiquidationLead();
        if (lead == null || lead.isNegative()) {
            throw new ConfigurationException("Strategy " + definition.getId() + " has an invalid liquidation lead");
        }

        LocalTime start = windowStartTime(definition);
        LocalTime end = windowEndTime(definition);
        LocalTime marketOpen = tradingCalendarService.phaseStartTime(Phase.OPENING);
        LocalTime marketClose = tradingCalendarService.phaseStartTime(Phase.POST_MARKET);
        if (!start.isBefore(end)) {
            throw new ConfigurationException(
                    "Strategy " + definition.getId() + " window is empty: " + start + "-" + end);
        }
        if (start.isBefore(marketOpen) || end.isAfter(marketClose)) {
            throw new ConfigurationException("Strategy " + definition.getId() + " window " + start + "-" + end
                    + " lies outside market hours " + marketOpen + "-" + marketClose);
        }
        if (!start.plus(lead).isBefore(end)) {
            throw new ConfigurationException(
                    "Strategy " + definition.getId() + " liquidation lead leaves no trading time");
        }
    }

    private void validateNoOverlap(Iterable<RegisteredStrategy> strategies) {
        List<RegisteredStrategy> checked = new ArrayList<>();
        for (RegisteredStrategy candidate : strategies) {
            LocalTime start = windowStartTime(candidate.definition());
            LocalTime end = windowEndTime(candidate.definition());
            for (RegisteredStrategy other : checked) {
                LocalTime otherStart = windowStartTime(other.definition());
                LocalTime otherEnd = windowEndTime(other.definition());
                if (start.isBefore(otherEnd) && otherStart.isBefore(end)) {
                    throw new ConfigurationException(String.format(
                            "Strategy windows overlap: %s [%s-%s) and %s [%s-%s)",
                            candidate.id(), start, end, other.id(), otherStart, otherEnd));
                }
            }
            checked.add(candidate);
        }
    }
}
