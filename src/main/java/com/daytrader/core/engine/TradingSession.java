package com.daytrader.core.engine;

import com.daytrader.domain.enums.Phase;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one trading day, owned by the {@link TradingEngine}.
 *
 * <p>The "ran today" flags live here rather than in the engine so that a new date always
 * starts from a clean object. Phase and liquidation state are only written by the engine's
 * tick thread. {@link TradingEngine#halt(String)} may run on the thread that detected a
 * corruption, so the halt flag and the last phase are volatile.
 */
public class TradingSession {

    private final LocalDate tradingDate;
    private final List<PhaseChange> phaseHistory = new ArrayList<>();

    /** Symbol to owner of positions held when the market opened, still to be sold. */
    private final Map<String, String> carriedPositions = new LinkedHashMap<>();

    private volatile Phase lastPhase;
    private boolean openingLiquidationDone;
    private boolean postMarketDone;
    private volatile boolean halted;

    public TradingSession(LocalDate tradingDate) {
        this.tradingDate = tradingDate;
    }

    /**
     * Records {@code phase} as current.
     *
     * @return true if it differs from the previous tick's phase
     */
    boolean enterPhase(Phase phase, LocalDateTime at) {
        if (phase == lastPhase) {
            return false;
        }
        phaseHistory.add(new PhaseChange(lastPhase, phase, at));
        lastPhase = phase;
        return true;
    }

    /** True if {@code phase} comes before a phase already entered today. */
    boolean isBehind(Phase phase) {
        return lastPhase != null && phase.ordinal() < lastPhase.ordinal();
    }

    void carryPosition(String symbol, String owner) {
        carriedPositions.put(symbol, owner);
    }

    void clearCarriedPosition(String symbol) {
        carriedPositions.remove(symbol);
    }

    void markOpeningLiquidationDone() {
        openingLiquidationDone = true;
    }

    void markPostMarketDone() {
        postMarketDone = true;
    }

    void markHalted() {
        halted = true;
    }

    public LocalDate getTradingDate() {
        return tradingDate;
    }

    public Phase getLastPhase() {
        return lastPhase;
    }

    public List<PhaseChange> getPhaseHistory() {
        return Collections.unmodifiableList(phaseHistory);
    }

    public Map<String, String> getCarriedPositions() {
        return Collections.unmodifiableMap(carriedPositions);
    }

    public boolean isOpeningLiquidationDone() {
        return openingLiquidationDone;
    }

    public boolean isPostMarketDone() {
        return postMarketDone;
    }

    public boolean isHalted() {
        return halted;
    }

    public record PhaseChange(Phase from, Phase to, LocalDateTime at) {}
}
