package com.daytrader.portfolio;

import com.daytrader.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the portfolio handed to strategies and the order manager.
 * Returned positions are copies; mutating them has no effect on the ledger.
 */
public interface PortfolioView {

    BigDecimal getCash();

    /** Cash minus the amount committed to open and in-flight buy orders. */
    BigDecimal getAvailableCash();

    Optional<Position> getPosition(String symbol);

    List<Position> getPositions();

    List<Position> getPositionsOwnedBy(String strategyId);

    /** Held quantity minus quantity already committed to open or in-flight sell orders. */
    int getAvailableQuantity(String symbol);

    /** True if an order for the pair is open at the broker or currently being submitted. */
    boolean hasOpenOrder(String strategyId, String symbol);
}
