package com.daytrader.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A held quantity of one symbol. Owned by the portfolio ledger and mutated only by fills;
 * quantity is never negative and a zero-quantity position is removed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    /** Pseudo-owner of positions reconstructed from the broker at startup. */
    public static final String STARTUP_OWNER = "loaded_on_startup";

    private String symbol;
    private int quantity;
    private BigDecimal averageCost;
    private String owningStrategyId;

    public Position copy() {
        return new Position(symbol, quantity, averageCost, owningStrategyId);
    }
}
