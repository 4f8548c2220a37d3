package com.daytrader.portfolio;

import com.daytrader.domain.model.Fill;
import java.math.BigDecimal;

/**
 * A fill folded into the ledger. For sells {@code averageCost} is the position's cost basis and
 * {@code realizedPnl} the gain against it; for buys realizedPnl is zero.
 */
public record AppliedFill(Fill fill, BigDecimal averageCost, BigDecimal realizedPnl) {}
