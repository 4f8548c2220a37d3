package com.daytrader.portfolio;

import com.daytrader.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;

public record PortfolioSnapshot(BigDecimal cash, BigDecimal availableCash, List<Position> positions, int openOrders) {}
