package com.daytrader.sizing;

import com.daytrader.domain.model.Signal;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Inputs to a sizing decision for one buy signal.
 *
 * @param estimatedPrice price used for the cash check, before the slippage buffer
 * @param availableCash cash not yet committed to open or in-flight buys
 * @param tradingDate the trading day the order is placed on
 */
public record SizingContext(
        Signal signal, BigDecimal estimatedPrice, BigDecimal availableCash, LocalDate tradingDate) {}
