package com.daytrader.domain.model;

import com.daytrader.domain.enums.Phase;
import com.daytrader.domain.enums.TickStatus;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of one engine tick, mainly for logging and tests.
 */
@Value
@Builder
public class TickResult {

    TickStatus status;

    /** Null unless status is ACTIVE or HALTED. */
    Phase phase;

    /** Liquidation signals first, then strategy signals, in submission order. */
    @Builder.Default
    List<Signal> submittedSignals = List.of();

    @Builder.Default
    List<String> evaluatedStrategies = List.of();

    int ordersAccepted;
    int ordersRejected;

    public static TickResult of(TickStatus status) {
        return TickResult.builder().status(status).build();
    }

    public static TickResult of(TickStatus status, Phase phase) {
        return TickResult.builder().status(status).phase(phase).build();
    }
}
