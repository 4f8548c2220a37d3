package com.daytrader.exception;

import java.util.Map;

/**
 * A ledger invariant would be violated (negative cash, negative quantity, over-filled order).
 * Halts trading for the rest of the day.
 */
public class StateCorruptionException extends BaseException {

    public StateCorruptionException(String message, Map<String, Object> details) {
        super(ErrorCode.STATE_CORRUPTION_RISK, message, details);
    }
}
