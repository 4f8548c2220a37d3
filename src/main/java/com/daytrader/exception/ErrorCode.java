package com.daytrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the engine. The {@code fatal} flag marks errors that stop trading
 * (state corruption at runtime, configuration problems at startup).
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    TRANSIENT_API_FAILURE("TRANSIENT_API_FAILURE", false),
    PERMANENT_REJECTION("PERMANENT_REJECTION", false),
    VALIDATION_FAILURE("VALIDATION_FAILURE", false),
    RESOURCE_NOT_FOUND("RESOURCE_NOT_FOUND", false),
    STATE_CORRUPTION_RISK("STATE_CORRUPTION_RISK", true),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", true);

    private final String code;
    private final boolean fatal;
}
