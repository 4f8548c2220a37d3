package com.daytrader.exception;

/**
 * A broker call failed in a way that may succeed when repeated (timeout, connection reset,
 * rate limit). Thrown by broker clients per attempt, and by the retry wrapper once all
 * attempts are exhausted.
 */
public class TransientApiFailureException extends BaseException {

    public TransientApiFailureException(String message) {
        super(ErrorCode.TRANSIENT_API_FAILURE, message);
    }

    public TransientApiFailureException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_API_FAILURE, message, cause);
    }
}
