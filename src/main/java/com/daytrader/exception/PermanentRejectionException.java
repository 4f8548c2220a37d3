package com.daytrader.exception;

/**
 * The broker refused a request for a reason that will not change on retry
 * (unknown symbol, invalid quantity, account restriction). Never retried.
 */
public class PermanentRejectionException extends BaseException {

    public PermanentRejectionException(String message) {
        super(ErrorCode.PERMANENT_REJECTION, message);
    }
}
