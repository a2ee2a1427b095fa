package com.yieldbasket.common.exception;

/** Reward arithmetic left its representable range. The operation must abort without mutating state. */
public class AccumulatorOverflowException extends RuntimeException {

    public AccumulatorOverflowException(String message) {
        super(message);
    }

    public AccumulatorOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
