package com.yieldbasket.common.exception;

/** Another attempt at the same logical operation holds the idempotency lock. */
public class CycleInProgressException extends RuntimeException {
    private final String operationKey;

    public CycleInProgressException(String operationKey) {
        super("operation already in progress: " + operationKey);
        this.operationKey = operationKey;
    }

    public String getOperationKey() {
        return operationKey;
    }
}
