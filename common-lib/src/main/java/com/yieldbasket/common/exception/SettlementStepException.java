package com.yieldbasket.common.exception;

/** One settlement step failed; {@code step} names the state the job was trying to leave. */
public class SettlementStepException extends RuntimeException {
    private final String step;

    public SettlementStepException(String step, String message) {
        super("[" + step + "] " + message);
        this.step = step;
    }

    public SettlementStepException(String step, String message, Throwable cause) {
        super("[" + step + "] " + message, cause);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
