package com.yieldbasket.common.exception;

/** A decision could not be written to the history store after every save attempt. */
public class DecisionNotRecordedException extends RuntimeException {
    private final String decisionId;

    public DecisionNotRecordedException(String decisionId, String message, Throwable cause) {
        super(message, cause);
        this.decisionId = decisionId;
    }

    public String getDecisionId() {
        return decisionId;
    }
}
