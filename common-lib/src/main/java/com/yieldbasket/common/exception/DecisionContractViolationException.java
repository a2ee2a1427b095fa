package com.yieldbasket.common.exception;

import com.yieldbasket.common.model.DecisionAction;

/** A decision maker proposed something other than HOLD while the risk gate vetoed. */
public class DecisionContractViolationException extends RuntimeException {
    private final DecisionAction proposed;

    public DecisionContractViolationException(DecisionAction proposed, String detail) {
        super("decision maker proposal " + proposed + " breaks the decision contract: " + detail);
        this.proposed = proposed;
    }

    public DecisionAction getProposed() {
        return proposed;
    }
}
