package com.yieldbasket.history.exception;

public class DecisionNotFoundException extends RuntimeException {

    public DecisionNotFoundException(String decisionId) {
        super("no decision recorded with id " + decisionId);
    }
}
