package com.yieldbasket.settlement.exception;

/** The requested operation is not allowed in the job's current state. */
public class InvalidJobStateException extends RuntimeException {

    public InvalidJobStateException(String message) {
        super(message);
    }
}
