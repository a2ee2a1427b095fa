package com.yieldbasket.history.exception;

/** The decision exists but cannot be scored yet, or ever (SKIPPED). */
public class ReflectionRejectedException extends RuntimeException {

    public ReflectionRejectedException(String message) {
        super(message);
    }
}
