package com.yieldbasket.common.exception;

/** Language-model output that does not match the expected structure. Never trusted as-is. */
public class MalformedModelOutputException extends RuntimeException {

    public MalformedModelOutputException(String message) {
        super(message);
    }

    public MalformedModelOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
