package com.yieldbasket.common.exception;

import com.yieldbasket.common.model.ProducerKind;

/** A report producer timed out, returned malformed output or failed internally. */
public class ProducerFailureException extends RuntimeException {
    private final ProducerKind producer;

    public ProducerFailureException(ProducerKind producer, String message) {
        super("[" + producer + "] " + message);
        this.producer = producer;
    }

    public ProducerFailureException(ProducerKind producer, String message, Throwable cause) {
        super("[" + producer + "] " + message, cause);
        this.producer = producer;
    }

    public ProducerKind getProducer() {
        return producer;
    }
}
