package com.yieldbasket.settlement.exception;

/** A new bridge job was refused by a safety flag, the transfer ceiling or the trigger policy. */
public class TransferRejectedException extends RuntimeException {

    public TransferRejectedException(String message) {
        super(message);
    }
}
