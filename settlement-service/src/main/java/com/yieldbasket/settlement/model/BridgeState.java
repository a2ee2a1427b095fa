package com.yieldbasket.settlement.model;

/**
 * Settlement job states in the order a job moves through them.
 * {@code FAILED} and {@code CANCELLED} are the absorbing exits.
 */
public enum BridgeState {
    READY,
    SOURCE_LOCKED,
    SOURCE_CONFIRMED,
    ATTESTATION_PENDING,
    ATTESTATION_RECEIVED,
    DEST_MINTED,
    DEPOSITED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DEPOSITED || this == FAILED || this == CANCELLED;
    }

    /** Successor on the happy path. */
    public BridgeState next() {
        return switch (this) {
            case READY                -> SOURCE_LOCKED;
            case SOURCE_LOCKED        -> SOURCE_CONFIRMED;
            case SOURCE_CONFIRMED     -> ATTESTATION_PENDING;
            case ATTESTATION_PENDING  -> ATTESTATION_RECEIVED;
            case ATTESTATION_RECEIVED -> DEST_MINTED;
            case DEST_MINTED          -> DEPOSITED;
            default -> throw new IllegalStateException(this + " has no successor");
        };
    }
}
