package com.yieldbasket.scheduler.model;

import com.yieldbasket.common.model.Decision;

/** Result of one scheduled cycle trigger as seen from the scheduler. */
public record CycleOutcome(Status status, Decision decision, String detail) {

    public enum Status {
        COMPLETED,
        /** Another cycle held the idempotency lock. */
        BUSY,
        FAILED
    }

    public static CycleOutcome completed(Decision decision) {
        return new CycleOutcome(Status.COMPLETED, decision, null);
    }

    public static CycleOutcome busy() {
        return new CycleOutcome(Status.BUSY, null, "cycle already in progress");
    }

    public static CycleOutcome failed(String detail) {
        return new CycleOutcome(Status.FAILED, null, detail);
    }
}
