package com.yieldbasket.settlement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of advancing one job by one step. */
public record StepResult(
    @JsonProperty("jobId") long jobId,
    @JsonProperty("fromState") BridgeState fromState,
    @JsonProperty("toState") BridgeState toState,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error
) {
    public static StepResult of(BridgeState from, BridgeJob after) {
        boolean ok = after.getState() != BridgeState.FAILED;
        return new StepResult(after.getId(), from, after.getState(), ok, ok ? null : after.getError());
    }
}
