package com.yieldbasket.scheduler.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/** One entry of settlement-service's pending-job sweep. States are kept as names. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepSummary(
    @JsonProperty("jobId") long jobId,
    @JsonProperty("fromState") String fromState,
    @JsonProperty("toState") String toState,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error
) {
    private static final Set<String> TERMINAL = Set.of("DEPOSITED", "FAILED", "CANCELLED");

    public boolean inFlight() {
        return toState != null && !TERMINAL.contains(toState);
    }
}
