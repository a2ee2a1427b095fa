package com.yieldbasket.settlement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of one trigger evaluation. {@code jobId} is set only when a job was created. */
public record TriggerResult(
    @JsonProperty("triggered") boolean triggered,
    @JsonProperty("jobId") Long jobId,
    @JsonProperty("amountRaw") long amountRaw,
    @JsonProperty("detail") String detail
) {
    public static TriggerResult skipped(String detail) {
        return new TriggerResult(false, null, 0L, detail);
    }

    public static TriggerResult created(BridgeJob job, String detail) {
        return new TriggerResult(true, job.getId(), job.getAmountRaw(), detail);
    }
}
